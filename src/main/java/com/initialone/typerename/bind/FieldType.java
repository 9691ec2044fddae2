package com.initialone.typerename.bind;

import com.initialone.typerename.model.TypeRef;

/** struct/union 成员的声明类型；type 为 null 表示函数指针等无法继续链式推断的成员。 */
public final class FieldType {
    private final String structName;
    private final String fieldName;
    private final TypeRef type;
    private final int position;

    public FieldType(String structName, String fieldName, TypeRef type, int position) {
        this.structName = structName;
        this.fieldName = fieldName;
        this.type = type;
        this.position = position;
    }

    public String getStructName() { return structName; }

    public String getFieldName() { return fieldName; }

    public TypeRef getType() { return type; }

    public int getPosition() { return position; }

    @Override
    public String toString() {
        return structName + "." + fieldName + ": " + (type == null ? "?" : type);
    }
}
