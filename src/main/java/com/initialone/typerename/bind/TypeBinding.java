package com.initialone.typerename.bind;

import com.initialone.typerename.model.TypeRef;

/**
 * 局部变量、参数或全局变量的声明事实。type 为 null 表示声明存在但类型不可用
 * （函数指针、typeof 等），它仍然会遮蔽外层同名绑定。
 */
public final class TypeBinding {
    private final String name;
    private final int scopeId;
    private final TypeRef type;
    private final int position;
    private final String function;

    public TypeBinding(String name, int scopeId, TypeRef type, int position, String function) {
        this.name = name;
        this.scopeId = scopeId;
        this.type = type;
        this.position = position;
        this.function = function;
    }

    public String getName() { return name; }

    public int getScopeId() { return scopeId; }

    public TypeRef getType() { return type; }

    /** 声明处标识符的位置 */
    public int getPosition() { return position; }

    /** 所在函数名；文件作用域为 null */
    public String getFunction() { return function; }

    @Override
    public String toString() {
        return name + ": " + (type == null ? "?" : type) + " @scope" + scopeId;
    }
}
