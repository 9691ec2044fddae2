package com.initialone.typerename.bind;

import com.initialone.typerename.lex.SignificantTokens;
import com.initialone.typerename.model.TypeRef;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * 一次绑定的结果：作用域树、各声明位置、成员类型表、初始化花括号的类型。
 * 构建完成后只读，改写阶段按位置查询。
 */
public final class Bindings {
    private final SignificantTokens tokens;
    private final TypeTable types;
    private final List<Scope> scopes;
    private final int[] scopeAt;
    private final Map<Integer, TypeBinding> bindingDecls;
    private final Map<Integer, FieldType> fieldDecls;
    private final Map<Integer, TypeRef> initializerTypes;

    Bindings(SignificantTokens tokens, TypeTable types, List<Scope> scopes, int[] scopeAt,
             Map<Integer, TypeBinding> bindingDecls, Map<Integer, FieldType> fieldDecls,
             Map<Integer, TypeRef> initializerTypes) {
        this.tokens = tokens;
        this.types = types;
        this.scopes = Collections.unmodifiableList(scopes);
        this.scopeAt = scopeAt;
        this.bindingDecls = Collections.unmodifiableMap(bindingDecls);
        this.fieldDecls = Collections.unmodifiableMap(fieldDecls);
        this.initializerTypes = Collections.unmodifiableMap(initializerTypes);
    }

    public SignificantTokens tokens() {
        return tokens;
    }

    public TypeTable types() {
        return types;
    }

    public List<Scope> scopes() {
        return scopes;
    }

    /** position 处最内层的作用域 */
    public Scope scopeAt(int position) {
        if (position < 0 || position >= scopeAt.length) return scopes.get(0);
        return scopes.get(scopeAt[position]);
    }

    /** 由内向外查找在 position 处可见的同名声明。 */
    public TypeBinding lookup(String name, int position) {
        for (Scope s = scopeAt(position); s != null; s = s.getParent()) {
            TypeBinding b = s.find(name, position);
            if (b != null) return b;
        }
        return null;
    }

    /** position 处的标识符若是变量/参数的声明名，返回该声明。 */
    public TypeBinding bindingDeclaredAt(int position) {
        return bindingDecls.get(position);
    }

    /** position 处的标识符若是 struct/union 成员的声明名，返回该成员。 */
    public FieldType fieldDeclaredAt(int position) {
        return fieldDecls.get(position);
    }

    /** 以 position 处 '{' 开始的初始化列表的类型（声明初始化或复合字面量）。 */
    public TypeRef initializerType(int bracePosition) {
        return initializerTypes.get(bracePosition);
    }

    public int bindingCount() {
        return bindingDecls.size();
    }
}
