package com.initialone.typerename.resolve;

import com.initialone.typerename.bind.Bindings;
import com.initialone.typerename.bind.FieldType;
import com.initialone.typerename.bind.TypeBinding;
import com.initialone.typerename.bind.TypeNames;
import com.initialone.typerename.bind.TypeTable;
import com.initialone.typerename.lex.CKeywords;
import com.initialone.typerename.lex.SignificantTokens;
import com.initialone.typerename.model.TypeRef;

import java.util.Map;

/**
 * 成员访问 base.member / base-&gt;member 中 base 的静态类型。
 *
 * 只根据声明事实推断：变量绑定、成员链、下标、解引用、强制转换、
 * 复合字面量、白名单里的构造函数调用、指定初始化器。推不出来就返回 null，从不按成员名猜。
 */
public final class TypeResolver {
    private final SignificantTokens st;
    private final Bindings bindings;
    private final TypeTable types;
    private final Map<String, TypeRef> constructors;

    /**
     * @param constructors 构造函数白名单：函数名 -&gt; 返回类型；值为 null 时取本单元声明的返回类型
     */
    public TypeResolver(Bindings bindings, Map<String, TypeRef> constructors) {
        this.st = bindings.tokens();
        this.bindings = bindings;
        this.types = bindings.types();
        this.constructors = constructors;
    }

    /**
     * 位于 opPos 的 '.' 或 '-&gt;' 所访问的 struct/union 的规范名；推不出时返回 null。
     */
    public String ownerOf(int opPos) {
        return ownerName(baseTypeOf(opPos), st.text(opPos));
    }

    /** opPos 处运算符左侧表达式的类型（未做 typedef 展开）。 */
    public TypeRef baseTypeOf(int opPos) {
        if (isDesignator(opPos)) return designatorOwner(opPos);
        Resolved r = postfix(opPos - 1);
        return r == null ? null : r.type;
    }

    /** '.' 要求 0 层指针，'-&gt;' 要求 1 层；内建类型不能作为 owner。 */
    public String ownerName(TypeRef type, String op) {
        TypeRef c = types.canonical(type);
        if (c == null || CKeywords.BUILTIN_TYPES.contains(c.getName())) return null;
        if (op.equals(".") && c.getDepth() == 0) return c.getName();
        if (op.equals("->") && c.getDepth() == 1) return c.getName();
        return null;
    }

    /* ======================= 后缀表达式（自右向左） ======================= */

    private static final class Resolved {
        final TypeRef type;
        final int start;

        Resolved(TypeRef type, int start) {
            this.type = type;
            this.start = start;
        }
    }

    /** 以 end 结尾的后缀表达式的类型及其起点。 */
    private Resolved postfix(int end) {
        if (end < 0) return null;

        if (st.isName(end)) {
            String name = st.text(end);
            if (st.is(end - 1, ".") || st.is(end - 1, "->")) {
                int op = end - 1;
                // 左侧只推一次：类型和起点都从同一个结果里取
                Resolved base = isDesignator(op) ? new Resolved(designatorOwner(op), op) : postfix(op - 1);
                if (base == null) return null;
                String owner = ownerName(base.type, st.text(op));
                if (owner == null) return null;
                FieldType f = types.field(owner, name);
                if (f == null || f.getType() == null) return null;
                return new Resolved(f.getType(), base.start);
            }
            TypeBinding b = bindings.lookup(name, end);
            if (b == null || b.getType() == null) return null;
            return new Resolved(b.getType(), end);
        }

        if (st.is(end, "]")) {
            int open = st.matching(end);
            if (open <= 0) return null;
            Resolved base = postfix(open - 1);
            if (base == null) return null;
            TypeRef element = types.canonical(base.type);
            element = element == null ? null : element.deref();
            return element == null ? null : new Resolved(element, base.start);
        }

        if (st.is(end, ")")) {
            int open = st.matching(end);
            if (open < 0) return null;
            int before = open - 1;
            if (st.isName(before)) {
                // 函数调用；经由成员的调用（函数指针）不推断
                if (st.is(before - 1, ".") || st.is(before - 1, "->")) return null;
                TypeRef ret = constructorReturn(st.text(before));
                return ret == null ? null : new Resolved(ret, before);
            }
            if ((st.is(before, ")") && !isCastBefore(before)) || st.is(before, "]")) {
                return null;
            }
            TypeRef inner = expression(open + 1, end - 1);
            return inner == null ? null : new Resolved(inner, open);
        }

        if (st.is(end, "}")) {
            // 复合字面量 (Type){ ... }
            int open = st.matching(end);
            TypeRef type = open < 0 ? null : bindings.initializerType(open);
            if (type == null || !st.is(open - 1, ")")) return null;
            return new Resolved(type, st.matching(open - 1));
        }
        return null;
    }

    /** 闭区间 [from, to] 作为一个完整一元表达式时的类型。 */
    private TypeRef expression(int from, int to) {
        if (from > to) return null;
        if (st.is(from, "(")) {
            int close = st.matching(from);
            if (close > from && close < to) {
                TypeRef cast = TypeNames.parse(st, types, from + 1, close - 1);
                if (cast != null) return cast;
            }
        }
        if (st.is(from, "*")) {
            TypeRef inner = types.canonical(expression(from + 1, to));
            return inner == null ? null : inner.deref();
        }
        if (st.is(from, "&")) {
            TypeRef inner = types.canonical(expression(from + 1, to));
            return inner == null ? null : inner.addressOf();
        }
        Resolved r = postfix(to);
        return r != null && r.start == from ? r.type : null;
    }

    /** before 是 ')'，判断它闭合的是不是一个强制转换 (Type)。 */
    private boolean isCastBefore(int before) {
        int open = st.matching(before);
        return open >= 0 && TypeNames.parse(st, types, open + 1, before - 1) != null;
    }

    private TypeRef constructorReturn(String function) {
        if (!constructors.containsKey(function)) return null;
        TypeRef declared = constructors.get(function);
        return declared != null ? declared : types.functionReturn(function);
    }

    /* ======================= 指定初始化器 ======================= */

    /** { .n = 1 }、{ x, .n = 1 }、[2].n = 1 里的 '.' */
    private boolean isDesignator(int opPos) {
        if (!st.is(opPos, ".")) return false;
        int prev = opPos - 1;
        if (st.is(prev, "{") || st.is(prev, ",")) return true;
        if (st.is(prev, "]")) {
            int open = st.matching(prev);
            return open > 0 && (st.is(open - 1, "{") || st.is(open - 1, ","));
        }
        return false;
    }

    /** 指定初始化器所在花括号初始化的 struct 类型。 */
    private TypeRef designatorOwner(int dotPos) {
        int prev = dotPos - 1;
        if (st.is(prev, "]")) {
            // [i].n：先取数组元素类型
            int open = st.matching(prev);
            TypeRef array = types.canonical(braceType(enclosingBrace(open)));
            return array == null ? null : array.deref();
        }
        return braceType(enclosingBrace(dotPos));
    }

    /** 包住 p 的最近一层 '{'；不在花括号内返回 -1。 */
    private int enclosingBrace(int p) {
        int q = p - 1;
        while (q >= 0) {
            if (st.is(q, ")") || st.is(q, "]") || st.is(q, "}")) {
                int open = st.matching(q);
                if (open < 0) return -1;
                q = open - 1;
                continue;
            }
            if (st.is(q, "(") || st.is(q, "[")) return -1;
            if (st.is(q, "{")) return q;
            q--;
        }
        return -1;
    }

    /** 初始化花括号的类型：声明/复合字面量直接记录，嵌套的按外层推。 */
    private TypeRef braceType(int brace) {
        if (brace < 0) return null;
        TypeRef recorded = bindings.initializerType(brace);
        if (recorded != null) return recorded;

        int prev = brace - 1;
        if (st.is(prev, "=")) {
            // .field = { ... }
            if (st.isName(prev - 1) && st.is(prev - 2, ".") && isDesignator(prev - 2)) {
                TypeRef owner = types.canonical(designatorOwner(prev - 2));
                if (owner == null || owner.getDepth() != 0) return null;
                FieldType f = types.field(owner.getName(), st.text(prev - 1));
                return f == null ? null : f.getType();
            }
            // [i] = { ... }
            if (st.is(prev - 1, "]")) {
                int open = st.matching(prev - 1);
                if (open < 0) return null;
                TypeRef array = types.canonical(braceType(enclosingBrace(open)));
                return array == null ? null : array.deref();
            }
            return null;
        }
        if (st.is(prev, "{") || st.is(prev, ",")) {
            // 数组初始化里的一个元素
            TypeRef outer = types.canonical(braceType(enclosingBrace(brace)));
            return outer == null ? null : outer.deref();
        }
        return null;
    }
}
