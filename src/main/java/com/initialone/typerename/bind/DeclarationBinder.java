package com.initialone.typerename.bind;

import com.initialone.typerename.lex.CKeywords;
import com.initialone.typerename.lex.SignificantTokens;
import com.initialone.typerename.lex.Token;
import com.initialone.typerename.model.TypeRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 单次前向扫描，记录声明事实：
 * - 块内的局部声明  Type *name / Type name
 * - 函数定义的参数
 * - struct/union 成员（按 tag 名；匿名结构按 typedef 名）
 * - typedef 别名、函数返回类型、初始化花括号的类型
 *
 * 不是完整的 C 语法分析：声明只在语句开头识别，认不出的一律当作表达式跳过。
 */
public final class DeclarationBinder {
    private static final Logger log = LoggerFactory.getLogger(DeclarationBinder.class);

    private final SignificantTokens st;
    private final TypeTable types = new TypeTable();
    private final List<Scope> scopes = new ArrayList<>();
    private final Map<Integer, TypeBinding> bindingDecls = new HashMap<>();
    private final Map<Integer, FieldType> fieldDecls = new HashMap<>();
    private final Map<Integer, TypeRef> initializerTypes = new HashMap<>();

    public DeclarationBinder(SignificantTokens st) {
        this.st = st;
    }

    public Bindings bind() {
        Scope file = newScope(Scope.Kind.FILE, null, 0, st.size() - 1, null);
        walkBlock(0, st.size(), file);
        types.freeze();

        int[] scopeAt = new int[st.size()];
        // 作用域按创建顺序（外层先于内层）覆盖
        for (Scope s : scopes) {
            if (s.getKind() == Scope.Kind.FILE) continue;
            int from = Math.max(0, s.getStart());
            int to = Math.min(st.size() - 1, s.getEnd());
            for (int i = from; i <= to; i++) scopeAt[i] = s.getId();
        }
        log.debug("bound {} scopes, {} declarations, {} records", scopes.size(), bindingDecls.size(), types.recordCount());
        return new Bindings(st, types, scopes, scopeAt, bindingDecls, fieldDecls, initializerTypes);
    }

    /* ======================= 语句层 ======================= */

    /** 遍历 [from, to) 内的语句序列。 */
    private void walkBlock(int from, int to, Scope scope) {
        int p = from;
        boolean stmtStart = true;
        int ternary = 0;
        while (p < to) {
            if (stmtStart) {
                int q = tryDeclaration(p, to, scope);
                if (q > p) {
                    p = q;
                    stmtStart = st.is(q - 1, ";") || st.is(q - 1, "}");
                    ternary = 0;
                    continue;
                }
            }

            if (st.is(p, "{")) {
                int close = st.matching(p);
                if (close < 0 || close >= to) {
                    p++;
                    stmtStart = true;
                    continue;
                }
                Scope block = newScope(Scope.Kind.BLOCK, scope, p, close, scope.getFunctionName());
                walkBlock(p + 1, close, block);
                p = close + 1;
                stmtStart = true;
                ternary = 0;
                continue;
            }
            if (st.is(p, "(")) {
                int brace = recordCompoundLiteral(p);
                if (brace >= 0) {
                    int close = st.matching(brace);
                    walkExpression(brace + 1, close, scope);
                    p = close + 1;
                    stmtStart = false;
                    continue;
                }
            }
            if (st.isIdentifier(p) && st.text(p).equals("for") && st.is(p + 1, "(")) {
                p = forStatement(p, to, scope);
                stmtStart = true;
                ternary = 0;
                continue;
            }
            if (st.is(p, ";") || st.is(p, "}")) {
                stmtStart = true;
                ternary = 0;
                p++;
                continue;
            }
            if (st.is(p, "?")) {
                ternary++;
            } else if (st.is(p, ":")) {
                // 条件表达式的 ':' 不开启新语句；标号和 case 才开启
                if (ternary > 0) {
                    ternary--;
                } else {
                    stmtStart = true;
                    p++;
                    continue;
                }
            }
            stmtStart = false;
            p++;
        }
    }

    /** for ( init; cond; step ) body：init 声明只在头部和循环体内可见。 */
    private int forStatement(int p, int to, Scope scope) {
        int open = p + 1;
        int close = st.matching(open);
        if (close < 0 || close >= to) return p + 1;
        int bodyEnd = statementEnd(close + 1, to);
        Scope loop = newScope(Scope.Kind.FOR, scope, open, bodyEnd, scope.getFunctionName());
        int q = tryDeclaration(open + 1, close, loop);
        walkExpression(q, close, loop);
        walkBlock(close + 1, bodyEnd + 1, loop);
        return bodyEnd + 1;
    }

    /** 从 p 开始的一条语句的最后一个位置。 */
    private int statementEnd(int p, int to) {
        if (p >= to) return to - 1;
        if (st.is(p, "{")) {
            int close = st.matching(p);
            return close >= 0 ? close : to - 1;
        }
        String word = st.isIdentifier(p) ? st.text(p) : "";
        switch (word) {
            case "if":
            case "while":
            case "for":
            case "switch": {
                int close = st.matching(p + 1);
                if (!st.is(p + 1, "(") || close < 0) break;
                int end = statementEnd(close + 1, to);
                if (word.equals("if") && st.isIdentifier(end + 1) && st.text(end + 1).equals("else")) {
                    return statementEnd(end + 2, to);
                }
                return end;
            }
            case "do": {
                int end = statementEnd(p + 1, to);
                int w = end + 1;
                if (st.isIdentifier(w) && st.text(w).equals("while") && st.is(w + 1, "(")) {
                    int close = st.matching(w + 1);
                    if (close >= 0 && st.is(close + 1, ";")) return close + 1;
                }
                return end;
            }
            default:
                break;
        }
        int q = p;
        while (q < to && !st.is(q, ";")) q = skipGroup(q);
        return Math.min(q, to - 1);
    }

    /** 表达式区间：只关心复合字面量和 GNU 语句表达式。 */
    private void walkExpression(int from, int to, Scope scope) {
        int p = from;
        while (p < to) {
            if (st.is(p, "(")) {
                if (st.is(p + 1, "{")) {
                    int close = st.matching(p + 1);
                    if (close > 0 && close < to) {
                        Scope block = newScope(Scope.Kind.BLOCK, scope, p + 1, close, scope.getFunctionName());
                        walkBlock(p + 2, close, block);
                        p = close + 1;
                        continue;
                    }
                }
                int brace = recordCompoundLiteral(p);
                if (brace >= 0) {
                    p = brace + 1;
                    continue;
                }
            }
            p++;
        }
    }

    /** (Type){ ... }：记录花括号的类型，返回 '{' 的位置；不是复合字面量返回 -1。 */
    private int recordCompoundLiteral(int open) {
        int close = st.matching(open);
        if (close < 0 || !st.is(close + 1, "{") || st.matching(close + 1) < 0) return -1;
        TypeRef type = TypeNames.parse(st, types, open + 1, close - 1);
        if (type == null) return -1;
        initializerTypes.put(close + 1, type);
        return close + 1;
    }

    /* ======================= 声明 ======================= */

    /**
     * 尝试把 p 处当作一条声明解析；成功时返回声明之后的位置，否则返回 p。
     */
    private int tryDeclaration(int p, int to, Scope scope) {
        Specifiers spec = parseSpecifiers(p, to, scope);
        if (spec == null) return p;
        int q = spec.end;
        if (st.is(q, ";")) {
            // 只有类型定义：struct Foo { ... };
            if (spec.anonymous != null) commitAnonymous(spec, spec.typeName);
            return q + 1;
        }

        boolean first = true;
        while (q < to) {
            Declarator d = parseDeclarator(q, to);
            if (d == null || (d.end == q && d.name == null)) break;
            if (first && spec.anonymous != null) {
                boolean namesRecord = spec.typedef && d.depth == 0 && !d.function && !d.opaque && d.name != null;
                commitAnonymous(spec, namesRecord ? d.name : spec.typeName);
            }
            first = false;
            if (d.name != null) declare(spec, d, scope);
            q = d.end;

            if (d.function && st.is(q, "{") && scope.getKind() == Scope.Kind.FILE && !spec.typedef) {
                return functionDefinition(d, q, scope);
            }
            if (st.is(q, "=")) {
                int end = initializerEnd(q + 1, to);
                if (st.is(q + 1, "{") && spec.typeName != null && !d.opaque) {
                    initializerTypes.put(q + 1, new TypeRef(spec.typeName, d.depth));
                }
                walkExpression(q + 1, end, scope);
                q = end;
            }
            if (st.is(q, ",")) {
                q++;
                continue;
            }
            if (st.is(q, ";")) return q + 1;
            break;
        }
        if (spec.anonymous != null) commitAnonymous(spec, spec.typeName);
        return Math.max(q, p + 1);
    }

    private void declare(Specifiers spec, Declarator d, Scope scope) {
        if (spec.typedef) {
            if (spec.typeName == null || d.opaque || d.function) {
                types.defineAlias(d.name, null);
            } else if (!d.name.equals(spec.typeName) || d.depth != 0) {
                types.defineAlias(d.name, new TypeRef(spec.typeName, d.depth));
            } else {
                types.defineAlias(d.name, new TypeRef(d.name, 0));
            }
            return;
        }
        if (d.function) {
            if (spec.typeName != null) types.defineFunction(d.name, new TypeRef(spec.typeName, d.depth));
            return;
        }
        TypeRef type = spec.typeName == null || d.opaque ? null : new TypeRef(spec.typeName, d.depth);
        bindVariable(d.name, type, d.namePos, scope);
    }

    private int functionDefinition(Declarator d, int bodyOpen, Scope scope) {
        int bodyClose = st.matching(bodyOpen);
        if (bodyClose < 0) return bodyOpen + 1;
        Scope fn = newScope(Scope.Kind.FUNCTION, scope, d.paramOpen, bodyClose, d.name);
        bindParameters(d.paramOpen, d.paramClose, fn);
        walkBlock(bodyOpen + 1, bodyClose, fn);
        return bodyClose + 1;
    }

    private void bindParameters(int open, int close, Scope fn) {
        int seg = open + 1;
        while (seg < close) {
            int segEnd = seg;
            while (segEnd < close && !st.is(segEnd, ",")) segEnd = skipGroup(segEnd);
            bindParameter(seg, Math.min(segEnd, close), fn);
            seg = segEnd + 1;
        }
    }

    private void bindParameter(int from, int to, Scope fn) {
        if (from >= to || st.is(from, "...")) return;
        Specifiers spec = parseSpecifiers(from, to, fn);
        if (spec == null) return;
        if (spec.anonymous != null) commitAnonymous(spec, spec.typeName);
        Declarator d = parseDeclarator(spec.end, to);
        if (d == null || d.name == null) return;
        TypeRef type = spec.typeName == null || d.opaque || d.function ? null : new TypeRef(spec.typeName, d.depth);
        bindVariable(d.name, type, d.namePos, fn);
    }

    private void bindVariable(String name, TypeRef type, int position, Scope scope) {
        TypeBinding b = new TypeBinding(name, scope.getId(), type, position, scope.getFunctionName());
        scope.add(b);
        bindingDecls.put(position, b);
    }

    /* ======================= 类型说明符 ======================= */

    private static final class Specifiers {
        String typeName;
        boolean typedef;
        int end;
        // 匿名 struct/union 的成员，等声明符出现后再决定记录名
        List<PendingField> anonymous;
    }

    private static final class PendingField {
        final String name;
        final TypeRef type;
        final int position;

        PendingField(String name, TypeRef type, int position) {
            this.name = name;
            this.type = type;
            this.position = position;
        }
    }

    private Specifiers parseSpecifiers(int p, int to, Scope scope) {
        Specifiers spec = new Specifiers();
        int q = p;
        boolean sawType = false;
        while (q < to && st.isIdentifier(q)) {
            String word = st.text(q);
            if (word.equals("typedef")) {
                spec.typedef = true;
                q++;
                continue;
            }
            if (CKeywords.QUALIFIERS.contains(word)) {
                q++;
                continue;
            }
            if (CKeywords.ATTRIBUTES.contains(word)) {
                q = skipParenGroup(q + 1);
                continue;
            }
            if (CKeywords.BUILTIN_TYPES.contains(word)) {
                if (sawType && !isBuiltin(spec.typeName)) break;
                sawType = true;
                if (spec.typeName == null) spec.typeName = word;
                q++;
                continue;
            }
            if (word.equals("typeof") || word.equals("__typeof__")) {
                if (sawType) break;
                sawType = true;
                spec.typeName = null;
                q = skipParenGroup(q + 1);
                continue;
            }
            if (CKeywords.TAGS.contains(word)) {
                if (sawType) break;
                sawType = true;
                int r = skipAttributes(q + 1);
                String tag = null;
                if (st.isName(r)) {
                    tag = st.text(r);
                    r++;
                }
                r = skipAttributes(r);
                if (st.is(r, "{")) {
                    int close = st.matching(r);
                    if (close < 0) return null;
                    if (word.equals("enum")) {
                        spec.typeName = tag != null ? tag : syntheticName(word, r);
                    } else {
                        List<PendingField> body = parseRecordBody(r, close, scope);
                        if (tag != null) {
                            commit(tag, body);
                            spec.typeName = tag;
                        } else {
                            spec.anonymous = body;
                            spec.typeName = syntheticName(word, r);
                        }
                    }
                    q = close + 1;
                } else {
                    if (tag == null) return null;
                    spec.typeName = tag;
                    q = r;
                }
                continue;
            }
            // 普通标识符：已知 typedef 名，或按形状判断的未知类型名
            if (sawType || CKeywords.isKeyword(word)) break;
            if (types.isTypedefName(word) || looksLikeDeclaration(q, to)) {
                sawType = true;
                spec.typeName = word;
                q++;
                continue;
            }
            break;
        }
        if (!sawType) return null;
        spec.end = q;
        return spec;
    }

    /**
     * 未知标识符开头时的形状判断：
     * {@code Foo bar}、{@code Foo *bar;}、{@code Foo *bar = }、{@code Foo (*fp)(...)} 都是声明。
     */
    private boolean looksLikeDeclaration(int q, int to) {
        int r = q + 1;
        int stars = 0;
        while (r < to) {
            if (st.is(r, "*")) {
                stars++;
                r++;
            } else if (st.isIdentifier(r) && CKeywords.QUALIFIERS.contains(st.text(r))) {
                r++;
            } else {
                break;
            }
        }
        if (st.isName(r)) {
            if (stars == 0) return true;
            String next = st.text(r + 1);
            return next.equals(";") || next.equals("=") || next.equals(",")
                    || next.equals("[") || next.equals(")") || next.equals("(");
        }
        return st.is(r, "(") && st.is(r + 1, "*") && st.isName(r + 2)
                && st.is(r + 3, ")") && st.is(r + 4, "(");
    }

    /** struct/union 花括号内的成员声明。 */
    private List<PendingField> parseRecordBody(int open, int close, Scope scope) {
        List<PendingField> out = new ArrayList<>();
        int q = open + 1;
        while (q < close) {
            if (st.is(q, ";")) {
                q++;
                continue;
            }
            Specifiers spec = parseSpecifiers(q, close, scope);
            if (spec == null) {
                q = skipPast(q, close);
                continue;
            }
            int r = spec.end;
            if (st.is(r, ";") || r >= close) {
                // C11 匿名成员：字段直接属于外层
                if (spec.anonymous != null) out.addAll(spec.anonymous);
                q = r + 1;
                continue;
            }
            if (spec.anonymous != null) commitAnonymous(spec, spec.typeName);
            while (r < close) {
                Declarator d = parseDeclarator(r, close);
                if (d == null || (d.end == r && d.name == null)) break;
                if (d.name != null) {
                    TypeRef type = spec.typeName == null || d.opaque || d.function
                            ? null : new TypeRef(spec.typeName, d.depth);
                    out.add(new PendingField(d.name, type, d.namePos));
                }
                r = d.end;
                if (!st.is(r, ",")) break;
                r++;
            }
            q = skipPast(r, close);
        }
        return out;
    }

    private void commitAnonymous(Specifiers spec, String name) {
        commit(name, spec.anonymous);
        spec.typeName = name;
        spec.anonymous = null;
    }

    private void commit(String recordName, List<PendingField> pending) {
        List<FieldType> fields = new ArrayList<>(pending.size());
        for (PendingField pf : pending) {
            FieldType f = new FieldType(recordName, pf.name, pf.type, pf.position);
            fields.add(f);
            fieldDecls.put(pf.position, f);
        }
        types.defineRecord(recordName, fields);
    }

    /* ======================= 声明符 ======================= */

    private static final class Declarator {
        String name;
        int namePos = -1;
        int depth;
        boolean function;
        // 函数指针、数组指针：有名字但类型不可用
        boolean opaque;
        int paramOpen = -1;
        int paramClose = -1;
        int end;
    }

    private Declarator parseDeclarator(int q, int to) {
        Declarator d = new Declarator();
        while (q < to) {
            if (st.is(q, "*")) {
                d.depth++;
                q++;
            } else if (st.isIdentifier(q) && CKeywords.QUALIFIERS.contains(st.text(q))) {
                q++;
            } else if (st.isIdentifier(q) && CKeywords.ATTRIBUTES.contains(st.text(q))) {
                q = skipParenGroup(q + 1);
            } else {
                break;
            }
        }

        if (st.is(q, "(")) {
            int close = st.matching(q);
            if (close < 0 || close >= to) return null;
            int r = q + 1;
            int inner = 0;
            while (r < close && (st.is(r, "*") || (st.isIdentifier(r) && CKeywords.QUALIFIERS.contains(st.text(r))))) {
                if (st.is(r, "*")) inner++;
                r++;
            }
            if (!st.isName(r)) return null;
            d.name = st.text(r);
            d.namePos = r;
            q = close + 1;
            if (st.is(q, "(") || st.is(q, "[")) {
                d.opaque = true;
                while (st.is(q, "(") || st.is(q, "[")) {
                    int c = st.matching(q);
                    if (c < 0) return null;
                    q = c + 1;
                }
            } else {
                d.depth += inner;
            }
        } else if (st.isName(q)) {
            d.name = st.text(q);
            d.namePos = q;
            q++;
        }

        while (st.is(q, "[")) {
            int c = st.matching(q);
            if (c < 0) return null;
            d.depth++;
            q = c + 1;
        }
        if (st.is(q, "(") && !d.opaque) {
            int c = st.matching(q);
            if (c < 0) return null;
            d.function = true;
            d.paramOpen = q;
            d.paramClose = c;
            q = c + 1;
        }
        q = skipAttributes(q);
        if (st.is(q, ":")) {
            // 位域宽度
            q++;
            while (q < to && !st.is(q, ",") && !st.is(q, ";")) q = skipGroup(q);
        }
        d.end = q;
        return d;
    }

    /* ======================= 工具 ======================= */

    private Scope newScope(Scope.Kind kind, Scope parent, int start, int end, String functionName) {
        Scope s = new Scope(scopes.size(), parent, kind, start, end, functionName);
        scopes.add(s);
        return s;
    }

    /** 初始化表达式的结束位置：同层的 ',' 或 ';'。 */
    private int initializerEnd(int from, int to) {
        int q = from;
        while (q < to && !st.is(q, ",") && !st.is(q, ";")) q = skipGroup(q);
        return Math.min(q, to);
    }

    /** 跳过到同层下一个 ';' 之后。 */
    private int skipPast(int q, int to) {
        while (q < to && !st.is(q, ";")) q = skipGroup(q);
        return q + 1;
    }

    /** 开括号跳到配对之后，其余前进一个位置。 */
    private int skipGroup(int q) {
        if (st.is(q, "(") || st.is(q, "[") || st.is(q, "{")) {
            int c = st.matching(q);
            if (c > q) return c + 1;
        }
        return q + 1;
    }

    private int skipParenGroup(int q) {
        if (st.is(q, "(")) {
            int c = st.matching(q);
            if (c > q) return c + 1;
        }
        return q;
    }

    private int skipAttributes(int q) {
        while (st.isIdentifier(q) && CKeywords.ATTRIBUTES.contains(st.text(q))) {
            int next = skipParenGroup(q + 1);
            q = next == q + 1 ? q + 1 : next;
        }
        return q;
    }

    private static boolean isBuiltin(String typeName) {
        return typeName != null && CKeywords.BUILTIN_TYPES.contains(typeName);
    }

    private String syntheticName(String tagKeyword, int bracePos) {
        Token t = st.get(bracePos);
        return "<anonymous " + tagKeyword + " at " + t.getLine() + ":" + t.getColumn() + ">";
    }
}
