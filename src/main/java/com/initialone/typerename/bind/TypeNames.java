package com.initialone.typerename.bind;

import com.initialone.typerename.lex.CKeywords;
import com.initialone.typerename.lex.SignificantTokens;
import com.initialone.typerename.model.TypeRef;

/** 识别括号里的类型名（强制转换、复合字面量）。 */
public final class TypeNames {

    private TypeNames() {
    }

    /**
     * [from, to] 闭区间恰好是一个类型名时返回它，否则返回 null。
     * 未知标识符只有后面带 * 时才算类型名，避免把 (x) 当成强制转换。
     */
    public static TypeRef parse(SignificantTokens st, TypeTable types, int from, int to) {
        if (from > to) return null;
        int q = skipQualifiers(st, from, to);
        String name;
        boolean known = true;
        String word = st.text(q);
        if (st.isIdentifier(q) && CKeywords.TAGS.contains(word)) {
            if (!st.isName(q + 1)) return null;
            name = st.text(q + 1);
            q += 2;
        } else if (st.isIdentifier(q) && CKeywords.BUILTIN_TYPES.contains(word)) {
            name = word;
            while (q <= to && st.isIdentifier(q)
                    && (CKeywords.BUILTIN_TYPES.contains(st.text(q)) || CKeywords.QUALIFIERS.contains(st.text(q)))) {
                q++;
            }
        } else if (st.isName(q)) {
            name = word;
            known = types.isTypedefName(name);
            q++;
        } else {
            return null;
        }

        int depth = 0;
        while (q <= to) {
            if (st.is(q, "*")) {
                depth++;
                q++;
            } else if (st.isIdentifier(q) && CKeywords.QUALIFIERS.contains(st.text(q))) {
                q++;
            } else {
                break;
            }
        }
        if (q != to + 1) return null;
        if (!known && depth == 0) return null;
        return new TypeRef(name, depth);
    }

    private static int skipQualifiers(SignificantTokens st, int q, int to) {
        while (q <= to && st.isIdentifier(q) && CKeywords.QUALIFIERS.contains(st.text(q))) q++;
        return q;
    }
}
