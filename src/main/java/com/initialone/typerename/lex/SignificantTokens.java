package com.initialone.typerename.lex;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;

/**
 * 去掉空白、注释和预处理指令行之后的 token 视图。
 * 位置（position）指本视图内的下标；并预先算好括号配对。
 */
public final class SignificantTokens {
    private final List<Token> tokens;
    private final int[] sig;
    private final int[] positionOf;
    private final int[] match;

    public SignificantTokens(List<Token> tokens) {
        this.tokens = tokens;
        this.positionOf = new int[tokens.size()];
        int count = 0;
        for (int i = 0; i < tokens.size(); i++) {
            Token t = tokens.get(i);
            if (t.getKind().isTrivia() || t.isInDirective()) {
                positionOf[i] = -1;
            } else {
                positionOf[i] = count++;
            }
        }
        this.sig = new int[count];
        for (int i = 0; i < tokens.size(); i++) {
            if (positionOf[i] >= 0) sig[positionOf[i]] = i;
        }
        this.match = computeMatches();
    }

    public List<Token> tokens() {
        return tokens;
    }

    public int size() {
        return sig.length;
    }

    public Token get(int p) {
        return tokens.get(sig[p]);
    }

    /** 越界时返回空串，方便向前/向后探测。 */
    public String text(int p) {
        return p >= 0 && p < sig.length ? get(p).getText() : "";
    }

    public boolean is(int p, String s) {
        return p >= 0 && p < sig.length && get(p).is(s);
    }

    public boolean isIdentifier(int p) {
        return p >= 0 && p < sig.length && get(p).isIdentifier();
    }

    /** 标识符且不是 C 关键字 */
    public boolean isName(int p) {
        return isIdentifier(p) && !CKeywords.isKeyword(text(p));
    }

    public int tokenIndex(int p) {
        return sig[p];
    }

    /** token 下标 -> 位置；不参与分析的 token 返回 -1 */
    public int positionOf(int tokenIndex) {
        return positionOf[tokenIndex];
    }

    /** 配对括号的位置；未配对或不是括号时为 -1 */
    public int matching(int p) {
        return p >= 0 && p < match.length ? match[p] : -1;
    }

    private int[] computeMatches() {
        int[] m = new int[sig.length];
        Arrays.fill(m, -1);
        Deque<Integer> open = new ArrayDeque<>();
        for (int p = 0; p < sig.length; p++) {
            String t = text(p);
            Token tok = get(p);
            if (tok.getKind() != TokenKind.PUNCTUATION) continue;
            if (t.equals("(") || t.equals("[") || t.equals("{")) {
                open.push(p);
                continue;
            }
            String opener = openerOf(t);
            if (opener == null) continue;
            // 条件编译可能让括号失衡：向下找到同类开括号，中间未闭合的丢弃
            boolean found = false;
            for (Iterator<Integer> it = open.iterator(); it.hasNext(); ) {
                if (text(it.next()).equals(opener)) {
                    found = true;
                    break;
                }
            }
            if (!found) continue;
            while (true) {
                int q = open.pop();
                if (text(q).equals(opener)) {
                    m[q] = p;
                    m[p] = q;
                    break;
                }
            }
        }
        return m;
    }

    private static String openerOf(String closer) {
        switch (closer) {
            case ")": return "(";
            case "]": return "[";
            case "}": return "{";
            default: return null;
        }
    }
}
