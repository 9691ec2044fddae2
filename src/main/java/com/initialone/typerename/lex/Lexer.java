package com.initialone.typerename.lex;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * C 源码词法分析：输出覆盖每个字节、无间隙的 token 序列。
 * 空白与注释也是 token，所以把全部 token 文本拼起来就是原输入。
 *
 * 不处理宏展开；预处理指令行照常切分，只是打上 inDirective 标记。
 */
public final class Lexer {

    // 多字符运算符，长的在前（最长匹配）
    private static final String[] OPERATORS = {
            "...", "<<=", ">>=",
            "->", "++", "--", "<<", ">>", "<=", ">=", "==", "!=", "&&", "||",
            "+=", "-=", "*=", "/=", "%=", "&=", "^=", "|=", "##"
    };
    private static final String PUNCTUATION = "()[]{},;";
    private static final Set<String> LITERAL_PREFIXES = Set.of("L", "u", "U", "u8");
    private static final Set<String> INCLUDE_DIRECTIVES = Set.of("include", "include_next", "import");

    private final String src;
    private final List<Token> tokens = new ArrayList<>();
    private int pos;
    private int line = 1;
    private int lineStart;
    private boolean atLineStart = true;
    private boolean inDirective;
    private int directiveSignificant;
    private boolean expectHeaderName;

    private Lexer(String src) {
        this.src = src;
    }

    public static List<Token> tokenize(String src) throws LexException {
        Lexer lx = new Lexer(src);
        lx.run();
        return lx.tokens;
    }

    private void run() throws LexException {
        int n = src.length();
        while (pos < n) {
            char c = src.charAt(pos);
            int start = pos;

            if (c == '\n' || isSpace(c) || continuationLength(pos) > 0) {
                whitespace();
            } else if (c == '/' && peek(1) == '*') {
                blockComment(start);
            } else if (c == '/' && peek(1) == '/') {
                lineComment(start);
            } else if (c == '"') {
                quoted(start, '"', TokenKind.STRING);
            } else if (c == '\'') {
                quoted(start, '\'', TokenKind.CHAR);
            } else if (isIdentStart(c)) {
                identifier(start);
            } else if (isDigit(c) || (c == '.' && isDigit(peek(1)))) {
                number(start);
            } else if (c == '#' && atLineStart && !inDirective) {
                inDirective = true;
                directiveSignificant = 0;
                pos++;
                emit(TokenKind.DIRECTIVE_START, start, pos);
            } else if (c == '<' && expectHeaderName && headerName(start)) {
                // headerName 已经 emit
            } else {
                operator(start);
            }
        }
    }

    /* ======================= 各类 token ======================= */

    private void whitespace() {
        int start = pos;
        boolean newline = false;
        int n = src.length();
        while (pos < n) {
            char c = src.charAt(pos);
            if (c == '\n') {
                pos++;
                newline = true;
                if (inDirective) break; // 指令在此结束，后面的空白另起一个 token
                continue;
            }
            if (isSpace(c)) {
                pos++;
                continue;
            }
            int cont = continuationLength(pos);
            if (cont > 0) {
                pos += cont;
                continue;
            }
            break;
        }
        emit(TokenKind.WHITESPACE, start, pos);
        if (newline) {
            inDirective = false;
            expectHeaderName = false;
            atLineStart = true;
        }
    }

    private void blockComment(int start) throws LexException {
        int close = src.indexOf("*/", start + 2);
        if (close < 0) {
            throw error("unterminated comment", start);
        }
        pos = close + 2;
        emit(TokenKind.COMMENT, start, pos);
    }

    private void lineComment(int start) {
        int n = src.length();
        pos = start + 2;
        while (pos < n && src.charAt(pos) != '\n') {
            int cont = continuationLength(pos);
            pos += cont > 0 ? cont : 1;
        }
        emit(TokenKind.COMMENT, start, pos);
    }

    /** pos 指向开引号；start 可能更靠前（L"..." 这类前缀）。 */
    private void quoted(int start, char quote, TokenKind kind) throws LexException {
        int n = src.length();
        pos++;
        while (true) {
            if (pos >= n) {
                throw error(kind == TokenKind.STRING ? "unterminated string literal" : "unterminated character literal", start);
            }
            char c = src.charAt(pos);
            if (c == '\\') {
                int cont = continuationLength(pos);
                pos += cont > 0 ? cont : 2;
                continue;
            }
            if (c == '\n') {
                throw error(kind == TokenKind.STRING ? "unterminated string literal" : "unterminated character literal", start);
            }
            pos++;
            if (c == quote) break;
        }
        emit(kind, start, pos);
    }

    private void identifier(int start) throws LexException {
        int n = src.length();
        pos++;
        while (pos < n && isIdentPart(src.charAt(pos))) pos++;
        String word = src.substring(start, pos);
        if (pos < n && LITERAL_PREFIXES.contains(word)) {
            char q = src.charAt(pos);
            if (q == '"') {
                quoted(start, '"', TokenKind.STRING);
                return;
            }
            if (q == '\'') {
                quoted(start, '\'', TokenKind.CHAR);
                return;
            }
        }
        emit(TokenKind.IDENTIFIER, start, pos);
    }

    /** 预处理数（pp-number）：覆盖十进制、浮点、0x/0b/0 前缀和各种后缀。 */
    private void number(int start) {
        int n = src.length();
        pos++;
        while (pos < n) {
            char c = src.charAt(pos);
            if ((c == '+' || c == '-') && "eEpP".indexOf(src.charAt(pos - 1)) >= 0) {
                pos++;
            } else if (isIdentPart(c) || c == '.') {
                pos++;
            } else {
                break;
            }
        }
        emit(TokenKind.NUMBER, start, pos);
    }

    private boolean headerName(int start) {
        int n = src.length();
        int p = start + 1;
        while (p < n && src.charAt(p) != '\n') {
            if (src.charAt(p) == '>') {
                pos = p + 1;
                emit(TokenKind.HEADER_NAME, start, pos);
                return true;
            }
            p++;
        }
        return false;
    }

    private void operator(int start) {
        for (String op : OPERATORS) {
            if (src.startsWith(op, start)) {
                pos = start + op.length();
                emit(TokenKind.OPERATOR, start, pos);
                return;
            }
        }
        char c = src.charAt(start);
        pos = start + 1;
        emit(PUNCTUATION.indexOf(c) >= 0 ? TokenKind.PUNCTUATION : TokenKind.OPERATOR, start, pos);
    }

    /* ======================= 工具 ======================= */

    private void emit(TokenKind kind, int start, int end) {
        String text = src.substring(start, end);
        tokens.add(new Token(kind, text, start, line, start - lineStart + 1, inDirective));
        for (int i = start; i < end; i++) {
            if (src.charAt(i) == '\n') {
                line++;
                lineStart = i + 1;
            }
        }
        if (kind.isTrivia()) return;

        atLineStart = false;
        if (inDirective) {
            directiveSignificant++;
            // # 之后的第一个标识符是指令名
            expectHeaderName = directiveSignificant == 2
                    && kind == TokenKind.IDENTIFIER
                    && INCLUDE_DIRECTIVES.contains(text);
        }
    }

    private LexException error(String message, int offset) {
        return new LexException(message, offset, line, offset - lineStart + 1);
    }

    private char peek(int ahead) {
        int p = pos + ahead;
        return p < src.length() ? src.charAt(p) : '\0';
    }

    /** 反斜杠续行的长度（\\\n 为 2，\\\r\n 为 3），不是续行返回 0。 */
    private int continuationLength(int p) {
        int n = src.length();
        if (p >= n || src.charAt(p) != '\\') return 0;
        if (p + 1 < n && src.charAt(p + 1) == '\n') return 2;
        if (p + 2 < n && src.charAt(p + 1) == '\r' && src.charAt(p + 2) == '\n') return 3;
        return 0;
    }

    private static boolean isSpace(char c) {
        return c == ' ' || c == '\t' || c == '\r' || c == '\f' || c == '\u000B';
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isIdentStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_' || c == '$';
    }

    private static boolean isIdentPart(char c) {
        return isIdentStart(c) || isDigit(c);
    }
}
