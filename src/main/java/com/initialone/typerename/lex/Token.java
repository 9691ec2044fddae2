package com.initialone.typerename.lex;

/**
 * 词法单元。start 为输入中的字节偏移（输入按 ISO-8859-1 读入，字符即字节）。
 */
public final class Token {
    private final TokenKind kind;
    private final String text;
    private final int start;
    private final int line;
    private final int column;
    private final boolean inDirective;

    public Token(TokenKind kind, String text, int start, int line, int column, boolean inDirective) {
        this.kind = kind;
        this.text = text;
        this.start = start;
        this.line = line;
        this.column = column;
        this.inDirective = inDirective;
    }

    public TokenKind getKind() { return kind; }

    public String getText() { return text; }

    public int getStart() { return start; }

    public int getLength() { return text.length(); }

    public int getEnd() { return start + text.length(); }

    public int getLine() { return line; }

    public int getColumn() { return column; }

    /** 是否属于某条预处理指令行 */
    public boolean isInDirective() { return inDirective; }

    public boolean isIdentifier() {
        return kind == TokenKind.IDENTIFIER;
    }

    public boolean is(String s) {
        return (kind == TokenKind.PUNCTUATION || kind == TokenKind.OPERATOR) && text.equals(s);
    }

    @Override
    public String toString() {
        return kind + "(" + text + ")@" + line + ":" + column;
    }
}
