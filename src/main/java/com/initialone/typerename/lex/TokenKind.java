package com.initialone.typerename.lex;

public enum TokenKind {
    IDENTIFIER,
    NUMBER,
    STRING,
    CHAR,
    /** ( ) [ ] { } , ; */
    PUNCTUATION,
    /** 其余运算符，包括 . 和 -> */
    OPERATOR,
    COMMENT,
    WHITESPACE,
    /** 行首的 #，开启一条预处理指令 */
    DIRECTIVE_START,
    /** #include 之后的 &lt;...&gt; */
    HEADER_NAME;

    public boolean isTrivia() {
        return this == WHITESPACE || this == COMMENT;
    }
}
