package com.initialone.typerename.lex;

import com.initialone.typerename.model.RewriteException;

/**
 * 未闭合的字符串/字符字面量或块注释。不做恢复，整个文件放弃。
 */
public class LexException extends RewriteException {
    public static final int EXIT_CODE = 2;

    private final int offset;
    private final int line;
    private final int column;

    public LexException(String message, int offset, int line, int column) {
        super(line + ":" + column + ": " + message, EXIT_CODE);
        this.offset = offset;
        this.line = line;
        this.column = column;
    }

    public int getOffset() { return offset; }

    public int getLine() { return line; }

    public int getColumn() { return column; }
}
