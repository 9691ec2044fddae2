package com.initialone.typerename.model;

/**
 * 所有终止性错误的基类；携带命令行退出码。
 */
public class RewriteException extends Exception {
    private final int exitCode;

    public RewriteException(String message, int exitCode) {
        super(message);
        this.exitCode = exitCode;
    }

    public RewriteException(String message, int exitCode, Throwable cause) {
        super(message, cause);
        this.exitCode = exitCode;
    }

    public int getExitCode() {
        return exitCode;
    }
}
