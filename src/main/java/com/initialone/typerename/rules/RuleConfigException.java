package com.initialone.typerename.rules;

import com.initialone.typerename.model.RewriteException;

/**
 * 规则文件无法使用：读不到、JSON 非法、记录不合法或键冲突。
 * 在任何改写开始之前抛出。
 */
public class RuleConfigException extends RewriteException {
    public static final int EXIT_CODE = 3;

    public RuleConfigException(String message) {
        super(message, EXIT_CODE);
    }

    public RuleConfigException(String message, Throwable cause) {
        super(message, EXIT_CODE, cause);
    }
}
