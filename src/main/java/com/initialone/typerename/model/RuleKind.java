package com.initialone.typerename.model;

import java.util.Locale;

public enum RuleKind {
    FIELD,
    FUNCTION,
    TYPE,
    VARIABLE;

    /** 规则文件中的写法：field|function|type|variable；无法识别时返回 null。 */
    public static RuleKind parse(String s) {
        if (s == null) return null;
        for (RuleKind k : values()) {
            if (k.name().equals(s.trim().toUpperCase(Locale.ROOT))) return k;
        }
        return null;
    }

    public String jsonName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
