package com.initialone.typerename.model;

/**
 * 改写过程中一次命中规则名的标识符出现；只在单次运行内存在。
 */
public final class Occurrence {

    public enum Status {
        RENAMED,
        UNRESOLVED,
        CONFLICT
    }

    private final int tokenIndex;
    private final int line;
    private final int column;
    private final String name;
    private final String owner;     // 可能为 null
    private final RenameRule rule;  // 可能为 null
    private final Status status;

    public Occurrence(int tokenIndex, int line, int column, String name,
                      String owner, RenameRule rule, Status status) {
        this.tokenIndex = tokenIndex;
        this.line = line;
        this.column = column;
        this.name = name;
        this.owner = owner;
        this.rule = rule;
        this.status = status;
    }

    public int getTokenIndex() { return tokenIndex; }

    public int getLine() { return line; }

    public int getColumn() { return column; }

    public String getName() { return name; }

    public String getOwner() { return owner; }

    public RenameRule getRule() { return rule; }

    public Status getStatus() { return status; }

    @Override
    public String toString() {
        return line + ":" + column + " " + name + " " + status
                + (owner != null ? " owner=" + owner : "")
                + (rule != null ? " -> " + rule.getCanonical() : "");
    }
}
