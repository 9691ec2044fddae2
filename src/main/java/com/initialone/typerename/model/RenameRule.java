package com.initialone.typerename.model;

import java.util.Objects;

/**
 * 一条改名规则：(owner, abbreviated) -> canonical。
 * owner 为 {@link #ANY} 时表示全局唯一的短名，不需要类型推断。
 */
public final class RenameRule {
    public static final String ANY = "any";

    private final String owner;
    private final String abbreviated;
    private final String canonical;
    private final RuleKind kind;

    public RenameRule(String owner, String abbreviated, String canonical, RuleKind kind) {
        this.owner = Objects.requireNonNull(owner, "owner");
        this.abbreviated = Objects.requireNonNull(abbreviated, "abbreviated");
        this.canonical = Objects.requireNonNull(canonical, "canonical");
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public String getOwner() { return owner; }

    public String getAbbreviated() { return abbreviated; }

    public String getCanonical() { return canonical; }

    public RuleKind getKind() { return kind; }

    public boolean isGlobal() {
        return ANY.equals(owner);
    }

    /** 同一条规则（目标与类别都相同），用于识别无害的重复记录。 */
    public boolean sameTarget(RenameRule other) {
        return canonical.equals(other.canonical) && kind == other.kind;
    }

    @Override
    public String toString() {
        return "(" + owner + ", " + abbreviated + ") -> " + canonical + " [" + kind.jsonName() + "]";
    }
}
