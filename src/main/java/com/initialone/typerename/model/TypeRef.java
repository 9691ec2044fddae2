package com.initialone.typerename.model;

import java.util.Objects;

/** 类型名 + 指针层数（数组按一层计）。 */
public final class TypeRef {
    private final String name;
    private final int depth;

    public TypeRef(String name, int depth) {
        this.name = Objects.requireNonNull(name, "name");
        this.depth = depth;
    }

    public String getName() { return name; }

    public int getDepth() { return depth; }

    public TypeRef withDepth(int newDepth) {
        return new TypeRef(name, newDepth);
    }

    /** 解引用一层；depth 为 0 时返回 null。 */
    public TypeRef deref() {
        return depth > 0 ? new TypeRef(name, depth - 1) : null;
    }

    public TypeRef addressOf() {
        return new TypeRef(name, depth + 1);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TypeRef)) return false;
        TypeRef other = (TypeRef) o;
        return depth == other.depth && name.equals(other.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, depth);
    }

    @Override
    public String toString() {
        return depth == 0 ? name : name + " " + "*".repeat(depth);
    }
}
