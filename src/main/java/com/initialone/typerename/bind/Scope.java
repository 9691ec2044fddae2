package com.initialone.typerename.bind;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 花括号（或 for 头部）界定的作用域。start/end 为闭区间位置。
 */
public final class Scope {

    public enum Kind {
        FILE,
        FUNCTION,
        BLOCK,
        FOR
    }

    private final int id;
    private final Scope parent;
    private final Kind kind;
    private final int start;
    private final int end;
    private final String functionName;
    private final Map<String, List<TypeBinding>> bindings = new HashMap<>();

    Scope(int id, Scope parent, Kind kind, int start, int end, String functionName) {
        this.id = id;
        this.parent = parent;
        this.kind = kind;
        this.start = start;
        this.end = end;
        this.functionName = functionName;
    }

    void add(TypeBinding binding) {
        bindings.computeIfAbsent(binding.getName(), k -> new ArrayList<>()).add(binding);
    }

    /** 本作用域内、在 position 处已经可见的最后一个同名声明。 */
    public TypeBinding find(String name, int position) {
        List<TypeBinding> list = bindings.get(name);
        if (list == null) return null;
        for (int i = list.size() - 1; i >= 0; i--) {
            TypeBinding b = list.get(i);
            if (b.getPosition() <= position) return b;
        }
        return null;
    }

    public int getId() { return id; }

    public Scope getParent() { return parent; }

    public Kind getKind() { return kind; }

    public int getStart() { return start; }

    public int getEnd() { return end; }

    public String getFunctionName() { return functionName; }
}
