package com.initialone.typerename.bind;

import com.initialone.typerename.model.TypeRef;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 翻译单元内跨作用域共享的类型事实：struct/union 成员、typedef 别名、函数返回类型。
 * 由 {@link DeclarationBinder} 一次建成，之后只读。
 */
public final class TypeTable {
    private static final int MAX_ALIAS_CHAIN = 16;

    // alias -> 目标；目标为 null 表示类型不可用的 typedef（比如函数指针）
    private final Map<String, TypeRef> aliases = new LinkedHashMap<>();
    private final Map<String, Map<String, FieldType>> records = new LinkedHashMap<>();
    private final Map<String, TypeRef> functions = new LinkedHashMap<>();
    private boolean frozen;

    /* ======================= 构建（仅 binder 调用） ======================= */

    void defineAlias(String alias, TypeRef target) {
        checkMutable();
        aliases.putIfAbsent(alias, target);
    }

    void defineRecord(String name, List<FieldType> fields) {
        checkMutable();
        Map<String, FieldType> byName = records.computeIfAbsent(name, k -> new LinkedHashMap<>());
        // 条件编译里可能出现两份定义，保留先出现的成员
        for (FieldType f : fields) {
            byName.putIfAbsent(f.getFieldName(), f);
        }
    }

    void defineFunction(String name, TypeRef returnType) {
        checkMutable();
        functions.putIfAbsent(name, returnType);
    }

    void freeze() {
        frozen = true;
    }

    private void checkMutable() {
        if (frozen) throw new IllegalStateException("type table is read-only after binding");
    }

    /* ======================= 查询 ======================= */

    public boolean isTypedefName(String name) {
        return aliases.containsKey(name);
    }

    public boolean isRecord(String name) {
        return records.containsKey(name);
    }

    /** 沿 typedef 链展开到规范类型名，指针层数累加；链断在不可用的 typedef 上时返回 null。 */
    public TypeRef canonical(TypeRef type) {
        if (type == null) return null;
        String name = type.getName();
        int depth = type.getDepth();
        for (int steps = 0; steps < MAX_ALIAS_CHAIN; steps++) {
            if (!aliases.containsKey(name)) break;
            TypeRef target = aliases.get(name);
            if (target == null) return null;
            depth += target.getDepth();
            boolean self = target.getName().equals(name);
            name = target.getName();
            if (self) break;
        }
        return new TypeRef(name, depth);
    }

    /**
     * 同一类型的所有名字：规范名在前，其余按字母序（只含不带指针的 typedef）。
     * 规则的 owner 可以写其中任何一个。
     */
    public List<String> aliasGroup(String canonicalName) {
        List<String> others = new ArrayList<>();
        TypeRef self = new TypeRef(canonicalName, 0);
        for (String alias : aliases.keySet()) {
            if (alias.equals(canonicalName)) continue;
            if (self.equals(canonical(new TypeRef(alias, 0)))) others.add(alias);
        }
        Collections.sort(others);
        List<String> group = new ArrayList<>(others.size() + 1);
        group.add(canonicalName);
        group.addAll(others);
        return group;
    }

    /** owner 必须已经是规范名。 */
    public FieldType field(String owner, String fieldName) {
        Map<String, FieldType> byName = records.get(owner);
        return byName == null ? null : byName.get(fieldName);
    }

    public Map<String, FieldType> fieldsOf(String owner) {
        return Collections.unmodifiableMap(records.getOrDefault(owner, Map.of()));
    }

    public TypeRef functionReturn(String name) {
        return functions.get(name);
    }

    public int recordCount() {
        return records.size();
    }
}
