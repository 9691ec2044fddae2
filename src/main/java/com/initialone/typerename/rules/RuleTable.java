package com.initialone.typerename.rules;

import com.initialone.typerename.lex.CKeywords;
import com.initialone.typerename.model.RenameRule;
import com.initialone.typerename.model.RuleKind;
import com.initialone.typerename.model.TypeRef;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * (owner, abbreviated) -&gt; 规则，外加构造函数白名单。
 * 构建时完成全部校验；构建后只读，可被多个文件的改写线程共享。
 */
public final class RuleTable {
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private final Map<Key, RenameRule> byKey;
    private final Set<String> ownerFieldNames;
    private final Set<String> abbreviations;
    private final Map<String, TypeRef> constructors;
    private final List<String> warnings;

    private RuleTable(Builder b) {
        this.byKey = Collections.unmodifiableMap(new LinkedHashMap<>(b.byKey));
        Set<String> names = new HashSet<>();
        Set<String> all = new HashSet<>();
        for (RenameRule r : byKey.values()) {
            if (!r.isGlobal() && r.getKind() == RuleKind.FIELD) names.add(r.getAbbreviated());
            all.add(r.getAbbreviated());
        }
        this.ownerFieldNames = Collections.unmodifiableSet(names);
        this.abbreviations = Collections.unmodifiableSet(all);
        this.constructors = Collections.unmodifiableMap(new LinkedHashMap<>(b.constructors));
        this.warnings = Collections.unmodifiableList(new ArrayList<>(b.warnings));
    }

    public static Builder builder() {
        return new Builder();
    }

    /* ======================= 查询 ======================= */

    /** owner 专属的成员规则。 */
    public RenameRule fieldRule(String owner, String name) {
        RenameRule r = byKey.get(new Key(owner, name));
        return r != null && r.getKind() == RuleKind.FIELD ? r : null;
    }

    /** owner 为 any 的规则（任何类别）。 */
    public RenameRule globalRule(String name) {
        return byKey.get(new Key(RenameRule.ANY, name));
    }

    /** owner 为 any 且类别为 field 的规则。 */
    public RenameRule globalFieldRule(String name) {
        RenameRule r = globalRule(name);
        return r != null && r.getKind() == RuleKind.FIELD ? r : null;
    }

    /** 某个函数内的局部变量/参数规则。 */
    public RenameRule localVariableRule(String function, String name) {
        if (function == null) return null;
        RenameRule r = byKey.get(new Key(function, name));
        return r != null && r.getKind() == RuleKind.VARIABLE ? r : null;
    }

    /** 是否存在以该名字为短名的 owner 专属成员规则（需要类型推断才能决定）。 */
    public boolean hasOwnerFieldRules(String name) {
        return ownerFieldNames.contains(name);
    }

    /** 任何规则都没有提到的名字可以直接跳过。 */
    public boolean mentions(String name) {
        return abbreviations.contains(name);
    }

    /** 函数名 -&gt; 返回类型；值为 null 表示取翻译单元中的声明。 */
    public Map<String, TypeRef> constructors() {
        return constructors;
    }

    public List<RenameRule> rules() {
        return new ArrayList<>(byKey.values());
    }

    public int size() {
        return byKey.size();
    }

    public Map<RuleKind, Integer> countByKind() {
        Map<RuleKind, Integer> counts = new EnumMap<>(RuleKind.class);
        for (RuleKind k : RuleKind.values()) counts.put(k, 0);
        for (RenameRule r : byKey.values()) counts.merge(r.getKind(), 1, Integer::sum);
        return counts;
    }

    /** 加载时发现的无害问题（例如完全相同的重复记录）。 */
    public List<String> warnings() {
        return warnings;
    }

    /* ======================= 构建与校验 ======================= */

    public static final class Builder {
        private final Map<Key, RenameRule> byKey = new LinkedHashMap<>();
        private final Map<String, TypeRef> constructors = new HashMap<>();
        private final List<String> warnings = new ArrayList<>();

        private Builder() {
        }

        public Builder add(RenameRule rule) throws RuleConfigException {
            String where = rule.toString();
            if (rule.getAbbreviated().isEmpty() || rule.getCanonical().isEmpty() || rule.getOwner().isEmpty()) {
                throw new RuleConfigException("empty name in rule " + where);
            }
            requireIdentifier(rule.getAbbreviated(), "abbreviated name", where);
            requireIdentifier(rule.getCanonical(), "canonical name", where);
            if (!rule.isGlobal()) requireIdentifier(rule.getOwner(), "owner type", where);
            if ((rule.getKind() == RuleKind.FUNCTION || rule.getKind() == RuleKind.TYPE) && !rule.isGlobal()) {
                throw new RuleConfigException(rule.getKind().jsonName() + " rule must have owner 'any': " + where);
            }

            Key key = new Key(rule.getOwner(), rule.getAbbreviated());
            RenameRule existing = byKey.get(key);
            if (existing != null) {
                if (existing.sameTarget(rule)) {
                    warnings.add("duplicate rule " + where);
                    return this;
                }
                throw new RuleConfigException("conflicting rules for key (" + rule.getOwner() + ", "
                        + rule.getAbbreviated() + "): " + existing.getCanonical() + " vs " + rule.getCanonical());
            }
            byKey.put(key, rule);
            return this;
        }

        public Builder addConstructor(String function, String returns, int pointerDepth) throws RuleConfigException {
            String where = "constructor '" + function + "'";
            if (function == null || function.isEmpty()) throw new RuleConfigException("constructor without function name");
            requireIdentifier(function, "function name", where);
            if (returns != null) requireIdentifier(returns, "return type", where);
            if (pointerDepth < 0) throw new RuleConfigException("negative pointer_depth for " + where);

            TypeRef type = returns == null ? null : new TypeRef(returns, pointerDepth);
            if (constructors.containsKey(function)) {
                if (Objects.equals(constructors.get(function), type)) {
                    warnings.add("duplicate " + where);
                    return this;
                }
                throw new RuleConfigException("conflicting return types for " + where);
            }
            constructors.put(function, type);
            return this;
        }

        public RuleTable build() throws RuleConfigException {
            Set<String> owners = new HashSet<>();
            Set<String> ownedNames = new HashSet<>();
            for (RenameRule r : byKey.values()) {
                if (r.isGlobal()) continue;
                owners.add(r.getOwner());
                ownedNames.add(r.getAbbreviated());
            }
            // 目标名不能再被任何规则改写，否则第二次运行结果不同
            for (RenameRule r : byKey.values()) {
                String target = r.getCanonical();
                if (target.equals(r.getAbbreviated())) continue;
                if (byKey.containsKey(new Key(r.getOwner(), target))
                        || byKey.containsKey(new Key(RenameRule.ANY, target))) {
                    throw new RuleConfigException("canonical name '" + target
                            + "' is itself renamed by another rule: " + r);
                }
                // any 规则不知道 owner，改名后可能落到某个 owner 的规则上
                if (r.isGlobal() && ownedNames.contains(target)) {
                    throw new RuleConfigException("canonical name '" + target
                            + "' is renamed under a specific owner: " + r);
                }
                // 类型改名后 owner 变了，第二次运行会命中新 owner 的规则
                if (r.getKind() == RuleKind.TYPE && owners.contains(target)) {
                    throw new RuleConfigException("canonical type '" + target
                            + "' is the owner of other rules: " + r);
                }
                // 函数改名成构造函数后，第二次运行才能推出返回类型
                if (r.getKind() == RuleKind.FUNCTION && constructors.containsKey(target)) {
                    throw new RuleConfigException("canonical function '" + target
                            + "' is a listed constructor: " + r);
                }
            }
            return new RuleTable(this);
        }

        private static void requireIdentifier(String s, String what, String where) throws RuleConfigException {
            if (!IDENTIFIER.matcher(s).matches()) {
                throw new RuleConfigException(what + " '" + s + "' is not a C identifier in " + where);
            }
            if (CKeywords.isKeyword(s)) {
                throw new RuleConfigException(what + " '" + s + "' is a C keyword in " + where);
            }
        }
    }

    private static final class Key {
        final String owner;
        final String name;

        Key(String owner, String name) {
            this.owner = owner;
            this.name = name;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Key)) return false;
            Key k = (Key) o;
            return owner.equals(k.owner) && name.equals(k.name);
        }

        @Override
        public int hashCode() {
            return Objects.hash(owner, name);
        }
    }
}
