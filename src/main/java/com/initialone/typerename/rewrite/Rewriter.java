package com.initialone.typerename.rewrite;

import com.initialone.typerename.bind.Bindings;
import com.initialone.typerename.bind.FieldType;
import com.initialone.typerename.bind.TypeBinding;
import com.initialone.typerename.lex.SignificantTokens;
import com.initialone.typerename.lex.Token;
import com.initialone.typerename.model.Occurrence;
import com.initialone.typerename.model.RenameRule;
import com.initialone.typerename.model.RuleKind;
import com.initialone.typerename.resolve.TypeResolver;
import com.initialone.typerename.rules.RuleTable;

import java.util.ArrayList;
import java.util.List;

/**
 * 单趟线性改写：每个 token 要么原样输出，要么（命中规则时）输出规范名。
 * 一个实例只处理一个文件。
 *
 * 成员位置（. / -&gt; 之后、指定初始化器）的决策：
 * 1. owner 已推出，owner 或其 typedef 别名有规则：改写
 * 2. owner 已推出，没有 owner 规则但有 any 成员规则：改写
 * 3. owner 推不出，且有 owner 专属规则：不改，记为 UNRESOLVED
 * 4. owner 推不出，只有 any 成员规则：改写
 * 5. 别名组内的规则目标不一致：不改，记为 CONFLICT
 */
final class Rewriter {
    private final String file;
    private final String source;
    private final List<Token> tokens;
    private final SignificantTokens st;
    private final Bindings bindings;
    private final TypeResolver resolver;
    private final RuleTable rules;

    private final List<Occurrence> occurrences = new ArrayList<>();

    Rewriter(String file, String source, Bindings bindings, RuleTable rules) {
        this.file = file;
        this.source = source;
        this.st = bindings.tokens();
        this.tokens = st.tokens();
        this.bindings = bindings;
        this.rules = rules;
        this.resolver = new TypeResolver(bindings, rules.constructors());
    }

    RewriteResult run() {
        StringBuilder out = new StringBuilder(source.length() + 64);
        for (int i = 0; i < tokens.size(); i++) {
            Token t = tokens.get(i);
            String replacement = null;
            if (t.isIdentifier() && rules.mentions(t.getText())) {
                replacement = t.isInDirective() ? directiveIdentifier(i, t) : identifier(i, t);
            }
            out.append(replacement != null ? replacement : t.getText());
        }
        return new RewriteResult(file, source, out.toString(), occurrences);
    }

    /* ======================= 普通代码 ======================= */

    private String identifier(int index, Token t) {
        int p = st.positionOf(index);
        if (p < 0) return null;
        String name = t.getText();

        if (st.is(p - 1, ".") || st.is(p - 1, "->")) {
            return member(index, t, resolver.ownerOf(p - 1));
        }

        FieldType declared = bindings.fieldDeclaredAt(p);
        if (declared != null) {
            return member(index, t, declared.getStructName());
        }

        TypeBinding local = bindings.lookup(name, p);
        if (local != null && local.getFunction() != null) {
            // 局部变量/参数遮蔽全局规则，只认该函数自己的变量规则
            return rename(index, t, null, rules.localVariableRule(local.getFunction(), name));
        }
        RenameRule global = rules.globalRule(name);
        if (global != null && global.getKind() != RuleKind.FIELD) {
            return rename(index, t, null, global);
        }
        return null;
    }

    /** owner 为 null 表示推不出。 */
    private String member(int index, Token t, String owner) {
        String name = t.getText();
        if (owner == null) {
            if (rules.hasOwnerFieldRules(name)) {
                record(index, t, null, null, Occurrence.Status.UNRESOLVED);
                return null;
            }
            return rename(index, t, null, rules.globalFieldRule(name));
        }

        RenameRule match = null;
        for (String alias : bindings.types().aliasGroup(owner)) {
            RenameRule r = rules.fieldRule(alias, name);
            if (r == null) continue;
            if (match == null) {
                match = r;
            } else if (!match.getCanonical().equals(r.getCanonical())) {
                record(index, t, owner, null, Occurrence.Status.CONFLICT);
                return null;
            }
        }
        if (match == null) match = rules.globalFieldRule(name);
        return rename(index, t, owner, match);
    }

    /* ======================= 预处理指令行 ======================= */

    /** 指令行不做类型推断，只应用 owner 为 any 的规则。 */
    private String directiveIdentifier(int index, Token t) {
        String name = t.getText();
        if (isMemberInDirective(index)) {
            if (rules.hasOwnerFieldRules(name)) {
                record(index, t, null, null, Occurrence.Status.UNRESOLVED);
                return null;
            }
            return rename(index, t, null, rules.globalFieldRule(name));
        }
        RenameRule global = rules.globalRule(name);
        if (global != null && global.getKind() != RuleKind.FIELD) {
            return rename(index, t, null, global);
        }
        return null;
    }

    private boolean isMemberInDirective(int index) {
        for (int i = index - 1; i >= 0; i--) {
            Token prev = tokens.get(i);
            if (!prev.isInDirective()) return false;
            if (prev.getKind().isTrivia()) continue;
            return prev.is(".") || prev.is("->");
        }
        return false;
    }

    /* ======================= 记录 ======================= */

    private String rename(int index, Token t, String owner, RenameRule rule) {
        if (rule == null) return null;
        record(index, t, owner, rule, Occurrence.Status.RENAMED);
        return rule.getCanonical();
    }

    private void record(int index, Token t, String owner, RenameRule rule, Occurrence.Status status) {
        occurrences.add(new Occurrence(index, t.getLine(), t.getColumn(), t.getText(), owner, rule, status));
    }
}
