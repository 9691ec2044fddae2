package com.initialone.typerename.commands;

import com.initialone.typerename.model.RenameRule;
import com.initialone.typerename.model.RuleKind;
import com.initialone.typerename.model.TypeRef;
import com.initialone.typerename.rules.RuleConfigException;
import com.initialone.typerename.rules.RuleTable;
import picocli.CommandLine;

import java.io.PrintStream;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * 只加载并校验规则表，不读源文件。退出码 0 或 3。
 */
@CommandLine.Command(
        name = "check-rules",
        description = "Validate a rule table and print its statistics"
)
public class CheckRulesCmd implements Callable<Integer> {

    @CommandLine.Mixin
    RuleOptions ruleOptions;

    @CommandLine.Option(names = "--list", defaultValue = "false",
            description = "Print every rule and constructor after validation")
    boolean list;

    PrintStream out = System.out;
    PrintStream err = System.err;

    @Override
    public Integer call() {
        ruleOptions.applyLogLevel();
        RuleTable table;
        try {
            table = ruleOptions.load();
        } catch (RuleConfigException e) {
            err.println("[check-rules] " + e.getMessage());
            return e.getExitCode();
        }

        Map<RuleKind, Integer> counts = table.countByKind();
        out.println("[check-rules] " + ruleOptions.rules + ": rules=" + table.size()
                + " field=" + counts.get(RuleKind.FIELD)
                + " function=" + counts.get(RuleKind.FUNCTION)
                + " type=" + counts.get(RuleKind.TYPE)
                + " variable=" + counts.get(RuleKind.VARIABLE)
                + " constructors=" + table.constructors().size());
        for (String w : table.warnings()) {
            err.println("[check-rules] warning: " + w);
        }
        if (list) {
            for (RenameRule r : table.rules()) out.println("  " + r);
            for (Map.Entry<String, TypeRef> c : table.constructors().entrySet()) {
                out.println("  constructor " + c.getKey() + "() -> "
                        + (c.getValue() == null ? "(declared return type)" : c.getValue()));
            }
        }
        return 0;
    }
}
