package com.initialone.typerename;

import com.initialone.typerename.commands.CheckRulesCmd;
import com.initialone.typerename.commands.RewriteCmd;
import picocli.CommandLine;

@CommandLine.Command(
        name = "typerename",
        version = "0.1.0",
        mixinStandardHelpOptions = true,
        usageHelpAutoWidth = true,
        sortOptions = false,
        description = {
                "Rename abbreviated C identifiers by the static type of each access.",
                "  check-rules → rewrite",
                "",
                "Exit codes: 0 ok | 1 unresolved or conflicting | 2 lex/input error | 3 rule table error",
                "Env: TYPERENAME_RULES (default rule file)"
        },
        subcommands = {
                RewriteCmd.class, CheckRulesCmd.class
        }
)
public class Main implements Runnable {
    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    /** 没有子命令时打印用法。 */
    @Override
    public void run() {
        spec.commandLine().usage(spec.commandLine().getOut());
    }

    public static void main(String[] args) {
        System.exit(new CommandLine(new Main()).execute(args));
    }
}
