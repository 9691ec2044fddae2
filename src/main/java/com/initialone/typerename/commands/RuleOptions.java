package com.initialone.typerename.commands;

import com.initialone.typerename.rules.RuleConfigException;
import com.initialone.typerename.rules.RuleTable;
import com.initialone.typerename.rules.RuleTableLoader;
import picocli.CommandLine;

import java.nio.file.Path;

// rewrite 与 check-rules 共用的选项
public class RuleOptions {

    @CommandLine.Option(names = "--rules", defaultValue = "${env:TYPERENAME_RULES:-rules.json}",
            description = "Rule table JSON (default: ${DEFAULT-VALUE}, or $TYPERENAME_RULES)")
    public Path rules;

    @CommandLine.Option(names = {"-v", "--verbose"}, defaultValue = "false",
            description = "Log engine diagnostics to stderr")
    public boolean verbose;

    /** 必须在第一次获取 logger 之前调用，slf4j-simple 只在初始化时读取级别 */
    public void applyLogLevel() {
        if (verbose) System.setProperty("org.slf4j.simpleLogger.defaultLogLevel", "debug");
    }

    public RuleTable load() throws RuleConfigException {
        return new RuleTableLoader().load(rules);
    }
}
