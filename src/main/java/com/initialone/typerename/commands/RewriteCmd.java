package com.initialone.typerename.commands;

import com.initialone.typerename.lex.LexException;
import com.initialone.typerename.report.CoverageReporter;
import com.initialone.typerename.rewrite.RewriteEngine;
import com.initialone.typerename.rewrite.RewriteResult;
import com.initialone.typerename.rules.RuleConfigException;
import com.initialone.typerename.rules.RuleTable;
import com.initialone.typerename.util.Tools;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintStream;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * 按规则表改写 C 源文件。
 * 特性：
 * - 输入可以是文件或目录（目录按 --extensions 递归收集）
 * - 分批执行 (--batch) + 并发 (--max-concurrent)
 * - 不中断：单文件失败只记录错误并继续，退出码取所有文件中最坏的
 * - dry-run 只统计与报告，不写盘也不输出
 *
 * 退出码：0 全部解析；1 有未解析/冲突；2 词法错误或输入不可读；3 规则表错误
 */
@CommandLine.Command(
        name = "rewrite",
        description = "Rename abbreviated identifiers in C sources by the static type of each access"
)
public class RewriteCmd implements Callable<Integer> {
    static final int EXIT_INPUT = 2;

    @CommandLine.Mixin
    RuleOptions ruleOptions;

    @CommandLine.Parameters(arity = "1..*", paramLabel = "<input>",
            description = "C source files or directories")
    List<String> inputs;

    @CommandLine.Option(names = "--in-place", defaultValue = "false",
            description = "Overwrite each input file with its rewritten text")
    boolean inPlace;

    @CommandLine.Option(names = "--stdout", defaultValue = "false",
            description = "Write rewritten text to stdout (default when --in-place is not given)")
    boolean toStdout;

    @CommandLine.Option(names = "--report", description = "Write the coverage report here instead of stderr")
    Path report;

    @CommandLine.Option(names = "--dry-run", defaultValue = "false",
            description = "Analyze & report without writing any output")
    boolean dryRun;

    @CommandLine.Option(names = "--batch", defaultValue = "100",
            description = "Files per batch (default: ${DEFAULT-VALUE})")
    int batch;

    @CommandLine.Option(names = "--max-concurrent", defaultValue = "4",
            description = "Max concurrent workers (default: ${DEFAULT-VALUE})")
    int maxConcurrent;

    @CommandLine.Option(names = "--extensions", split = ",", defaultValue = ".c,.h",
            description = "Comma-separated extensions collected from directories (default: ${DEFAULT-VALUE})")
    List<String> exts;

    // 测试时替换
    PrintStream out = System.out;
    PrintStream err = System.err;

    @Override
    public Integer call() {
        if (inPlace && toStdout) {
            throw new CommandLine.ParameterException(new CommandLine(this), "--in-place and --stdout are mutually exclusive");
        }
        if (batch < 1 || maxConcurrent < 1) {
            throw new CommandLine.ParameterException(new CommandLine(this), "--batch and --max-concurrent must be positive");
        }
        ruleOptions.applyLogLevel();

        RuleTable rules;
        try {
            rules = ruleOptions.load();
        } catch (RuleConfigException e) {
            err.println("[rewrite] " + e.getMessage());
            return e.getExitCode();
        }

        int worst = CoverageReporter.EXIT_OK;
        List<FileOutcome> outcomes = new ArrayList<>();

        // 收集文件列表（保持输入顺序，去重）
        Set<Path> files = new LinkedHashSet<>();
        for (String in : inputs) {
            Path p = Paths.get(in);
            try {
                if (Files.isDirectory(p)) {
                    files.addAll(Tools.listFiles(p, exts));
                } else if (Files.isRegularFile(p)) {
                    files.add(p);
                } else {
                    outcomes.add(FileOutcome.failed(p, "no such file or directory"));
                }
            } catch (IOException e) {
                outcomes.add(FileOutcome.failed(p, "cannot list directory: " + e.getMessage()));
            }
        }

        RewriteEngine engine = new RewriteEngine(rules);
        List<List<Path>> batches = Tools.chunk(new ArrayList<>(files), batch);
        ExecutorService pool = Executors.newFixedThreadPool(Math.min(maxConcurrent, Math.max(1, batches.size())));
        try {
            List<Future<List<FileOutcome>>> futs = new ArrayList<>();
            for (int i = 0; i < batches.size(); i++) {
                int batchIndex = i + 1;
                List<Path> one = batches.get(i);
                futs.add(pool.submit(() -> processBatch(batchIndex, batches.size(), one, engine)));
            }
            for (int i = 0; i < futs.size(); i++) {
                try {
                    outcomes.addAll(futs.get(i).get());
                } catch (ExecutionException e) {
                    // 单批内部已逐文件捕获异常，这里兜底
                    for (Path p : batches.get(i)) outcomes.add(FileOutcome.failed(p, String.valueOf(e.getCause())));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    err.println("[rewrite] interrupted");
                    return EXIT_INPUT;
                }
            }
        } finally {
            pool.shutdown();
        }

        CoverageReporter reporter = new CoverageReporter();
        long renamed = 0;
        long changed = 0;
        long errors = 0;
        for (FileOutcome o : outcomes) {
            if (o.result == null) {
                err.println(o.error);
                worst = Math.max(worst, o.exitCode);
                errors++;
                continue;
            }
            reporter.add(o.result);
            renamed += o.result.renamedCount();
            if (o.result.isChanged()) changed++;
            worst = Math.max(worst, CoverageReporter.exitCodeOf(o.result));
            if (!dryRun && !inPlace) {
                byte[] bytes = o.result.getOutput().getBytes(Tools.SOURCE_CHARSET);
                out.write(bytes, 0, bytes.length);
            }
        }
        out.flush();

        try {
            writeReport(reporter);
        } catch (IOException e) {
            err.println("[rewrite] cannot write report " + report + ": " + e.getMessage());
            worst = Math.max(worst, EXIT_INPUT);
        }

        err.printf("[rewrite] DONE. files=%d, changed=%d, renamed=%d, unresolved=%d, conflicts=%d, errors=%d%s%n",
                files.size(), changed, renamed, reporter.getUnresolved(), reporter.getConflicts(), errors,
                dryRun ? " (dry-run)" : "");
        return worst;
    }

    /* ======================= 批处理核心 ======================= */

    private static final class FileOutcome {
        final RewriteResult result;
        final String error;
        final int exitCode;

        private FileOutcome(RewriteResult result, String error, int exitCode) {
            this.result = result;
            this.error = error;
            this.exitCode = exitCode;
        }

        static FileOutcome ok(RewriteResult result) {
            return new FileOutcome(result, null, CoverageReporter.EXIT_OK);
        }

        static FileOutcome failed(Path file, String error) {
            return new FileOutcome(null, file + ": " + error, EXIT_INPUT);
        }
    }

    private List<FileOutcome> processBatch(int idx, int total, List<Path> files, RewriteEngine engine) {
        if (total > 1) err.println("[rewrite] batch " + idx + "/" + total + " items=" + files.size());
        List<FileOutcome> outcomes = new ArrayList<>(files.size());
        for (Path p : files) {
            try {
                String code = Tools.readSource(p);
                RewriteResult r = engine.rewrite(p.toString(), code);
                if (inPlace && !dryRun && r.isChanged()) {
                    Tools.writeSource(p, r.getOutput());
                }
                outcomes.add(FileOutcome.ok(r));
            } catch (LexException e) {
                outcomes.add(new FileOutcome(null, p + ":" + e.getMessage(), e.getExitCode()));
            } catch (IOException e) {
                outcomes.add(FileOutcome.failed(p, "cannot read or write: " + e.getMessage()));
            }
        }
        return outcomes;
    }

    private void writeReport(CoverageReporter reporter) throws IOException {
        if (report == null) {
            for (String line : reporter.lines()) err.println(line);
            return;
        }
        Path parent = report.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        try (Writer w = Files.newBufferedWriter(report, StandardCharsets.UTF_8)) {
            reporter.writeTo(w);
        }
    }
}
