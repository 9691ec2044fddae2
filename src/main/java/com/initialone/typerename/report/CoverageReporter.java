package com.initialone.typerename.report;

import com.initialone.typerename.model.Occurrence;
import com.initialone.typerename.rewrite.RewriteResult;

import java.io.IOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.List;

/**
 * 汇总没有改写的可疑出现：owner 推不出的（UNRESOLVED）和别名规则冲突的（CONFLICT）。
 *
 * <pre>
 * a.c:12:9: cannot resolve owner type for 'n'
 * a.c:20:5: conflicting rules for 'n' on 'Box'
 * 1 unresolved occurrence(s)
 * </pre>
 */
public final class CoverageReporter {
    public static final int EXIT_OK = 0;
    public static final int EXIT_UNRESOLVED = 1;

    private final List<String> lines = new ArrayList<>();
    private long unresolved;
    private long conflicts;

    /** 按调用顺序累积；调用方负责按输入顺序添加。 */
    public void add(RewriteResult result) {
        for (Occurrence o : result.getOccurrences()) {
            String at = result.getFile() + ":" + o.getLine() + ":" + o.getColumn() + ": ";
            if (o.getStatus() == Occurrence.Status.UNRESOLVED) {
                lines.add(at + "cannot resolve owner type for '" + o.getName() + "'");
                unresolved++;
            } else if (o.getStatus() == Occurrence.Status.CONFLICT) {
                lines.add(at + "conflicting rules for '" + o.getName() + "' on '" + o.getOwner() + "'");
                conflicts++;
            }
        }
    }

    public long getUnresolved() {
        return unresolved;
    }

    public long getConflicts() {
        return conflicts;
    }

    public List<String> lines() {
        List<String> all = new ArrayList<>(lines);
        all.add(unresolved + " unresolved occurrence(s)");
        return all;
    }

    public void writeTo(Writer w) throws IOException {
        for (String line : lines()) {
            w.write(line);
            w.write(System.lineSeparator());
        }
        w.flush();
    }

    public int exitCode() {
        return exitCodeOf(unresolved, conflicts);
    }

    public static int exitCodeOf(RewriteResult result) {
        return exitCodeOf(result.unresolvedCount(), result.conflictCount());
    }

    private static int exitCodeOf(long unresolved, long conflicts) {
        return unresolved > 0 || conflicts > 0 ? EXIT_UNRESOLVED : EXIT_OK;
    }
}
