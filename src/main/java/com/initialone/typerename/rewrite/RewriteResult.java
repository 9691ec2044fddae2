package com.initialone.typerename.rewrite;

import com.initialone.typerename.model.Occurrence;

import java.util.Collections;
import java.util.List;

/** 单个文件的改写结果。 */
public final class RewriteResult {
    private final String file;
    private final String source;
    private final String output;
    private final List<Occurrence> occurrences;

    public RewriteResult(String file, String source, String output, List<Occurrence> occurrences) {
        this.file = file;
        this.source = source;
        this.output = output;
        this.occurrences = Collections.unmodifiableList(occurrences);
    }

    public String getFile() { return file; }

    public String getOutput() { return output; }

    public List<Occurrence> getOccurrences() { return occurrences; }

    public boolean isChanged() {
        return !source.equals(output);
    }

    public long count(Occurrence.Status status) {
        return occurrences.stream().filter(o -> o.getStatus() == status).count();
    }

    public long renamedCount() {
        return count(Occurrence.Status.RENAMED);
    }

    public long unresolvedCount() {
        return count(Occurrence.Status.UNRESOLVED);
    }

    public long conflictCount() {
        return count(Occurrence.Status.CONFLICT);
    }
}
