package com.initialone.typerename.commands;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RewriteCmdTest {

    private static final String RULES = "{\"rules\":["
            + "{\"owner_type\":\"Box\",\"abbreviated_name\":\"n\",\"canonical_name\":\"size\",\"kind\":\"field\"}"
            + "]}";
    private static final String SRC = "struct Box { int n; };\nint f(struct Box *b) { return b->n; }\n";
    private static final String OUT = "struct Box { int size; };\nint f(struct Box *b) { return b->size; }\n";

    @TempDir
    Path dir;

    private Path rules;
    private final ByteArrayOutputStream stdout = new ByteArrayOutputStream();
    private final ByteArrayOutputStream stderr = new ByteArrayOutputStream();

    @BeforeEach
    void setUp() throws IOException {
        rules = dir.resolve("rules.json");
        Files.writeString(rules, RULES);
    }

    private int run(String... args) {
        RewriteCmd cmd = new RewriteCmd();
        cmd.out = new PrintStream(stdout, true);
        cmd.err = new PrintStream(stderr, true);
        return new CommandLine(cmd).execute(args);
    }

    private Path write(String name, String text) throws IOException {
        Path p = dir.resolve(name);
        Files.createDirectories(p.getParent());
        Files.writeString(p, text);
        return p;
    }

    private String err() {
        return stderr.toString(StandardCharsets.UTF_8);
    }

    @Test
    void writesRewrittenTextToStdout() throws IOException {
        Path a = write("a.c", SRC);
        assertEquals(0, run("--rules", rules.toString(), a.toString()));
        assertEquals(OUT, stdout.toString(StandardCharsets.ISO_8859_1));
        assertEquals(SRC, Files.readString(a));
        assertTrue(err().contains("0 unresolved occurrence(s)"), err());
    }

    @Test
    void rewritesInPlace() throws IOException {
        Path a = write("a.c", SRC);
        assertEquals(0, run("--rules", rules.toString(), "--in-place", a.toString()));
        assertEquals(OUT, Files.readString(a));
        assertEquals(0, stdout.size());
    }

    @Test
    void dryRunWritesNothing() throws IOException {
        Path a = write("a.c", SRC);
        assertEquals(0, run("--rules", rules.toString(), "--in-place", "--dry-run", a.toString()));
        assertEquals(SRC, Files.readString(a));
        assertTrue(err().contains("(dry-run)"));
    }

    @Test
    void unresolvedOccurrencesGoToTheReport() throws IOException {
        Path a = write("a.c", "struct Box { int n; };\nint g(void) { return get()->n; }\n");
        Path report = dir.resolve("out/report.txt");
        assertEquals(1, run("--rules", rules.toString(), "--report", report.toString(), a.toString()));
        List<String> lines = Files.readAllLines(report);
        assertEquals(List.of(a + ":2:29: cannot resolve owner type for 'n'", "1 unresolved occurrence(s)"), lines);
    }

    @Test
    void lexErrorDoesNotStopOtherFiles() throws IOException {
        Path bad = write("bad.c", "char *s = \"open;\n");
        Path good = write("good.c", SRC);
        assertEquals(2, run("--rules", rules.toString(), "--in-place", bad.toString(), good.toString()));
        assertEquals(OUT, Files.readString(good));
        assertTrue(err().contains(bad + ":1:11: unterminated string literal"), err());
    }

    @Test
    void missingInputIsReported() throws IOException {
        Path good = write("good.c", SRC);
        assertEquals(2, run("--rules", rules.toString(), dir.resolve("missing.c").toString(), good.toString()));
        assertEquals(OUT, stdout.toString(StandardCharsets.ISO_8859_1));
        assertTrue(err().contains("no such file or directory"));
    }

    @Test
    void badRuleTableExitsBeforeRewriting() throws IOException {
        Path a = write("a.c", SRC);
        Files.writeString(rules, "[{\"owner_type\":\"Box\",\"abbreviated_name\":\"n\",\"canonical_name\":\"size\"},"
                + "{\"owner_type\":\"Box\",\"abbreviated_name\":\"n\",\"canonical_name\":\"count\"}]");
        assertEquals(3, run("--rules", rules.toString(), "--in-place", a.toString()));
        assertEquals(SRC, Files.readString(a));
        assertEquals(3, run("--rules", dir.resolve("none.json").toString(), a.toString()));
    }

    @Test
    void directoriesAreWalkedByExtension() throws IOException {
        Path c = write("src/a.c", SRC);
        Path h = write("src/inc/b.h", SRC);
        Path txt = write("src/notes.txt", SRC);
        assertEquals(0, run("--rules", rules.toString(), "--in-place", dir.resolve("src").toString()));
        assertEquals(OUT, Files.readString(c));
        assertEquals(OUT, Files.readString(h));
        assertEquals(SRC, Files.readString(txt));
    }

    @Test
    void batchedOutputKeepsInputOrder() throws IOException {
        Path a = write("1.c", "struct Box { int n; }; /* 1 */\n");
        Path b = write("2.c", "struct Box { int n; }; /* 2 */\n");
        Path c = write("3.c", "struct Box { int n; }; /* 3 */\n");
        assertEquals(0, run("--rules", rules.toString(), "--batch", "1", "--max-concurrent", "3",
                c.toString(), a.toString(), b.toString()));
        assertEquals("struct Box { int size; }; /* 3 */\n"
                + "struct Box { int size; }; /* 1 */\n"
                + "struct Box { int size; }; /* 2 */\n", stdout.toString(StandardCharsets.ISO_8859_1));
    }

    @Test
    void nonAsciiBytesRoundTrip() throws IOException {
        Path a = dir.resolve("latin.c");
        byte[] src = "struct Box { int n; }; /* éÿ */\n".getBytes(StandardCharsets.ISO_8859_1);
        Files.write(a, src);
        assertEquals(0, run("--rules", rules.toString(), "--in-place", a.toString()));
        byte[] expected = "struct Box { int size; }; /* éÿ */\n".getBytes(StandardCharsets.ISO_8859_1);
        assertEquals(new String(expected, StandardCharsets.ISO_8859_1),
                new String(Files.readAllBytes(a), StandardCharsets.ISO_8859_1));
    }

    @Test
    void inPlaceAndStdoutAreExclusive() throws IOException {
        Path a = write("a.c", SRC);
        int code = run("--rules", rules.toString(), "--in-place", "--stdout", a.toString());
        assertEquals(CommandLine.ExitCode.USAGE, code);
        assertEquals(SRC, Files.readString(a));
    }
}
