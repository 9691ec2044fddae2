package com.initialone.typerename.util;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

public class Tools {
    /** 源文件按字节读写：ISO-8859-1 下每个字节对应一个 char，偏移量就是字节偏移 */
    public static final Charset SOURCE_CHARSET = StandardCharsets.ISO_8859_1;

    private Tools() {
    }

    public static String readSource(Path p) throws IOException {
        return new String(Files.readAllBytes(p), SOURCE_CHARSET);
    }

    public static void writeSource(Path p, String text) throws IOException {
        Files.write(p, text.getBytes(SOURCE_CHARSET));
    }

    /** 递归列出 root 下扩展名匹配的文件，按路径排序。 */
    public static List<Path> listFiles(Path root, List<String> exts) throws IOException {
        Set<String> allow = exts.stream()
                .map(s -> s.trim().toLowerCase(Locale.ROOT))
                .filter(s -> !s.isEmpty())
                .map(s -> s.startsWith(".") ? s : "." + s)
                .collect(Collectors.toSet());
        List<Path> out = new ArrayList<>();
        try (var s = Files.walk(root)) {
            s.filter(Files::isRegularFile)
                    .filter(p -> allow.contains(extOf(p)))
                    .forEach(out::add);
        }
        out.sort(Comparator.comparing(Path::toString));
        return out;
    }

    public static String extOf(Path p) {
        String n = p.getFileName().toString().toLowerCase(Locale.ROOT);
        int i = n.lastIndexOf('.');
        return (i >= 0 ? n.substring(i) : "");
    }

    public static <T> List<List<T>> chunk(List<T> in, int n) {
        List<List<T>> batches = new ArrayList<>();
        int i = 0;
        while (i < in.size()) {
            int j = Math.min(i + n, in.size());
            batches.add(in.subList(i, j));
            i = j;
        }
        return batches;
    }
}
