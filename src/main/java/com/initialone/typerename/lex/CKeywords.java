package com.initialone.typerename.lex;

import java.util.HashSet;
import java.util.Set;

/** C 关键字分组；声明识别与类型推断共用。 */
public final class CKeywords {

    /** 内建类型说明符 */
    public static final Set<String> BUILTIN_TYPES = Set.of(
            "void", "char", "short", "int", "long", "float", "double",
            "signed", "unsigned", "_Bool", "_Complex", "_Imaginary",
            "__int128", "__signed__", "__unsigned__");

    /** 存储类与限定符，可以出现在类型名前后 */
    public static final Set<String> QUALIFIERS = Set.of(
            "static", "extern", "const", "volatile", "register", "auto",
            "inline", "__inline", "__inline__", "restrict", "__restrict", "__restrict__",
            "_Thread_local", "__thread", "_Noreturn", "_Atomic", "__extension__",
            "__const", "__volatile__");

    /** 带括号参数、需要整体跳过的扩展 */
    public static final Set<String> ATTRIBUTES = Set.of(
            "__attribute__", "__attribute", "__declspec", "_Alignas", "__asm__", "__asm", "asm");

    public static final Set<String> TAGS = Set.of("struct", "union", "enum");

    private static final Set<String> STATEMENT_KEYWORDS = Set.of(
            "if", "else", "while", "for", "do", "switch", "case", "default",
            "break", "continue", "goto", "return", "sizeof", "typedef",
            "_Alignof", "__alignof__", "_Generic", "_Static_assert", "typeof", "__typeof__");

    private static final Set<String> ALL;

    static {
        Set<String> all = new HashSet<>();
        all.addAll(BUILTIN_TYPES);
        all.addAll(QUALIFIERS);
        all.addAll(ATTRIBUTES);
        all.addAll(TAGS);
        all.addAll(STATEMENT_KEYWORDS);
        ALL = Set.copyOf(all);
    }

    private CKeywords() {
    }

    public static boolean isKeyword(String word) {
        return ALL.contains(word);
    }
}
