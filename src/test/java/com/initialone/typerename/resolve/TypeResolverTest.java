package com.initialone.typerename.resolve;

import com.initialone.typerename.bind.Bindings;
import com.initialone.typerename.bind.DeclarationBinder;
import com.initialone.typerename.lex.LexException;
import com.initialone.typerename.lex.Lexer;
import com.initialone.typerename.lex.SignificantTokens;
import com.initialone.typerename.model.TypeRef;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class TypeResolverTest {

    private static final String TYPES = ""
            + "typedef struct Box { int n; struct Box *next; } Box;\n"
            + "typedef struct Pair { int n; } Pair;\n"
            + "typedef struct Holder { Box items[4]; Pair *pairs; Box inner; } Holder;\n";

    private Map<String, TypeRef> constructors;

    @BeforeEach
    void setUp() {
        constructors = new HashMap<>();
        // 不写返回类型：取翻译单元里的声明
        constructors.put("box_new", null);
    }

    private TypeResolver resolver(Bindings b) {
        return new TypeResolver(b, constructors);
    }

    private static Bindings bind(String src) throws LexException {
        return new DeclarationBinder(new SignificantTokens(Lexer.tokenize(src))).bind();
    }

    /** 第 nth 个 n 前面那个运算符所访问的 owner */
    private String ownerOfNth(Bindings b, int nth) {
        SignificantTokens st = b.tokens();
        int seen = 0;
        for (int p = 0; p < st.size(); p++) {
            if (st.text(p).equals("n") && seen++ == nth) return resolver(b).ownerOf(p - 1);
        }
        throw new AssertionError("no n #" + nth);
    }

    @Test
    void memberAccessExpressions() throws LexException {
        Bindings b = bind(TYPES
                + "Box *box_new(void);\n"
                + "Pair *pair_get(void);\n"
                + "void f(Box *p, Box **pp, Box arr[], Holder h, Holder *hp) {\n"
                + "    p->n;\n"
                + "    (*pp)->n;\n"
                + "    arr[1].n;\n"
                + "    (&h.inner)->n;\n"
                + "    h.items[0].n;\n"
                + "    hp->pairs[2].n;\n"
                + "    ((Pair *) p)->n;\n"
                + "    box_new()->n;\n"
                + "    pair_get()->n;\n"
                + "    p.n;\n"
                + "    unknown->n;\n"
                + "    p->next->next->n;\n"
                + "}\n");
        assertEquals("Box", ownerOfNth(b, 2), "variable");
        assertEquals("Box", ownerOfNth(b, 3), "dereference");
        assertEquals("Box", ownerOfNth(b, 4), "subscript");
        assertEquals("Box", ownerOfNth(b, 5), "address-of member");
        assertEquals("Box", ownerOfNth(b, 6), "member subscript");
        assertEquals("Pair", ownerOfNth(b, 7), "arrow then subscript");
        assertEquals("Pair", ownerOfNth(b, 8), "cast");
        assertEquals("Box", ownerOfNth(b, 9), "whitelisted constructor");
        assertNull(ownerOfNth(b, 10), "call outside the whitelist");
        assertNull(ownerOfNth(b, 11), "'.' on a pointer");
        assertNull(ownerOfNth(b, 12), "no binding");
        assertEquals("Box", ownerOfNth(b, 13), "chain");
    }

    @Test
    void constructorWithExplicitReturnType() throws LexException {
        constructors.put("make", new TypeRef("Pair", 1));
        Bindings b = bind(TYPES + "int g(void) { return make(1, 2)->n; }\n");
        assertEquals("Pair", ownerOfNth(b, 2));
    }

    @Test
    void callThroughFunctionPointerMemberIsUnknown() throws LexException {
        constructors.put("make", new TypeRef("Pair", 1));
        Bindings b = bind(TYPES + "void g(Holder *ops) { ops->make()->n; }\n");
        assertNull(ownerOfNth(b, 2));
    }

    @Test
    void designatedInitializers() throws LexException {
        Bindings b = bind(TYPES
                + "Holder g = { .inner = { .n = 1 }, .items = { [1].n = 2, { .n = 3 } }, .pairs = 0 };\n"
                + "Box one = { .n = 4 };\n");
        assertEquals("Box", ownerOfNth(b, 2), "nested designator");
        assertEquals("Box", ownerOfNth(b, 3), "array element designator");
        assertEquals("Box", ownerOfNth(b, 4), "array element brace");
        assertEquals("Box", ownerOfNth(b, 5), "plain designator");
    }

    @Test
    void compoundLiteralDesignator() throws LexException {
        Bindings b = bind(TYPES + "void g(void) { use((Pair){ .n = 1 }); }\n");
        assertEquals("Pair", ownerOfNth(b, 2));
    }

    @Test
    void innerScopeDecidesTheOwner() throws LexException {
        Bindings b = bind(TYPES
                + "void g(Box *x) {\n"
                + "    { Pair *x = 0; x->n; }\n"
                + "    x->n;\n"
                + "}\n");
        assertEquals("Pair", ownerOfNth(b, 2));
        assertEquals("Box", ownerOfNth(b, 3));
    }

    @Test
    void builtinTypesAreNeverOwners() throws LexException {
        Bindings b = bind("void g(int *v) { v->n; }\n");
        assertNull(ownerOfNth(b, 0));
    }

    @Test
    void typedefToPointerCountsItsDepth() throws LexException {
        Bindings b = bind(TYPES
                + "typedef Box *BoxRef;\n"
                + "void g(BoxRef r, BoxRef *rr) { r->n; (*rr)->n; r.n; }\n");
        assertEquals("Box", ownerOfNth(b, 2));
        assertEquals("Box", ownerOfNth(b, 3));
        assertNull(ownerOfNth(b, 4));
    }
}
