package com.initialone.typerename.bind;

import com.initialone.typerename.lex.LexException;
import com.initialone.typerename.lex.Lexer;
import com.initialone.typerename.lex.SignificantTokens;
import com.initialone.typerename.model.TypeRef;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DeclarationBinderTest {

    static Bindings bind(String src) throws LexException {
        return new DeclarationBinder(new SignificantTokens(Lexer.tokenize(src))).bind();
    }

    /** 第 nth 个（从 0 开始）文本为 text 的位置 */
    static int pos(Bindings b, String text, int nth) {
        SignificantTokens st = b.tokens();
        int seen = 0;
        for (int p = 0; p < st.size(); p++) {
            if (st.text(p).equals(text) && seen++ == nth) return p;
        }
        throw new AssertionError("no occurrence #" + nth + " of " + text);
    }

    @Test
    void recordsAndTypedefAliases() throws LexException {
        Bindings b = bind(""
                + "typedef struct Node_ { struct Node_ *next; int k; } Node;\n"
                + "typedef Node *NodePtr;\n"
                + "typedef struct { int l, c; const char *f; } Loc;\n");
        TypeTable types = b.types();

        assertEquals(new TypeRef("Node_", 1), types.field("Node_", "next").getType());
        assertEquals(new TypeRef("int", 0), types.field("Node_", "k").getType());
        assertEquals(new TypeRef("Node_", 0), types.canonical(new TypeRef("Node", 0)));
        assertEquals(new TypeRef("Node_", 1), types.canonical(new TypeRef("NodePtr", 0)));
        assertEquals(List.of("Node_", "Node"), types.aliasGroup("Node_"));

        assertTrue(types.isRecord("Loc"));
        assertEquals(new TypeRef("int", 0), types.field("Loc", "c").getType());
        assertEquals(new TypeRef("char", 1), types.field("Loc", "f").getType());
        assertEquals(new TypeRef("Loc", 0), types.canonical(new TypeRef("Loc", 0)));
    }

    @Test
    void fieldDeclarationSitesAreRemembered() throws LexException {
        Bindings b = bind("struct Box { int n; struct Box *next; };\n");
        FieldType n = b.fieldDeclaredAt(pos(b, "n", 0));
        assertNotNull(n);
        assertEquals("Box", n.getStructName());
        assertEquals("n", n.getFieldName());
        assertNull(b.fieldDeclaredAt(pos(b, "Box", 0)));
    }

    @Test
    void innerDeclarationShadowsOuter() throws LexException {
        Bindings b = bind(""
                + "int g(Box *b) {\n"
                + "    Pair *b2 = 0;\n"
                + "    {\n"
                + "        Pair *b = 0;\n"
                + "        b->n;\n"
                + "    }\n"
                + "    return b->n;\n"
                + "}\n");
        TypeBinding inner = b.lookup("b", pos(b, "b", 2));
        assertEquals(new TypeRef("Pair", 1), inner.getType());
        assertEquals("g", inner.getFunction());

        TypeBinding param = b.lookup("b", pos(b, "b", 3));
        assertEquals(new TypeRef("Box", 1), param.getType());
        assertEquals(param, b.bindingDeclaredAt(pos(b, "b", 0)));
        assertEquals(new TypeRef("Pair", 1), b.lookup("b2", pos(b, "return", 0)).getType());
    }

    @Test
    void declarationIsVisibleOnlyAfterItsPoint() throws LexException {
        Bindings b = bind(""
                + "void f(void) {\n"
                + "    x;\n"
                + "    Box *x = 0;\n"
                + "    x;\n"
                + "}\n");
        assertNull(b.lookup("x", pos(b, "x", 0)));
        assertEquals(new TypeRef("Box", 1), b.lookup("x", pos(b, "x", 2)).getType());
    }

    @Test
    void forInitIsScopedToTheLoop() throws LexException {
        Bindings b = bind(""
                + "void f(void) {\n"
                + "    for (Box *it = head; it; it = it->next) { it->n; }\n"
                + "    it;\n"
                + "}\n");
        assertEquals(new TypeRef("Box", 1), b.lookup("it", pos(b, "it", 4)).getType());
        assertNull(b.lookup("it", pos(b, "it", 5)));
        assertEquals(Scope.Kind.FOR, b.scopeAt(pos(b, "it", 1)).getKind());
    }

    @Test
    void functionReturnTypesAndInitializerBraces() throws LexException {
        Bindings b = bind(""
                + "Box *box_new(int n);\n"
                + "struct Box b = { .n = 1 };\n"
                + "Pair arr[2] = { { .n = 1 }, { .n = 2 } };\n");
        assertEquals(new TypeRef("Box", 1), b.types().functionReturn("box_new"));
        assertNotNull(b.bindingDeclaredAt(pos(b, "b", 0)));
        assertEquals(new TypeRef("Box", 0), b.initializerType(pos(b, "{", 0)));
        assertEquals(new TypeRef("Pair", 1), b.initializerType(pos(b, "{", 1)));
        assertEquals(new TypeRef("Pair", 1), b.lookup("arr", pos(b, "arr", 0)).getType());
    }

    @Test
    void compoundLiteralBraceHasItsType() throws LexException {
        Bindings b = bind(""
                + "typedef struct Box { int n; } Box;\n"
                + "void f(void) { g((Box){ .n = 3 }); }\n");
        assertEquals(new TypeRef("Box", 0), b.initializerType(pos(b, "{", 2)));
    }

    @Test
    void anonymousMembersBitfieldsAndFunctionPointers() throws LexException {
        Bindings b = bind(""
                + "struct S {\n"
                + "    union { int i; float f; };\n"
                + "    unsigned flag : 1, other : 2;\n"
                + "    struct { int x; } pt;\n"
                + "    int (*cb)(int);\n"
                + "};\n");
        Map<String, FieldType> fields = b.types().fieldsOf("S");
        assertEquals(List.of("i", "f", "flag", "other", "pt", "cb"), List.copyOf(fields.keySet()));
        assertEquals(new TypeRef("float", 0), fields.get("f").getType());
        assertTrue(fields.get("pt").getType().getName().startsWith("<anonymous struct"));
        assertNull(fields.get("cb").getType());
    }

    @Test
    void parametersBindInFunctionScope() throws LexException {
        Bindings b = bind(""
                + "static int parse(const Lexer *lx, int t) { return t; }\n"
                + "int other(int t) { return t; }\n");
        TypeBinding t = b.lookup("t", pos(b, "t", 1));
        assertEquals("parse", t.getFunction());
        assertEquals(new TypeRef("Lexer", 1), b.lookup("lx", pos(b, "return", 0)).getType());
        assertEquals("other", b.lookup("t", pos(b, "t", 3)).getFunction());
        assertEquals(Scope.Kind.FUNCTION, b.scopeAt(pos(b, "return", 1)).getKind());
    }

    @Test
    void expressionStatementsAreNotDeclarations() throws LexException {
        Bindings b = bind(""
                + "void f(Box *b) {\n"
                + "    b->n = 1;\n"
                + "    g(b);\n"
                + "    x = y;\n"
                + "    return;\n"
                + "}\n");
        assertEquals(1, b.bindingCount());
    }

    @Test
    void typeTableIsReadOnlyAfterBinding() throws LexException {
        Bindings b = bind("struct A { int a; };");
        assertThrows(IllegalStateException.class, () -> b.types().defineFunction("f", new TypeRef("int", 0)));
    }
}
