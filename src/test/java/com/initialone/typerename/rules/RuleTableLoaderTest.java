package com.initialone.typerename.rules;

import com.initialone.typerename.model.RuleKind;
import com.initialone.typerename.model.TypeRef;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RuleTableLoaderTest {

    private final RuleTableLoader loader = new RuleTableLoader();

    private static String rule(String owner, String abbr, String canonical, String kind) {
        return "{\"owner_type\":\"" + owner + "\",\"abbreviated_name\":\"" + abbr
                + "\",\"canonical_name\":\"" + canonical + "\",\"kind\":\"" + kind + "\"}";
    }

    private RuleTable parse(String json) throws RuleConfigException {
        return loader.parse(json, "test.json");
    }

    private RuleConfigException rejects(String json) {
        RuleConfigException e = assertThrows(RuleConfigException.class, () -> parse(json));
        assertEquals(RuleConfigException.EXIT_CODE, e.getExitCode());
        return e;
    }

    @Test
    void arrayForm() throws RuleConfigException {
        RuleTable t = parse("[" + rule("Box", "n", "size", "field") + ","
                + rule("Pair", "n", "count", "field") + ","
                + rule("any", "len", "length", "function") + "]");
        assertEquals(3, t.size());
        assertEquals("size", t.fieldRule("Box", "n").getCanonical());
        assertEquals("count", t.fieldRule("Pair", "n").getCanonical());
        assertEquals(RuleKind.FUNCTION, t.globalRule("len").getKind());
        assertNull(t.globalFieldRule("len"));
        assertTrue(t.hasOwnerFieldRules("n"));
        assertTrue(t.constructors().isEmpty());
    }

    @Test
    void objectFormWithConstructors() throws RuleConfigException {
        RuleTable t = parse("{\"rules\":[" + rule("parse", "t", "token", "variable") + "],"
                + "\"constructors\":[{\"function\":\"node_new\",\"returns\":\"Node\",\"pointer_depth\":1},"
                + "{\"function\":\"box_new\"}]}");
        assertEquals("token", t.localVariableRule("parse", "t").getCanonical());
        assertNull(t.localVariableRule("other", "t"));
        assertTrue(t.mentions("t"));
        assertEquals(new TypeRef("Node", 1), t.constructors().get("node_new"));
        assertTrue(t.constructors().containsKey("box_new"));
        assertNull(t.constructors().get("box_new"));
    }

    @Test
    void kindDefaultsToField() throws RuleConfigException {
        RuleTable t = parse("[{\"owner_type\":\"Box\",\"abbreviated_name\":\"n\",\"canonical_name\":\"size\"}]");
        assertNotNull(t.fieldRule("Box", "n"));
    }

    @Test
    void identicalDuplicatesAreAcceptedWithWarning() throws RuleConfigException {
        RuleTable t = parse("[" + rule("Box", "n", "size", "field") + "," + rule("Box", "n", "size", "field") + "]");
        assertEquals(1, t.size());
        assertEquals(1, t.warnings().size());
    }

    @Test
    void contradictoryKeysAreRejected() {
        RuleConfigException e = rejects("[" + rule("Box", "n", "size", "field") + ","
                + rule("Box", "n", "count", "field") + "]");
        assertTrue(e.getMessage().contains("conflicting rules"), e.getMessage());
    }

    @Test
    void invalidRecordsAreRejected() {
        rejects("[" + rule("Box", "", "size", "field") + "]");
        rejects("[" + rule("Box", "n", "2size", "field") + "]");
        rejects("[" + rule("Box", "n", "int", "field") + "]");
        rejects("[" + rule("Box", "n", "size", "method") + "]");
        rejects("[" + rule("Box", "len", "length", "function") + "]");
        rejects("[" + rule("Box", "T", "Type", "type") + "]");
        rejects("[{\"owner_type\":\"Box\",\"canonical_name\":\"size\"}]");
        rejects("[{\"owner_type\":\"Box\",\"abbreviated_name\":\"n\",\"canonical_name\":\"size\",\"colour\":1}]");
        rejects("{\"rules\":[],\"extra\":true}");
        rejects("{\"constructors\":[{\"function\":\"f\",\"pointer_depth\":-1}]}");
        rejects("\"just a string\"");
        rejects("[ not json");
    }

    @Test
    void renamingIntoAnotherAbbreviationIsRejected() {
        rejects("[" + rule("Box", "n", "s", "field") + "," + rule("Box", "s", "size", "field") + "]");
        rejects("[" + rule("Box", "n", "s", "field") + "," + rule("any", "s", "str", "variable") + "]");
    }

    @Test
    void globalTargetMustNotBeAnOwnedAbbreviation() {
        RuleConfigException e = rejects("[" + rule("any", "n", "count", "field") + ","
                + rule("Box", "count", "size", "field") + "]");
        assertTrue(e.getMessage().contains("'count'"), e.getMessage());
        rejects("[" + rule("any", "len", "size", "function") + "," + rule("parse", "size", "sz", "variable") + "]");
    }

    @Test
    void renamedTypeMustNotOwnOtherRules() {
        RuleConfigException e = rejects("[" + rule("any", "Box", "Pair", "type") + ","
                + rule("Pair", "n", "count", "field") + "]");
        assertTrue(e.getMessage().contains("'Pair'"), e.getMessage());
    }

    @Test
    void renamedFunctionMustNotBecomeAConstructor() {
        rejects("{\"rules\":[" + rule("any", "mk", "box_new", "function") + "],"
                + "\"constructors\":[{\"function\":\"box_new\",\"returns\":\"Box\"}]}");
    }

    @Test
    void typeRuleAndRulesOnTheOldOwnerCoexist() throws RuleConfigException {
        RuleTable t = parse("[" + rule("any", "Box", "Bucket", "type") + ","
                + rule("Box", "n", "size", "field") + "]");
        assertEquals(2, t.size());
    }

    @Test
    void sameCanonicalOnDifferentOwnersIsFine() throws RuleConfigException {
        RuleTable t = parse("[" + rule("Box", "n", "size", "field") + "," + rule("Pair", "sz", "size", "field") + "]");
        assertEquals(2, t.size());
        assertEquals(2, t.countByKind().get(RuleKind.FIELD));
        assertEquals(0, t.countByKind().get(RuleKind.TYPE));
    }

    @Test
    void loadFromFile(@TempDir Path dir) throws IOException, RuleConfigException {
        Path f = dir.resolve("rules.json");
        Files.writeString(f, "[" + rule("Box", "n", "size", "field") + "]");
        assertEquals(1, loader.load(f).size());
    }

    @Test
    void missingFileIsAConfigError(@TempDir Path dir) {
        RuleConfigException e = assertThrows(RuleConfigException.class, () -> loader.load(dir.resolve("nope.json")));
        assertEquals(3, e.getExitCode());
        assertTrue(e.getMessage().contains("not found"));
    }
}
