package com.initialone.typerename.rules;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.initialone.typerename.model.ConstructorRecord;
import com.initialone.typerename.model.RenameRule;
import com.initialone.typerename.model.RuleFile;
import com.initialone.typerename.model.RuleKind;
import com.initialone.typerename.model.RuleRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * 读取 JSON 规则文件。顶层可以是规则数组，也可以是
 * {"rules": [...], "constructors": [...]} 对象；未知字段直接报错。
 */
public final class RuleTableLoader {
    private static final Logger log = LoggerFactory.getLogger(RuleTableLoader.class);

    private final ObjectMapper om = new ObjectMapper()
            .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .enable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES);

    public RuleTable load(Path path) throws RuleConfigException {
        if (!Files.isRegularFile(path)) {
            throw new RuleConfigException("rule file not found: " + path.toAbsolutePath());
        }
        String json;
        try {
            json = Files.readString(path);
        } catch (IOException e) {
            throw new RuleConfigException("cannot read rule file " + path + ": " + e.getMessage(), e);
        }
        RuleTable table = parse(json, path.toString());
        log.debug("loaded {} rules and {} constructors from {}", table.size(), table.constructors().size(), path);
        return table;
    }

    /** source 只用于错误信息。 */
    public RuleTable parse(String json, String source) throws RuleConfigException {
        RuleFile file;
        try {
            JsonNode root = om.readTree(json);
            if (root == null || root.isMissingNode()) {
                throw new RuleConfigException(source + ": empty rule file");
            }
            if (root.isArray()) {
                file = new RuleFile();
                file.rules = om.readerFor(new TypeReference<List<RuleRecord>>() {}).readValue(root);
            } else if (root.isObject()) {
                file = om.treeToValue(root, RuleFile.class);
            } else {
                throw new RuleConfigException(source + ": expected a JSON array or object");
            }
        } catch (JsonProcessingException e) {
            throw new RuleConfigException(source + ": invalid JSON: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new RuleConfigException(source + ": " + e.getMessage(), e);
        }
        return build(file, source);
    }

    private RuleTable build(RuleFile file, String source) throws RuleConfigException {
        RuleTable.Builder b = RuleTable.builder();
        List<RuleRecord> rules = file.rules == null ? List.of() : file.rules;
        for (int i = 0; i < rules.size(); i++) {
            b.add(toRule(rules.get(i), source + ": rule #" + (i + 1)));
        }
        if (file.constructors != null) {
            for (ConstructorRecord c : file.constructors) {
                if (c == null) throw new RuleConfigException(source + ": null constructor entry");
                b.addConstructor(c.function, c.returns, c.pointerDepth);
            }
        }
        RuleTable table = b.build();
        for (String w : table.warnings()) {
            log.warn("{}: {}", source, w);
        }
        return table;
    }

    private static RenameRule toRule(RuleRecord r, String where) throws RuleConfigException {
        if (r == null) throw new RuleConfigException(where + ": null entry");
        if (r.ownerType == null) throw new RuleConfigException(where + ": missing owner_type");
        if (r.abbreviatedName == null) throw new RuleConfigException(where + ": missing abbreviated_name");
        if (r.canonicalName == null) throw new RuleConfigException(where + ": missing canonical_name");
        RuleKind kind = RuleKind.parse(r.kind == null ? "field" : r.kind);
        if (kind == null) throw new RuleConfigException(where + ": unknown kind '" + r.kind + "'");
        return new RenameRule(r.ownerType.trim(), r.abbreviatedName.trim(), r.canonicalName.trim(), kind);
    }
}
