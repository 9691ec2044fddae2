package com.initialone.typerename.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public class RuleRecord {
    /** struct/union 名，或 "any" */
    @JsonProperty("owner_type")
    public String ownerType;

    @JsonProperty("abbreviated_name")
    public String abbreviatedName;

    @JsonProperty("canonical_name")
    public String canonicalName;

    /** field | function | type | variable */
    @JsonProperty("kind")
    public String kind;

    public RuleRecord() {
    }

    public RuleRecord(String ownerType, String abbreviatedName, String canonicalName, String kind) {
        this.ownerType = ownerType;
        this.abbreviatedName = abbreviatedName;
        this.canonicalName = canonicalName;
        this.kind = kind;
    }
}
