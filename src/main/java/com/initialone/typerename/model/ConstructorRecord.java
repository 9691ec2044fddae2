package com.initialone.typerename.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public class ConstructorRecord {
    @JsonProperty("function")
    public String function;

    /** 返回的类型名；省略时取本翻译单元中该函数声明的返回类型 */
    @JsonProperty("returns")
    public String returns;

    @JsonProperty("pointer_depth")
    public int pointerDepth = 1;
}
