package com.initialone.typerename.model;

import java.util.ArrayList;
import java.util.List;

/**
 * 规则文件的 JSON 结构（对象形式）：
 * <pre>
 * {
 *   "rules":        [ {owner_type, abbreviated_name, canonical_name, kind}, ... ],
 *   "constructors": [ {function, returns, pointer_depth}, ... ]
 * }
 * </pre>
 * 也接受直接以规则数组作为顶层。
 */
public class RuleFile {
    /** 改名规则 */
    public List<RuleRecord> rules = new ArrayList<>();
    /** 构造函数白名单：调用结果的返回类型已知 */
    public List<ConstructorRecord> constructors = new ArrayList<>();
}
