package com.voxelagent.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 规范化结果类型
 */
public enum NormalizationOutcomeEnum {

    /**
     * 已规范化，至少包含一个目标
     */
    NORMALIZED("normalized"),

    /**
     * 规划未提出任何目标，按空操作处理
     */
    EMPTY_TREE("empty_tree");

    private final String code;

    NormalizationOutcomeEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
