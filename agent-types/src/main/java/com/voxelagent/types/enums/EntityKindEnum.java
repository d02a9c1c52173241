package com.voxelagent.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 标识符实体类型枚举
 *
 * @author voxelagent
 * @since 2025-09-09
 */
public enum EntityKindEnum {

    /**
     * 会话
     */
    SESSION("session"),

    /**
     * 目标
     */
    GOAL("goal"),

    /**
     * 计划步骤
     */
    PLAN("plan"),

    /**
     * 可执行命令
     */
    COMMAND("command");

    private final String code;

    EntityKindEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
