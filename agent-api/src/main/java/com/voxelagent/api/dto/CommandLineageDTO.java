package com.voxelagent.api.dto;

import lombok.Data;

/**
 * 命令血缘 DTO：由命令 ID 自身还原出的完整祖先链
 */
@Data
public class CommandLineageDTO {

    private String commandId;

    private String sessionId;

    private String goalId;

    private String planId;

    private Integer goalSequence;

    private Integer planSequence;

    private Integer commandSequence;

    private String actionType;

    private String description;

    private String attemptOf;

    private Integer attemptNumber;

    /** 所属计划的计数器是否已重置退役 */
    private Boolean planRetired;
}
