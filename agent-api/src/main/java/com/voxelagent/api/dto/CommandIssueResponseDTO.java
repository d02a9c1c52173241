package com.voxelagent.api.dto;

import lombok.Data;

/**
 * 命令 ID 签发响应 DTO
 */
@Data
public class CommandIssueResponseDTO {

    private String commandId;

    private String planId;

    private Integer sequence;

    private String attemptOf;

    private Integer attemptNumber;
}
