package com.voxelagent.api.dto;

import lombok.Data;

/**
 * 命令 ID 签发请求 DTO
 */
@Data
public class CommandIssueRequestDTO {

    /**
     * 被重试的命令 ID，首次下发为空
     */
    private String retryOf;
}
