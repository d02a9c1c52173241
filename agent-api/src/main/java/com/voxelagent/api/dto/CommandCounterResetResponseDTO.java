package com.voxelagent.api.dto;

import lombok.Data;

/**
 * 命令计数器重置响应 DTO
 */
@Data
public class CommandCounterResetResponseDTO {

    private String planId;

    /**
     * 重置前最后签发的命令序号
     */
    private Integer lastSequence;
}
