package com.voxelagent.api.dto;

import lombok.Data;

import java.time.LocalDateTime;

/**
 * 会话启动响应 DTO
 */
@Data
public class SessionStartResponseDTO {

    private String sessionId;

    /**
     * 会话随机后缀，嵌入本会话所有目标 ID
     */
    private String suffix;

    private Boolean clientSupplied;

    /**
     * 是否恢复了已存在的会话
     */
    private Boolean resumed;

    private Integer committedGoalCount;

    private LocalDateTime createdAt;
}
