package com.voxelagent.api.dto;

import lombok.Data;

/**
 * 会话关闭响应 DTO
 */
@Data
public class SessionCloseResponseDTO {

    private String sessionId;

    private Boolean closed;
}
