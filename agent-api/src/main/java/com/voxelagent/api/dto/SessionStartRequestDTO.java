package com.voxelagent.api.dto;

import lombok.Data;

/**
 * 会话启动请求 DTO
 */
@Data
public class SessionStartRequestDTO {

    /**
     * 渲染客户端自带的会话 ID，为空时由服务端签发
     */
    private String sessionId;
}
