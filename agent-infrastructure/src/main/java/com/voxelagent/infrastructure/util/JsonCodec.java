package com.voxelagent.infrastructure.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.voxelagent.types.enums.ResponseCode;
import com.voxelagent.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

/**
 * JSON 编解码工具。
 *
 * @author voxelagent
 * @since 2025-09-09
 */
@Slf4j
@Component
public class JsonCodec {

    private final ObjectMapper objectMapper;

    /**
     * 创建 JsonCodec。
     */
    public JsonCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * 严格读取 JSON 树。
     */
    public JsonNode readTree(String json) {
        if (StringUtils.isBlank(json)) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "JSON 内容为空");
        }
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException ex) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER.getCode(), "Failed to parse json", ex);
        }
    }

    /**
     * 读取可能被说明文字或代码块包裹的 JSON 对象：先严格解析，失败后截取首个 '{' 到最后一个 '}' 之间的片段再解析。
     */
    public JsonNode readEmbeddedObject(String text) {
        if (StringUtils.isBlank(text)) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "JSON 内容为空");
        }
        String trimmed = text.trim();
        JsonNode strict = tryReadTree(trimmed);
        if (strict != null && strict.isObject()) {
            return strict;
        }
        int start = trimmed.indexOf('{');
        int end = trimmed.lastIndexOf('}');
        if (start < 0 || end <= start) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "未找到 JSON 对象");
        }
        return readTree(trimmed.substring(start, end + 1));
    }

    private JsonNode tryReadTree(String text) {
        try {
            return objectMapper.readTree(text);
        } catch (JsonProcessingException ex) {
            log.debug("Strict json parse failed, fallback to embedded object: {}", ex.getOriginalMessage());
            return null;
        }
    }
}
