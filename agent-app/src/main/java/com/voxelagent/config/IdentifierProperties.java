package com.voxelagent.config;

import com.voxelagent.domain.identifier.service.IdentifierFormatDomainService;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 标识符签发配置。
 */
@Data
@ConfigurationProperties(prefix = "voxel-agent.identifier", ignoreInvalidFields = true)
public class IdentifierProperties {

    /** 会话随机后缀长度。 */
    private int suffixLength = IdentifierFormatDomainService.DEFAULT_SUFFIX_LENGTH;

    /** 签发会话后缀使用的字符表，校验时接受任意小写字母数字。 */
    private String suffixAlphabet = IdentifierFormatDomainService.DEFAULT_SUFFIX_ALPHABET;

    /** 会话时间戳使用的时区，为空时取系统时区。 */
    private String zoneId;
}
