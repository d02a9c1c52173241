package com.voxelagent.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 活跃会话缓存与后缀台账配置。
 */
@Data
@ConfigurationProperties(prefix = "voxel-agent.session", ignoreInvalidFields = true)
public class SessionProperties {

    /** 会话空闲多久后失效（分钟）。 */
    private long idleTtlMinutes = 120L;

    /** 同时保持的最大活跃会话数。 */
    private long maxActiveSessions = 10_000L;

    /** 后缀台账条目在最后一次访问后保留多久（分钟），关闭或淘汰的会话在此期间不能重新获取。 */
    private long suffixRetentionMinutes = 1440L;

    /** 后缀台账最多保留的条目数，不小于最大活跃会话数。 */
    private long maxRetainedSuffixes = 100_000L;
}
