package com.voxelagent.config;

import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.google.common.cache.RemovalListener;
import com.voxelagent.domain.session.model.entity.PlanningSessionEntity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

/**
 * Guava 缓存配置类。
 * <p>
 * 活跃会话集合保存在进程内缓存中：空闲超时或超出容量的会话被淘汰，
 * 其命令计数器和已提交规划随之丢弃。
 * 后缀台账保留时间更长，用来拒绝已退役会话 ID 和后缀的再次使用。
 * </p>
 *
 * @author voxelagent
 * @since 2025-09-09
 */
@Slf4j
@Configuration
public class GuavaConfig {

    @Bean(name = "planningSessionCache")
    public Cache<String, PlanningSessionEntity> planningSessionCache(SessionProperties properties) {
        RemovalListener<String, PlanningSessionEntity> listener = notification -> {
            if (notification.wasEvicted()) {
                log.info("SESSION_EVICTED sessionId={}, cause={}", notification.getKey(), notification.getCause());
            }
        };
        return CacheBuilder.newBuilder()
                .expireAfterAccess(Math.max(properties.getIdleTtlMinutes(), 1L), TimeUnit.MINUTES)
                .maximumSize(Math.max(properties.getMaxActiveSessions(), 1L))
                .removalListener(listener)
                .build();
    }

    @Bean(name = "sessionSuffixCache")
    public Cache<String, String> sessionSuffixCache(SessionProperties properties) {
        long retentionMinutes = Math.max(properties.getSuffixRetentionMinutes(), properties.getIdleTtlMinutes());
        long maximumSize = Math.max(properties.getMaxRetainedSuffixes(), properties.getMaxActiveSessions());
        return CacheBuilder.newBuilder()
                .expireAfterAccess(Math.max(retentionMinutes, 1L), TimeUnit.MINUTES)
                .maximumSize(Math.max(maximumSize, 1L))
                .build();
    }

}
