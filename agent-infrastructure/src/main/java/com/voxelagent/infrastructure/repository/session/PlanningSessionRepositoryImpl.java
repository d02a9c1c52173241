package com.voxelagent.infrastructure.repository.session;

import com.google.common.cache.Cache;
import com.voxelagent.domain.session.adapter.repository.IPlanningSessionRepository;
import com.voxelagent.domain.session.model.entity.PlanningSessionEntity;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

/**
 * 活跃会话仓储实现：进程内 Guava 缓存，过期与容量策略由缓存配置决定。
 * <p>
 * 后缀台账单独存放在另一个缓存里，保留时间长于会话本身，关闭或淘汰的会话在台账中作为墓碑留存。
 * </p>
 *
 * @author voxelagent
 * @since 2025-09-09
 */
@Repository
public class PlanningSessionRepositoryImpl implements IPlanningSessionRepository {

    private final Cache<String, PlanningSessionEntity> planningSessionCache;
    /** 后缀 -> 会话 ID */
    private final Cache<String, String> sessionSuffixCache;

    public PlanningSessionRepositoryImpl(@Qualifier("planningSessionCache") Cache<String, PlanningSessionEntity> planningSessionCache,
                                         @Qualifier("sessionSuffixCache") Cache<String, String> sessionSuffixCache) {
        this.planningSessionCache = planningSessionCache;
        this.sessionSuffixCache = sessionSuffixCache;
    }

    @Override
    public PlanningSessionEntity saveIfAbsent(PlanningSessionEntity entity) {
        if (entity == null) {
            throw new IllegalArgumentException("entity 不能为空");
        }
        PlanningSessionEntity existing = planningSessionCache.asMap()
                .putIfAbsent(entity.getSessionId().value(), entity);
        return existing == null ? entity : existing;
    }

    @Override
    public PlanningSessionEntity findById(String sessionId) {
        if (StringUtils.isBlank(sessionId)) {
            return null;
        }
        PlanningSessionEntity session = planningSessionCache.getIfPresent(sessionId);
        if (session != null) {
            // 活跃会话的台账条目随访问续期
            sessionSuffixCache.getIfPresent(session.getSessionId().suffix());
        }
        return session;
    }

    @Override
    public boolean deleteById(String sessionId) {
        if (StringUtils.isBlank(sessionId)) {
            return false;
        }
        return planningSessionCache.asMap().remove(sessionId) != null;
    }

    @Override
    public long countActive() {
        planningSessionCache.cleanUp();
        return planningSessionCache.size();
    }

    @Override
    public String findSuffixOwner(String suffix) {
        if (StringUtils.isBlank(suffix)) {
            return null;
        }
        return sessionSuffixCache.getIfPresent(suffix);
    }

    @Override
    public void claimSuffix(String suffix, String sessionId) {
        if (StringUtils.isAnyBlank(suffix, sessionId)) {
            throw new IllegalArgumentException("suffix 和 sessionId 不能为空");
        }
        sessionSuffixCache.put(suffix, sessionId);
    }
}
