package com.voxelagent.test.support;

import com.google.common.cache.CacheBuilder;
import com.voxelagent.domain.session.model.entity.PlanningSessionEntity;
import com.voxelagent.infrastructure.repository.session.PlanningSessionRepositoryImpl;

/**
 * 会话仓储测试装配：使用真实的缓存仓储实现。
 */
public final class SessionTestSupport {

    private SessionTestSupport() {
    }

    public static PlanningSessionRepositoryImpl newRepository() {
        return new PlanningSessionRepositoryImpl(
                CacheBuilder.newBuilder()
                        .maximumSize(1000)
                        .<String, PlanningSessionEntity>build(),
                CacheBuilder.newBuilder()
                        .maximumSize(1000)
                        .<String, String>build());
    }
}
