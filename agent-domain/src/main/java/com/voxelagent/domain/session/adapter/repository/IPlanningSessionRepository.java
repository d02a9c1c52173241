package com.voxelagent.domain.session.adapter.repository;

import com.voxelagent.domain.session.model.entity.PlanningSessionEntity;

/**
 * 活跃会话仓储接口
 *
 * @author voxelagent
 * @since 2025-09-09
 */
public interface IPlanningSessionRepository {

    /**
     * 不存在时保存；已存在时返回已有会话，不覆盖
     */
    PlanningSessionEntity saveIfAbsent(PlanningSessionEntity entity);

    /**
     * 根据会话 ID 查询活跃会话，不存在返回 null
     */
    PlanningSessionEntity findById(String sessionId);

    /**
     * 根据会话 ID 删除
     */
    boolean deleteById(String sessionId);

    /**
     * 活跃会话数量
     */
    long countActive();

    /**
     * 查询后缀的占用者会话 ID，未占用返回 null。会话关闭或淘汰后占用记录仍保留一段时间
     */
    String findSuffixOwner(String suffix);

    /**
     * 登记后缀归属
     */
    void claimSuffix(String suffix, String sessionId);
}
