package com.voxelagent.domain.session.model.valobj;

import com.voxelagent.domain.session.model.entity.PlanningSessionEntity;

/**
 * 会话获取结果。
 *
 * @param session 活跃会话
 * @param resumed 是否为恢复已存在的会话
 */
public record SessionAcquisition(PlanningSessionEntity session, boolean resumed) {
}
