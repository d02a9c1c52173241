/**
 * Session 领域 - 规划会话
 *
 * <p>职责：会话 ID 的签发与接纳、会话级规划串行化、已提交规划与命令计数器的生命周期</p>
 *
 * <h3>聚合根</h3>
 * <ul>
 *   <li>{@link com.voxelagent.domain.session.model.entity.PlanningSessionEntity}</li>
 * </ul>
 *
 * @author voxelagent
 * @since 2025-09-09
 */
package com.voxelagent.domain.session;
