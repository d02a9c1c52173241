/**
 * Identifier 领域 - 规范标识符的签发与校验
 *
 * <p>职责：为会话、目标、计划、命令四类实体生成层级化的规范 ID，并判定外部字符串是否符合规范格式</p>
 *
 * <h3>规范格式</h3>
 * <ul>
 *   <li>Session - sess_&lt;yyyyMMdd&gt;_&lt;HHmmss&gt;_&lt;suffix&gt;</li>
 *   <li>Goal - goal_&lt;suffix&gt;_&lt;3 位序号&gt;</li>
 *   <li>Plan - plan_&lt;3 位目标序号&gt;_&lt;2 位计划序号&gt;</li>
 *   <li>Command - cmd_&lt;完整计划 ID&gt;_&lt;3 位命令序号&gt;</li>
 * </ul>
 *
 * <h3>领域服务</h3>
 * <ul>
 *   <li>{@link com.voxelagent.domain.identifier.service.IdentifierFormatter} - 唯一的规范 ID 来源</li>
 * </ul>
 *
 * @author voxelagent
 * @since 2025-09-09
 */
package com.voxelagent.domain.identifier;
