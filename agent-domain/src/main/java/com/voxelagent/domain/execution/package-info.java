/**
 * Execution 领域 - 命令 ID 的按需签发
 *
 * <p>职责：执行层每下发一条命令前，从所属会话的计数器注册表中取得下一个命令 ID；
 * 命令 ID 从不预分配、从不复用，重试通过 attempt-of 关系关联到原命令。</p>
 *
 * @author voxelagent
 * @since 2025-09-09
 */
package com.voxelagent.domain.execution;
