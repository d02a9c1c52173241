/**
 * Planning 领域 - 规划输出规范化
 *
 * <p>职责：把上游规划服务返回的原始目标/计划树改写为只含规范 ID 的等价树，并一致地改写依赖引用</p>
 *
 * <h3>核心概念</h3>
 * <ul>
 *   <li>原始 ID：上游给出的任意字符串，不可信</li>
 *   <li>规范化：以单次规划调用为事务，全部成功或整体拒绝</li>
 *   <li>依赖边：计划对同一棵树内其它计划或目标的引用</li>
 * </ul>
 *
 * @author voxelagent
 * @since 2025-09-09
 */
package com.voxelagent.domain.planning;
