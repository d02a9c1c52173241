package com.voxelagent.domain.planning.adapter.gateway;

import com.voxelagent.domain.planning.model.valobj.RawGoalPlanTree;

/**
 * 规划输出读取端口：把上游规划服务返回的松散文本读成原始目标/计划树。
 */
public interface IPlannerOutputReader {

    /**
     * 读取规划输出。
     *
     * @param plannerOutput 上游返回的原始文本
     * @return 原始树，不做任何 ID 修正
     */
    RawGoalPlanTree read(String plannerOutput);
}
