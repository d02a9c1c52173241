package com.voxelagent.domain.planning.model.valobj;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 上游规划服务返回的原始目标/计划树，所有字段均不可信。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RawGoalPlanTree {

    /**
     * 按输入顺序排列的目标。
     */
    @Builder.Default
    private List<RawGoal> goals = new ArrayList<>();

    /**
     * 给玩家的即时回复，原样透传。
     */
    private String talkToPlayer;

    public boolean isEmpty() {
        return goals == null || goals.isEmpty();
    }
}
