package com.voxelagent.api.dto;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * 规范化后的规划结果 DTO
 */
@Data
public class PlanningResultDTO {

    private String sessionId;

    /**
     * normalized / empty_tree
     */
    private String outcome;

    private String talkToPlayer;

    private List<GoalDTO> goals = new ArrayList<>();

    @Data
    public static class GoalDTO {

        private String goalId;

        /**
         * 上游原始 ID，仅供排查
         */
        private String rawId;

        private String label;

        private List<PlanDTO> plans = new ArrayList<>();
    }

    @Data
    public static class PlanDTO {

        private String planId;

        private String rawId;

        private String actionType;

        private String description;

        private List<DependencyDTO> dependsOn = new ArrayList<>();
    }

    @Data
    public static class DependencyDTO {

        private String target;

        private String targetKind;

        private String rawReference;
    }
}
