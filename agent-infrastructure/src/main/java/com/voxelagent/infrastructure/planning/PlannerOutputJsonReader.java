package com.voxelagent.infrastructure.planning;

import com.fasterxml.jackson.databind.JsonNode;
import com.voxelagent.domain.planning.adapter.gateway.IPlannerOutputReader;
import com.voxelagent.domain.planning.model.valobj.RawGoal;
import com.voxelagent.domain.planning.model.valobj.RawGoalPlanTree;
import com.voxelagent.domain.planning.model.valobj.RawPlan;
import com.voxelagent.infrastructure.util.JsonCodec;
import com.voxelagent.types.enums.ResponseCode;
import com.voxelagent.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * 规划输出读取实现：把上游模型返回的 JSON 文本读成原始目标/计划树。
 * <p>
 * 同时兼容多目标结构 {@code {"goals":[...]}} 与单目标结构 {@code {"goal_label":..., "plan":[...]}}，
 * 字段名兼容 snake_case 与 camelCase，ID 可以是字符串或数字，depends_on 可以是数组或单个值。
 * 这里只做形状适配，不修正任何 ID。
 * </p>
 */
@Slf4j
@Component
public class PlannerOutputJsonReader implements IPlannerOutputReader {

    private final JsonCodec jsonCodec;

    public PlannerOutputJsonReader(JsonCodec jsonCodec) {
        this.jsonCodec = jsonCodec;
    }

    @Override
    public RawGoalPlanTree read(String plannerOutput) {
        JsonNode root = jsonCodec.readEmbeddedObject(plannerOutput);
        if (root == null || !root.isObject()) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "规划输出必须是 JSON 对象");
        }

        RawGoalPlanTree tree = new RawGoalPlanTree();
        tree.setTalkToPlayer(readText(root, "talk_to_player", "talkToPlayer"));

        JsonNode goals = firstPresent(root, "goals");
        if (goals != null) {
            if (!goals.isArray()) {
                throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "goals 必须是数组");
            }
            List<RawGoal> rawGoals = new ArrayList<>();
            for (JsonNode goal : goals) {
                rawGoals.add(readGoal(goal));
            }
            tree.setGoals(rawGoals);
            return tree;
        }

        JsonNode plans = firstPresent(root, "plan", "plans", "steps");
        if (plans == null) {
            log.debug("Planner output carries neither goals nor plan, treat as empty tree");
            tree.setGoals(new ArrayList<>());
            return tree;
        }
        // 单目标结构：顶层字段即目标本身
        tree.setGoals(new ArrayList<>(List.of(readGoal(root))));
        return tree;
    }

    private RawGoal readGoal(JsonNode node) {
        RawGoal goal = new RawGoal();
        if (node == null || !node.isObject()) {
            goal.setPlans(new ArrayList<>());
            return goal;
        }
        goal.setId(readText(node, "id", "goal_id", "goalId"));
        goal.setLabel(readText(node, "label", "goal_label", "goalLabel", "description"));

        List<RawPlan> plans = new ArrayList<>();
        JsonNode planNodes = firstPresent(node, "plan", "plans", "steps");
        if (planNodes != null && !planNodes.isArray()) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "plan 必须是数组");
        }
        if (planNodes != null) {
            for (JsonNode planNode : planNodes) {
                plans.add(readPlan(planNode));
            }
        }
        goal.setPlans(plans);
        return goal;
    }

    private RawPlan readPlan(JsonNode node) {
        RawPlan plan = new RawPlan();
        plan.setDependsOn(new ArrayList<>());
        if (node == null || node.isNull()) {
            return plan;
        }
        if (!node.isObject()) {
            plan.setDescription(node.asText());
            return plan;
        }
        plan.setId(readText(node, "id", "plan_id", "planId", "step_id", "stepId"));
        plan.setActionType(readText(node, "action_type", "actionType", "type"));
        plan.setDescription(readText(node, "description", "desc"));
        plan.setDependsOn(readReferences(firstPresent(node, "depends_on", "dependsOn", "dependencies")));
        return plan;
    }

    private List<String> readReferences(JsonNode node) {
        List<String> references = new ArrayList<>();
        if (node == null || node.isNull()) {
            return references;
        }
        if (node.isArray()) {
            for (JsonNode item : node) {
                if (item != null && item.isValueNode() && !item.isNull()) {
                    references.add(item.asText());
                }
            }
            return references;
        }
        if (node.isValueNode()) {
            references.add(node.asText());
            return references;
        }
        throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "depends_on 必须是数组或单个引用");
    }

    private String readText(JsonNode node, String... keys) {
        JsonNode value = firstPresent(node, keys);
        if (value == null || !value.isValueNode()) {
            return null;
        }
        return value.asText();
    }

    private JsonNode firstPresent(JsonNode node, String... keys) {
        if (node == null || keys == null) {
            return null;
        }
        for (String key : keys) {
            JsonNode value = node.get(key);
            if (value != null && !value.isNull()) {
                return value;
            }
        }
        return null;
    }
}
