package com.voxelagent.domain.identifier.model.valobj;

/**
 * 目标 ID 值对象：{@code goal_<session-suffix>_<3 位序号>}。
 *
 * @param value         完整的规范字符串
 * @param sessionSuffix 所属会话的随机后缀
 * @param sequence      会话内序号，从 1 开始
 */
public record GoalId(String value, String sessionSuffix, int sequence) {

    @Override
    public String toString() {
        return value;
    }
}
