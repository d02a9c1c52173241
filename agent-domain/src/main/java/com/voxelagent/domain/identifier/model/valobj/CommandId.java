package com.voxelagent.domain.identifier.model.valobj;

/**
 * 命令 ID 值对象：{@code cmd_<完整计划 ID>_<3 位命令序号>}。
 * <p>
 * 嵌入完整的计划 ID，单凭字符串即可还原整条血缘。
 * </p>
 *
 * @param value    完整的规范字符串
 * @param plan     所属计划
 * @param sequence 计划内命令序号，从 1 开始
 */
public record CommandId(String value, PlanId plan, int sequence) {

    @Override
    public String toString() {
        return value;
    }
}
