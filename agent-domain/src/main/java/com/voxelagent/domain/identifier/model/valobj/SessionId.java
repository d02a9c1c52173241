package com.voxelagent.domain.identifier.model.valobj;

/**
 * 会话 ID 值对象：{@code sess_<date>_<time>_<suffix>}。
 *
 * @param value  完整的规范字符串
 * @param suffix 随机后缀，目标 ID 中只嵌入这一段
 */
public record SessionId(String value, String suffix) {

    @Override
    public String toString() {
        return value;
    }
}
