package com.voxelagent.types.enums;

import lombok.Getter;

/**
 * 统一响应码枚举。
 * <p>
 * 定义系统中所有API响应的响应码和对应描述信息。1xxx 段为标识符签发与规范化相关的业务错误。
 * </p>
 *
 * @author voxelagent
 * @since 2025-09-09
 */
@Getter
public enum ResponseCode {

    /** 成功 */
    SUCCESS("0000", "成功"),

    /** 未知错误 */
    UN_ERROR("0001", "未知失败"),

    /** 非法参数 */
    ILLEGAL_PARAMETER("0002", "非法参数"),

    /** 序号非法（内部不变量被破坏，不可重试） */
    INVALID_SEQUENCE("1001", "序号非法"),

    /** 依赖引用无法解析，整次规划被拒绝 */
    UNRESOLVED_DEPENDENCY("1002", "依赖引用无法解析"),

    /** 计划从未登记过计数器 */
    UNKNOWN_PLAN("1003", "未知计划"),

    /** 客户端提供的会话 ID 格式不合法 */
    INVALID_SESSION_FORMAT("1004", "会话ID格式不合法"),

    /** 会话不存在或已关闭 */
    SESSION_NOT_FOUND("1005", "会话不存在或已关闭");

    private final String code;
    private final String info;

    ResponseCode(String code, String info) {
        this.code = code;
        this.info = info;
    }

}
