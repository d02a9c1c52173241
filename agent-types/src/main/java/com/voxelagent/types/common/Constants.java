package com.voxelagent.types.common;

/**
 * 全局常量定义类。
 * <p>
 * 定义标识符各字段之间的分隔符、各类实体的前缀以及定宽序号的位数。
 * </p>
 *
 * @author voxelagent
 * @since 2025-09-09
 */
public class Constants {

    /** 标识符字段分隔符 */
    public final static String ID_SEPARATOR = "_";

    /** 会话 ID 前缀 */
    public final static String SESSION_PREFIX = "sess";

    /** 目标 ID 前缀 */
    public final static String GOAL_PREFIX = "goal";

    /** 计划 ID 前缀 */
    public final static String PLAN_PREFIX = "plan";

    /** 命令 ID 前缀，后接完整的计划 ID */
    public final static String COMMAND_PREFIX = "cmd";

    /** 目标序号位数 */
    public final static int GOAL_SEQUENCE_WIDTH = 3;

    /** 目标内计划序号位数 */
    public final static int PLAN_SEQUENCE_WIDTH = 2;

    /** 计划内命令序号位数 */
    public final static int COMMAND_SEQUENCE_WIDTH = 3;

}
