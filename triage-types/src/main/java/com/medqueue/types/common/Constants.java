package com.medqueue.types.common;

/**
 * 全局常量定义类。
 * <p>
 * 定义分诊引擎中跨模块共享的常量，如默认科室、文本截断长度等。
 * </p>
 *
 * @author medqueue
 * @since 2025-10-12
 */
public class Constants {

    /** 缓存键字段分隔符 */
    public final static String KEY_SPLIT = "|";

    /** 默认科室 */
    public final static String DEFAULT_DEPARTMENT = "Internal Medicine";

    /** 急诊科室 */
    public final static String EMERGENCY_DEPARTMENT = "Emergency";

    /** 未知流程环节 */
    public final static String UNKNOWN_STAGE = "Unknown";

    /** 日志中病例文本的最大展示长度 */
    public final static int LOG_TEXT_PREVIEW = 50;

}
