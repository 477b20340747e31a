package com.taskquery.config;

import java.time.DayOfWeek;

/**
 * 全局常量定义
 *
 * 包含查询缓存参数、Pratt 解析绑定力和日期参数
 */
public final class Constants {
    private Constants() {
        // 工具类，禁止实例化
    }

    // ==================== 缓存参数 ====================
    /** AST 缓存容量，满后按插入顺序淘汰最早的条目 */
    public static final int AST_CACHE_CAPACITY = 50;

    // ==================== 绑定力 ====================
    /** NOT（-）绑定力 */
    public static final int NOT_BINDING_POWER = 100;
    /** AND 绑定力 */
    public static final int AND_BINDING_POWER = 80;
    /** OR 绑定力 */
    public static final int OR_BINDING_POWER = 60;
    /** 词项、短语、前缀、范围等其余 token 的绑定力 */
    public static final int DEFAULT_BINDING_POWER = 50;

    // ==================== 日期参数 ====================
    /** 默认每周起始日 */
    public static final DayOfWeek DEFAULT_WEEK_START = DayOfWeek.MONDAY;

    // ==================== CLI参数 ====================
    /** 命令行接受的最大查询长度 */
    public static final int MAX_QUERY_LENGTH = 1000;
}
