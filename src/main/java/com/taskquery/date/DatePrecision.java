package com.taskquery.date;

/** 绝对日期的精度，决定匹配时的窗口大小 */
public enum DatePrecision {
    /** yyyy-MM-dd，匹配当天 */
    FULL,
    /** yyyy-MM，匹配整月 */
    YEAR_MONTH,
    /** yyyy，匹配整年 */
    YEAR
}
