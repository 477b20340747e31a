package com.taskquery.date;

import java.time.LocalDate;

/**
 * 日期表达式的解析结果。
 */
public sealed interface ParsedDate permits ParsedDate.Absolute, ParsedDate.Range, ParsedDate.Relative {

    /**
     * 绝对日期。年份精度归一到 1 月 1 日，年月精度归一到当月 1 日。
     */
    record Absolute(LocalDate date, DatePrecision precision) implements ParsedDate {

        public static Absolute ofDay(LocalDate date) {
            return new Absolute(date, DatePrecision.FULL);
        }

        /** 匹配窗口起点（含） */
        public LocalDate windowStart() {
            return date;
        }

        /** 匹配窗口终点（不含） */
        public LocalDate windowEndExclusive() {
            return switch (precision) {
                case FULL -> date.plusDays(1);
                case YEAR_MONTH -> date.plusMonths(1);
                case YEAR -> date.plusYears(1);
            };
        }

        public boolean contains(LocalDate candidate) {
            return !candidate.isBefore(windowStart()) && candidate.isBefore(windowEndExclusive());
        }
    }

    /**
     * 显式区间 [start, endExclusive)。
     */
    record Range(LocalDate start, LocalDate endExclusive) implements ParsedDate {

        public boolean contains(LocalDate candidate) {
            return !candidate.isBefore(start) && candidate.isBefore(endExclusive);
        }
    }

    /**
     * 相对日期关键字；只有 NEXT_N_DAYS 使用 days，超出 long 的天数饱和为 Long.MAX_VALUE。
     */
    record Relative(RelativeDate keyword, long days) implements ParsedDate {

        public static Relative of(RelativeDate keyword) {
            return new Relative(keyword, 0);
        }
    }
}
