package com.taskquery.date;

import java.util.Locale;
import java.util.Optional;

/**
 * 相对日期关键字，求值时再根据"今天"解释。
 */
public enum RelativeDate {
    NONE("none"),
    OVERDUE("overdue"),
    DUE("due"),
    TODAY("today"),
    TOMORROW("tomorrow"),
    THIS_WEEK("this week"),
    NEXT_WEEK("next week"),
    THIS_MONTH("this month"),
    NEXT_MONTH("next month"),
    /** next N days，天数由 {@link ParsedDate.Relative#days()} 携带 */
    NEXT_N_DAYS("next n days");

    private final String keyword;

    RelativeDate(String keyword) {
        this.keyword = keyword;
    }

    public String keyword() {
        return keyword;
    }

    /**
     * 按固定词表查找；输入应已去除首尾空白并压缩内部空白。
     */
    public static Optional<RelativeDate> fromKeyword(String text) {
        String normalized = text.toLowerCase(Locale.ROOT);
        for (RelativeDate relative : values()) {
            if (relative != NEXT_N_DAYS && relative.keyword.equals(normalized)) {
                return Optional.of(relative);
            }
        }
        return Optional.empty();
    }
}
