package com.taskquery.query;

import java.util.Locale;
import java.util.Optional;

/** 前缀过滤支持的字段 */
public enum FilterField {
    PATH,
    FILE,
    TAG,
    STATE,
    PRIORITY,
    CONTENT,
    SCHEDULED,
    DEADLINE;

    public static Optional<FilterField> fromKeyword(String keyword) {
        if (keyword == null) {
            return Optional.empty();
        }
        for (FilterField field : values()) {
            if (field.keyword().equals(keyword)) {
                return Optional.of(field);
            }
        }
        return Optional.empty();
    }

    /** 查询语法中的关键字，如 scheduled */
    public String keyword() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** 只有日期字段可以使用 .. 范围 */
    public boolean isDateField() {
        return this == SCHEDULED || this == DEADLINE;
    }
}
