package com.taskquery.task;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

/** 任务优先级，对应 [#A]/[#B]/[#C] */
public enum TaskPriority {
    HIGH("high", "a"),
    MED("med", "b"),
    LOW("low", "c");

    private final String keyword;
    private final String letter;

    TaskPriority(String keyword, String letter) {
        this.keyword = keyword;
        this.letter = letter;
    }

    @JsonValue
    public String keyword() {
        return keyword;
    }

    /**
     * 解析查询或 JSON 中的优先级写法：high/medium/med/low 或 A/B/C，大小写不敏感。
     */
    public static Optional<TaskPriority> fromKeyword(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        if ("medium".equals(normalized)) {
            return Optional.of(MED);
        }
        for (TaskPriority priority : values()) {
            if (priority.keyword.equals(normalized) || priority.letter.equals(normalized)) {
                return Optional.of(priority);
            }
        }
        return Optional.empty();
    }

    @JsonCreator
    public static TaskPriority fromJson(String value) {
        return fromKeyword(value).orElse(null);
    }
}
