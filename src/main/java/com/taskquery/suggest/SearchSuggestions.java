package com.taskquery.suggest;

import com.taskquery.query.FilterField;
import com.taskquery.task.Task;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;

/**
 * 前缀过滤的自动补全候选：目录、文件名、标签、任务状态与优先级。
 */
public final class SearchSuggestions {
    /** 默认任务状态 */
    public static final List<String> DEFAULT_STATES = List.of(
            "CANCELED", "CANCELLED", "DOING", "DONE", "IN-PROGRESS", "LATER", "NOW", "TODO", "WAIT", "WAITING");
    /** 优先级可选值 */
    public static final List<String> PRIORITY_OPTIONS = List.of("A", "B", "C", "high", "medium", "low", "none");
    /** 日期字段的相对关键字 */
    public static final List<String> DATE_KEYWORDS = List.of(
            "today", "tomorrow", "overdue", "due", "this week", "next week", "this month", "next month", "none");

    private SearchSuggestions() {
        // 工具类，禁止实例化
    }

    /**
     * 任务路径中出现过的所有上级目录，如 a/b/c.md 产生 a 与 a/b。
     */
    public static List<String> paths(Collection<Task> tasks) {
        Set<String> directories = new TreeSet<>();
        for (Task task : tasks) {
            String[] parts = task.path().split("/");
            StringBuilder prefix = new StringBuilder();
            for (int i = 0; i < parts.length - 1; i++) {
                if (i > 0) {
                    prefix.append('/');
                }
                prefix.append(parts[i]);
                directories.add(prefix.toString());
            }
        }
        return new ArrayList<>(directories);
    }

    public static List<String> files(Collection<Task> tasks) {
        Set<String> names = new TreeSet<>();
        for (Task task : tasks) {
            if (!task.filename().isEmpty()) {
                names.add(task.filename());
            }
        }
        return new ArrayList<>(names);
    }

    public static List<String> tags(Collection<Task> tasks) {
        Set<String> tags = new TreeSet<>();
        for (Task task : tasks) {
            tags.addAll(task.tags());
        }
        return new ArrayList<>(tags);
    }

    /**
     * 指定前缀字段的全部候选。
     */
    public static List<String> forField(FilterField field, Collection<Task> tasks) {
        return switch (field) {
            case PATH -> paths(tasks);
            case FILE -> files(tasks);
            case TAG -> tags(tasks);
            case STATE -> DEFAULT_STATES;
            case PRIORITY -> PRIORITY_OPTIONS;
            case SCHEDULED, DEADLINE -> DATE_KEYWORDS;
            case CONTENT -> List.of();
        };
    }

    /**
     * 按输入做大小写不敏感的包含过滤；输入为空时返回全部候选。
     */
    public static List<String> filter(String input, List<String> suggestions) {
        if (input == null || input.isEmpty()) {
            return suggestions;
        }
        String needle = input.toLowerCase(Locale.ROOT);
        List<String> matched = new ArrayList<>();
        for (String suggestion : suggestions) {
            if (suggestion.toLowerCase(Locale.ROOT).contains(needle)) {
                matched.add(suggestion);
            }
        }
        return matched;
    }
}
