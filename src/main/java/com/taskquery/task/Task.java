package com.taskquery.task;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.LocalDate;
import java.util.List;

/**
 * 从文档中提取出的一条待办任务，查询引擎只读使用。
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Task(
        String path,
        int line,
        String rawText,
        String text,
        String state,
        boolean completed,
        TaskPriority priority,
        LocalDate scheduledDate,
        LocalDate deadlineDate,
        Double urgency
) {
    public Task {
        path = path == null ? "" : path;
        rawText = rawText == null ? "" : rawText;
        text = text == null ? "" : text;
        state = state == null ? "" : state;
    }

    /**
     * 以最少字段构造 TODO 任务，rawText 按 "- TODO text" 形式生成。
     */
    public static Task of(String path, String text) {
        return new Task(path, 0, "- TODO " + text, text, "TODO", false, null, null, null, null);
    }

    /** 路径最后一段，即文件名 */
    @JsonIgnore
    public String filename() {
        int slash = path.lastIndexOf('/');
        return slash >= 0 ? path.substring(slash + 1) : path;
    }

    /** 从 rawText 中提取的标签（不含 #） */
    @JsonIgnore
    public List<String> tags() {
        return TaskTags.extract(rawText);
    }

    public Task withState(String newState) {
        boolean done = "DONE".equals(newState) || "CANCELED".equals(newState) || "CANCELLED".equals(newState);
        return new Task(path, line, rawText, text, newState, done, priority, scheduledDate, deadlineDate, urgency);
    }

    public Task withPriority(TaskPriority newPriority) {
        return new Task(path, line, rawText, text, state, completed, newPriority, scheduledDate, deadlineDate, urgency);
    }

    public Task withScheduledDate(LocalDate date) {
        return new Task(path, line, rawText, text, state, completed, priority, date, deadlineDate, urgency);
    }

    public Task withDeadlineDate(LocalDate date) {
        return new Task(path, line, rawText, text, state, completed, priority, scheduledDate, date, urgency);
    }
}
