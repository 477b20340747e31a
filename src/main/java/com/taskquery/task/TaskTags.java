package com.taskquery.task;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 从任务原文中提取 #标签。
 *
 * 紧跟在字母、数字、'/'、'&'、'#' 或 '[' 之后的 '#' 不算标签，
 * 从而排除 URL 片段（page#section、/#anchor）和优先级标记 [#A]。
 */
public final class TaskTags {
    private static final Pattern TAG_PATTERN =
            Pattern.compile("(?<![\\p{L}\\p{N}_/&#\\[])#([\\p{L}\\p{N}_][\\p{L}\\p{N}_/\\-]*)");

    private TaskTags() {
        // 工具类，禁止实例化
    }

    /**
     * 按出现顺序返回标签，去掉末尾多余的 '/' 与 '-'。
     */
    public static List<String> extract(String rawText) {
        if (rawText == null || rawText.isEmpty()) {
            return List.of();
        }
        List<String> tags = new ArrayList<>();
        Matcher matcher = TAG_PATTERN.matcher(rawText);
        while (matcher.find()) {
            String tag = trimTrailingSeparators(matcher.group(1));
            if (!tag.isEmpty()) {
                tags.add(tag);
            }
        }
        return tags;
    }

    private static String trimTrailingSeparators(String tag) {
        int end = tag.length();
        while (end > 0 && (tag.charAt(end - 1) == '/' || tag.charAt(end - 1) == '-')) {
            end--;
        }
        return tag.substring(0, end);
    }
}
