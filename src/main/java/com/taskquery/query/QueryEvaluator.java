package com.taskquery.query;

import com.taskquery.config.SearchSettings;
import com.taskquery.date.DateMatcher;
import com.taskquery.date.DateValueParser;
import com.taskquery.date.ParsedDate;
import com.taskquery.property.PropertyMatcher;
import com.taskquery.task.Task;
import com.taskquery.task.TaskPriority;

import java.time.LocalDate;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.regex.Pattern;

/**
 * 将 AST 与单个任务匹配。
 *
 * 结果统一以 CompletableFuture 返回：属性过滤需要异步查询文档属性，其余节点同步完成。
 * AND/OR 依次求值并短路，后续子节点在前一个结果确定后才会开始。
 */
public class QueryEvaluator {
    private static final Pattern WORD_CHAR = Pattern.compile("\\w");

    private final boolean caseSensitive;
    private final SearchSettings settings;
    private final DateValueParser dateParser;
    private final DateMatcher dateMatcher;
    private final PropertyMatcher propertyMatcher;

    public QueryEvaluator(boolean caseSensitive, SearchSettings settings) {
        this.caseSensitive = caseSensitive;
        this.settings = settings == null ? SearchSettings.defaults() : settings;
        this.dateParser = DateValueParser.forSettings(this.settings);
        this.dateMatcher = DateMatcher.forSettings(this.settings);
        this.propertyMatcher = new PropertyMatcher(caseSensitive, dateParser, dateMatcher);
    }

    public CompletableFuture<Boolean> evaluate(QueryNode node, Task task) {
        if (node instanceof QueryNode.And and) {
            return allMatch(and.children(), 0, task);
        }
        if (node instanceof QueryNode.Or or) {
            return anyMatch(or.children(), 0, task);
        }
        if (node instanceof QueryNode.Not not) {
            return evaluate(not.child(), task).thenApply(matched -> !matched);
        }
        if (node instanceof QueryNode.Term term) {
            return CompletableFuture.completedFuture(matchesTerm(term.value(), task));
        }
        if (node instanceof QueryNode.Phrase phrase) {
            return CompletableFuture.completedFuture(matchesPhrase(phrase.value(), task));
        }
        if (node instanceof QueryNode.PrefixFilter filter) {
            return CompletableFuture.completedFuture(matchesPrefix(filter, task));
        }
        if (node instanceof QueryNode.RangeFilter range) {
            return CompletableFuture.completedFuture(matchesRange(range, task));
        }
        if (node instanceof QueryNode.PropertyFilter property) {
            return matchesProperty(property, task);
        }
        throw new IllegalStateException("未知节点类型: " + node);
    }

    private CompletableFuture<Boolean> allMatch(List<QueryNode> children, int index, Task task) {
        if (index >= children.size()) {
            return CompletableFuture.completedFuture(true);
        }
        return evaluate(children.get(index), task).thenCompose(matched -> matched
                ? allMatch(children, index + 1, task)
                : CompletableFuture.completedFuture(false));
    }

    private CompletableFuture<Boolean> anyMatch(List<QueryNode> children, int index, Task task) {
        if (index >= children.size()) {
            return CompletableFuture.completedFuture(false);
        }
        return evaluate(children.get(index), task).thenCompose(matched -> matched
                ? CompletableFuture.completedFuture(true)
                : anyMatch(children, index + 1, task));
    }

    /**
     * 词项在 rawText、text、path、文件名任一字段中出现即匹配。
     */
    private boolean matchesTerm(String term, Task task) {
        for (String field : searchableFields(task)) {
            if (contains(field, term)) {
                return true;
            }
        }
        return false;
    }

    /**
     * 短语按整词匹配，短语内的标点按字面处理。
     * 只有短语首尾是 ASCII 单词字符时才要求该端不与其他单词字符相连，"c++" 这类以标点结尾的短语照常匹配。
     */
    private boolean matchesPhrase(String phrase, Task task) {
        int flags = caseSensitive ? 0 : Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;
        boolean hasText = !phrase.isEmpty();
        String head = hasText && isWordChar(phrase.charAt(0)) ? "(?<!\\w)" : "";
        String tail = hasText && isWordChar(phrase.charAt(phrase.length() - 1)) ? "(?!\\w)" : "";
        Pattern pattern = Pattern.compile(head + Pattern.quote(phrase) + tail, flags);
        for (String field : searchableFields(task)) {
            if (pattern.matcher(field).find()) {
                return true;
            }
        }
        return false;
    }

    private static boolean isWordChar(char c) {
        return WORD_CHAR.matcher(String.valueOf(c)).matches();
    }

    private boolean matchesPrefix(QueryNode.PrefixFilter filter, Task task) {
        String value = filter.value();
        return switch (filter.field()) {
            case PATH -> matchesPath(task.path(), value);
            case FILE -> contains(task.filename(), value);
            case CONTENT -> contains(task.text(), value) || contains(task.rawText(), value);
            case STATE -> caseSensitive ? task.state().equals(value) : task.state().equalsIgnoreCase(value);
            case PRIORITY -> matchesPriority(task.priority(), value);
            case TAG -> matchesTag(task, value, filter.exact());
            case SCHEDULED -> matchesDate(value, filter.exact(), task.scheduledDate());
            case DEADLINE -> matchesDate(value, filter.exact(), task.deadlineDate());
        };
    }

    /**
     * 路径按目录片段匹配：等于完整路径、是开头的目录或中间的完整目录片段。
     * 文件名片段交给 file:，因此 path:a.md 不匹配 notes/a.md。
     */
    private boolean matchesPath(String path, String value) {
        String wanted = trimSlashes(normalizeCase(value));
        if (wanted.isEmpty()) {
            return false;
        }
        String actual = trimSlashes(normalizeCase(path));
        return actual.equals(wanted)
                || actual.startsWith(wanted + "/")
                || actual.contains("/" + wanted + "/");
    }

    private static boolean matchesPriority(TaskPriority priority, String value) {
        if ("none".equalsIgnoreCase(value.trim())) {
            return priority == null;
        }
        Optional<TaskPriority> wanted = TaskPriority.fromKeyword(value);
        return wanted.isPresent() && wanted.get() == priority;
    }

    /**
     * 未加引号时 tag:x 同时匹配 #x 与 #x/y；加引号时只匹配 #x。
     */
    private boolean matchesTag(Task task, String value, boolean exact) {
        String wanted = normalizeCase(value.startsWith("#") ? value.substring(1) : value);
        if (wanted.isEmpty()) {
            return false;
        }
        for (String tag : task.tags()) {
            String candidate = normalizeCase(tag);
            if (candidate.equals(wanted)) {
                return true;
            }
            if (!exact && candidate.startsWith(wanted + "/")) {
                return true;
            }
        }
        return false;
    }

    private boolean matchesDate(String value, boolean quoted, LocalDate date) {
        Optional<ParsedDate> parsed = dateParser.parse(value, quoted);
        return parsed.isPresent() && dateMatcher.matches(parsed.get(), date);
    }

    private boolean matchesRange(QueryNode.RangeFilter range, Task task) {
        LocalDate date = range.field() == FilterField.DEADLINE ? task.deadlineDate() : task.scheduledDate();
        Optional<ParsedDate> start = dateParser.parse(range.start(), false);
        Optional<ParsedDate> end = dateParser.parse(range.end(), false);
        if (start.isEmpty() || end.isEmpty()) {
            return false;
        }
        return dateMatcher.matchesBetween(start.get(), end.get(), date);
    }

    private CompletableFuture<Boolean> matchesProperty(QueryNode.PropertyFilter filter, Task task) {
        CompletableFuture<Map<String, Object>> lookup = settings.getPropertyLookup().lookup(task.path());
        if (lookup == null) {
            return CompletableFuture.completedFuture(false);
        }
        return lookup.thenApply(properties ->
                propertyMatcher.matches(properties, filter.key(), filter.value(), filter.exact()));
    }

    private static List<String> searchableFields(Task task) {
        return List.of(task.rawText(), task.text(), task.path(), task.filename());
    }

    private boolean contains(String haystack, String needle) {
        if (haystack == null || needle == null) {
            return false;
        }
        return normalizeCase(haystack).contains(normalizeCase(needle));
    }

    private String normalizeCase(String text) {
        return caseSensitive ? text : text.toLowerCase(Locale.ROOT);
    }

    private static String trimSlashes(String text) {
        int start = 0;
        int end = text.length();
        while (start < end && text.charAt(start) == '/') {
            start++;
        }
        while (end > start && text.charAt(end - 1) == '/') {
            end--;
        }
        return text.substring(start, end);
    }
}
