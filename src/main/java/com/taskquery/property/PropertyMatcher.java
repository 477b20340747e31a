package com.taskquery.property;

import com.taskquery.date.DateMatcher;
import com.taskquery.date.DateValueParser;
import com.taskquery.date.ParsedDate;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 文档属性的匹配规则。
 *
 * 只查找顶层 key，不进入嵌套结构；数组按元素逐个匹配，任一元素命中即可。
 */
public class PropertyMatcher {
    private static final Pattern COMPARISON_PATTERN = Pattern.compile("(>=|<=|>|<)\\s*(-?\\d+(?:\\.\\d+)?)");
    private static final Pattern ISO_DATE_PREFIX = Pattern.compile("(\\d{4}-\\d{2}-\\d{2})(?:[T ].*)?");
    private static final String OR_SEPARATOR = " OR ";

    private final boolean caseSensitive;
    private final DateValueParser dateParser;
    private final DateMatcher dateMatcher;

    public PropertyMatcher(boolean caseSensitive, DateValueParser dateParser, DateMatcher dateMatcher) {
        this.caseSensitive = caseSensitive;
        this.dateParser = dateParser;
        this.dateMatcher = dateMatcher;
    }

    /**
     * @param properties 文档属性，null 表示没有属性
     * @param value      过滤值；null 表示只要求 key 存在（值为 null 也算存在）
     * @param exact      过滤值或 key 带引号，此时值按整体相等比较，是否区分大小写取决于 caseSensitive
     */
    public boolean matches(Map<String, ?> properties, String key, String value, boolean exact) {
        if (properties == null || properties.isEmpty()) {
            return false;
        }
        Optional<String> actualKey = resolveKey(properties, key, exact);
        if (actualKey.isEmpty()) {
            return false;
        }
        if (value == null) {
            return true;
        }

        Object propertyValue = properties.get(actualKey.get());
        if (exact) {
            return matchesValue(propertyValue, value, true);
        }
        for (String alternative : alternatives(value)) {
            if (matchesValue(propertyValue, alternative, false)) {
                return true;
            }
        }
        return false;
    }

    private Optional<String> resolveKey(Map<String, ?> properties, String key, boolean exact) {
        if (properties.containsKey(key)) {
            return Optional.of(key);
        }
        if (caseSensitive) {
            return Optional.empty();
        }
        for (String candidate : properties.keySet()) {
            if (candidate != null && candidate.equalsIgnoreCase(key)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    /**
     * 拆分 "Draft OR Published" 或 "(Draft OR Published)"。
     */
    static List<String> alternatives(String value) {
        String body = value.trim();
        if (body.length() >= 2 && body.startsWith("(") && body.endsWith(")")) {
            body = body.substring(1, body.length() - 1).trim();
        }
        if (!body.contains(OR_SEPARATOR)) {
            return List.of(body);
        }
        List<String> parts = new ArrayList<>();
        for (String part : body.split(Pattern.quote(OR_SEPARATOR))) {
            String trimmed = part.trim();
            if (!trimmed.isEmpty()) {
                parts.add(trimmed);
            }
        }
        return parts;
    }

    private boolean matchesValue(Object propertyValue, String filterValue, boolean exact) {
        Matcher comparison = COMPARISON_PATTERN.matcher(filterValue.trim());
        if (comparison.matches()) {
            return propertyValue instanceof Number number
                    && compare(number.doubleValue(), comparison.group(1), Double.parseDouble(comparison.group(2)));
        }
        if (propertyValue == null) {
            return "null".equalsIgnoreCase(filterValue.trim());
        }
        if (propertyValue instanceof Collection<?> elements) {
            for (Object element : elements) {
                if (element != null && !(element instanceof Map) && !(element instanceof Collection)
                        && matchesScalar(element, filterValue, exact)) {
                    return true;
                }
            }
            return false;
        }
        if (propertyValue instanceof Map) {
            return false;
        }
        return matchesScalar(propertyValue, filterValue, exact);
    }

    private boolean matchesScalar(Object propertyValue, String filterValue, boolean exact) {
        String text = stringify(propertyValue);
        if (exact) {
            return caseSensitive ? text.equals(filterValue) : text.equalsIgnoreCase(filterValue);
        }
        if (caseSensitive ? text.contains(filterValue)
                : text.toLowerCase(Locale.ROOT).contains(filterValue.toLowerCase(Locale.ROOT))) {
            return true;
        }
        return matchesAsDate(propertyValue, filterValue);
    }

    /**
     * 属性值本身是日期时，允许使用 2024-01、today、2024-01-01..2024-01-31 等日期写法。
     */
    private boolean matchesAsDate(Object propertyValue, String filterValue) {
        Optional<LocalDate> propertyDate = toDate(propertyValue);
        if (propertyDate.isEmpty()) {
            return false;
        }
        Optional<ParsedDate> parsed = dateParser.parse(filterValue, false);
        return parsed.isPresent() && dateMatcher.matches(parsed.get(), propertyDate.get());
    }

    private static Optional<LocalDate> toDate(Object propertyValue) {
        if (propertyValue instanceof LocalDate date) {
            return Optional.of(date);
        }
        if (!(propertyValue instanceof String text)) {
            return Optional.empty();
        }
        Matcher matcher = ISO_DATE_PREFIX.matcher(text.trim());
        if (!matcher.matches()) {
            return Optional.empty();
        }
        try {
            return Optional.of(LocalDate.parse(matcher.group(1)));
        } catch (DateTimeParseException invalidDate) {
            return Optional.empty();
        }
    }

    private static boolean compare(double actual, String operator, double expected) {
        return switch (operator) {
            case ">" -> actual > expected;
            case ">=" -> actual >= expected;
            case "<" -> actual < expected;
            case "<=" -> actual <= expected;
            default -> false;
        };
    }

    /** 整数值的浮点数按整数输出，使 1.0 与过滤值 1 一致 */
    private static String stringify(Object value) {
        if ((value instanceof Double || value instanceof Float)) {
            double number = ((Number) value).doubleValue();
            if (!Double.isInfinite(number) && number == Math.rint(number)) {
                return String.valueOf((long) number);
            }
        }
        return String.valueOf(value);
    }
}
