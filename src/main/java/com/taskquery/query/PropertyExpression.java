package com.taskquery.query;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 方括号属性语法的解码结果：[key]、[key:value]、["key":"value"]。
 *
 * @param key         属性名（已去掉一层引号）
 * @param value       属性值；仅有属性名时为 null
 * @param keyQuoted   属性名是否带引号
 * @param valueQuoted 属性值是否带引号
 */
public record PropertyExpression(String key, String value, boolean keyQuoted, boolean valueQuoted) {

    static final Pattern BRACKET_PATTERN = Pattern.compile(
            "\\[(?:\"((?:[^\"\\\\]|\\\\.)*)\"|([^\\s:\"\\]]+))"
                    + "(?:\\s*:\\s*(?:\"((?:[^\"\\\\]|\\\\.)*)\"|([^\\]]*)))?\\]");

    /**
     * 解析完整的方括号原文，原文不合法时返回 empty。
     */
    public static Optional<PropertyExpression> parse(String bracketText) {
        if (bracketText == null) {
            return Optional.empty();
        }
        Matcher matcher = BRACKET_PATTERN.matcher(bracketText);
        if (!matcher.matches()) {
            return Optional.empty();
        }
        return Optional.of(fromMatch(matcher));
    }

    /**
     * 由已匹配 {@link #BRACKET_PATTERN} 的 matcher 构造。
     */
    static PropertyExpression fromMatch(Matcher matcher) {
        boolean keyQuoted = matcher.group(1) != null;
        String key = keyQuoted ? unescape(matcher.group(1)) : matcher.group(2);

        if (matcher.group(3) != null) {
            return new PropertyExpression(key, unescape(matcher.group(3)), keyQuoted, true);
        }
        String rawValue = matcher.group(4);
        if (rawValue == null || rawValue.isBlank()) {
            // [key:] 与 [key] 等价
            return new PropertyExpression(key, null, keyQuoted, false);
        }
        return new PropertyExpression(key, rawValue.trim(), keyQuoted, false);
    }

    public boolean keyOnly() {
        return value == null;
    }

    /** 带引号的属性名或属性值都表示精确匹配 */
    public boolean exact() {
        return keyQuoted || valueQuoted;
    }

    /** 规范形式：key 或 key:value */
    public String canonical() {
        return keyOnly() ? key : key + ":" + value;
    }

    private static String unescape(String quoted) {
        return quoted.replace("\\\"", "\"");
    }
}
