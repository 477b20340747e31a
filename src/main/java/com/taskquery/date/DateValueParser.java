package com.taskquery.date;

import com.taskquery.config.SearchSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.DateTimeException;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 解析 scheduled:/deadline: 的取值。
 *
 * 依次尝试：相对关键字、next N days、yyyy-MM-dd..yyyy-MM-dd 区间、
 * yyyy-MM-dd、yyyy-MM、yyyy；都不匹配时，带引号的值以及 next/this/last xxx、in N days
 * 交给 {@link NaturalDateParser}。
 */
public class DateValueParser {
    private static final Logger logger = LoggerFactory.getLogger(DateValueParser.class);

    private static final Pattern NEXT_N_DAYS_PATTERN = Pattern.compile("next (\\d+) days?");
    private static final Pattern RANGE_PATTERN = Pattern.compile("(\\d{4})-(\\d{2})-(\\d{2})\\.\\.(\\d{4})-(\\d{2})-(\\d{2})");
    private static final Pattern FULL_DATE_PATTERN = Pattern.compile("(\\d{4})-(\\d{2})-(\\d{2})");
    private static final Pattern YEAR_MONTH_PATTERN = Pattern.compile("(\\d{4})-(\\d{2})");
    private static final Pattern YEAR_PATTERN = Pattern.compile("\\d{4}");
    private static final Pattern NATURAL_HINT_PATTERN = Pattern.compile("(?:next|this|last) \\w+|in \\d+ days?");

    private final NaturalDateParser naturalDateParser;

    public DateValueParser(LocalDate today, DayOfWeek weekStart) {
        this.naturalDateParser = new NaturalDateParser(today, weekStart);
    }

    public static DateValueParser forSettings(SearchSettings settings) {
        return new DateValueParser(settings.today(), settings.getWeekStartsOn());
    }

    /**
     * 解析可能带双引号的原文；两端都是引号时视为带引号的值。
     */
    public Optional<ParsedDate> parse(String text) {
        if (text == null) {
            return Optional.empty();
        }
        String trimmed = text.trim();
        if (trimmed.length() >= 2 && trimmed.startsWith("\"") && trimmed.endsWith("\"")) {
            return parse(trimmed.substring(1, trimmed.length() - 1), true);
        }
        return parse(trimmed, false);
    }

    /**
     * @param quoted 值在查询中是否带引号；带引号的未知写法会交给自然语言解析
     */
    public Optional<ParsedDate> parse(String text, boolean quoted) {
        if (text == null) {
            return Optional.empty();
        }
        String normalized = text.trim().toLowerCase(Locale.ROOT).replaceAll("\\s+", " ");
        if (normalized.isEmpty()) {
            return Optional.empty();
        }

        Optional<RelativeDate> keyword = RelativeDate.fromKeyword(normalized);
        if (keyword.isPresent()) {
            return Optional.of(ParsedDate.Relative.of(keyword.get()));
        }

        Matcher matcher = NEXT_N_DAYS_PATTERN.matcher(normalized);
        if (matcher.matches()) {
            return Optional.of(new ParsedDate.Relative(RelativeDate.NEXT_N_DAYS, parseCount(matcher.group(1))));
        }

        matcher = RANGE_PATTERN.matcher(normalized);
        if (matcher.matches()) {
            Optional<LocalDate> start = toDate(matcher.group(1), matcher.group(2), matcher.group(3));
            Optional<LocalDate> end = toDate(matcher.group(4), matcher.group(5), matcher.group(6));
            if (start.isEmpty() || end.isEmpty()) {
                return Optional.empty();
            }
            return Optional.of(new ParsedDate.Range(start.get(), end.get().plusDays(1)));
        }

        matcher = FULL_DATE_PATTERN.matcher(normalized);
        if (matcher.matches()) {
            return toDate(matcher.group(1), matcher.group(2), matcher.group(3))
                    .map(ParsedDate.Absolute::ofDay);
        }

        matcher = YEAR_MONTH_PATTERN.matcher(normalized);
        if (matcher.matches()) {
            return toDate(matcher.group(1), matcher.group(2), "01")
                    .map(date -> new ParsedDate.Absolute(date, DatePrecision.YEAR_MONTH));
        }

        if (YEAR_PATTERN.matcher(normalized).matches()) {
            return Optional.of(new ParsedDate.Absolute(
                    LocalDate.of(Integer.parseInt(normalized), 1, 1), DatePrecision.YEAR));
        }

        if (quoted || NATURAL_HINT_PATTERN.matcher(normalized).matches()) {
            return naturalDateParser.parse(normalized).map(ParsedDate.Absolute::ofDay);
        }
        return Optional.empty();
    }

    /**
     * 解析纯数字计数，溢出 long 时饱和为 Long.MAX_VALUE。
     */
    static long parseCount(String digits) {
        try {
            return Long.parseLong(digits);
        } catch (NumberFormatException overflow) {
            logger.debug("计数超出范围，按最大值处理: {}", digits);
            return Long.MAX_VALUE;
        }
    }

    private static Optional<LocalDate> toDate(String year, String month, String day) {
        try {
            return Optional.of(LocalDate.of(Integer.parseInt(year), Integer.parseInt(month), Integer.parseInt(day)));
        } catch (DateTimeException invalidDate) {
            logger.debug("忽略无效日期: {}-{}-{} ({})", year, month, day, invalidDate.getMessage());
            return Optional.empty();
        }
    }
}
