package com.taskquery.date;

import java.time.DateTimeException;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.Month;
import java.time.temporal.TemporalAdjusters;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 英文自然语言日期解析，只覆盖固定的词表：
 * today/tomorrow/yesterday、in N days/weeks/months、N days/weeks ago、
 * next/this/last 星期几或 week/month/year、start/end of week/month/year、
 * 单独的星期几（今天或之后最近的一天）以及 "january 15, 2025" 这类月份写法。
 */
public class NaturalDateParser {
    private static final Pattern IN_PATTERN = Pattern.compile("in (\\d+) (day|days|week|weeks|month|months)");
    private static final Pattern AGO_PATTERN = Pattern.compile("(\\d+) (day|days|week|weeks|month|months) ago");
    private static final Pattern RELATIVE_PATTERN = Pattern.compile("(next|this|last) (\\w+)");
    private static final Pattern BOUNDARY_PATTERN =
            Pattern.compile("(start|beginning|end) of (?:the )?(?:(this|next|last) )?(week|month|year)");
    private static final Pattern MONTH_DAY_PATTERN =
            Pattern.compile("([a-z]+)\\.? (\\d{1,2})(?:st|nd|rd|th)?(?:,? (\\d{4}))?");
    private static final Pattern DAY_MONTH_PATTERN =
            Pattern.compile("(\\d{1,2})(?:st|nd|rd|th)? ([a-z]+)\\.?(?:,? (\\d{4}))?");

    private static final Map<String, DayOfWeek> WEEKDAYS = Map.ofEntries(
            Map.entry("monday", DayOfWeek.MONDAY), Map.entry("mon", DayOfWeek.MONDAY),
            Map.entry("tuesday", DayOfWeek.TUESDAY), Map.entry("tue", DayOfWeek.TUESDAY),
            Map.entry("wednesday", DayOfWeek.WEDNESDAY), Map.entry("wed", DayOfWeek.WEDNESDAY),
            Map.entry("thursday", DayOfWeek.THURSDAY), Map.entry("thu", DayOfWeek.THURSDAY),
            Map.entry("friday", DayOfWeek.FRIDAY), Map.entry("fri", DayOfWeek.FRIDAY),
            Map.entry("saturday", DayOfWeek.SATURDAY), Map.entry("sat", DayOfWeek.SATURDAY),
            Map.entry("sunday", DayOfWeek.SUNDAY), Map.entry("sun", DayOfWeek.SUNDAY));

    private final LocalDate today;
    private final DayOfWeek weekStart;

    public NaturalDateParser(LocalDate today, DayOfWeek weekStart) {
        this.today = today;
        this.weekStart = weekStart;
    }

    public Optional<LocalDate> parse(String text) {
        if (text == null) {
            return Optional.empty();
        }
        String normalized = text.trim().toLowerCase(Locale.ROOT).replaceAll("\\s+", " ");
        if (normalized.endsWith(".")) {
            normalized = normalized.substring(0, normalized.length() - 1);
        }

        switch (normalized) {
            case "today", "now":
                return Optional.of(today);
            case "tomorrow":
                return Optional.of(today.plusDays(1));
            case "yesterday":
                return Optional.of(today.minusDays(1));
            default:
                break;
        }

        DayOfWeek weekday = WEEKDAYS.get(normalized);
        if (weekday != null) {
            return Optional.of(today.with(TemporalAdjusters.nextOrSame(weekday)));
        }

        Matcher matcher = IN_PATTERN.matcher(normalized);
        if (matcher.matches()) {
            return shift(DateValueParser.parseCount(matcher.group(1)), matcher.group(2));
        }
        matcher = AGO_PATTERN.matcher(normalized);
        if (matcher.matches()) {
            return shift(-DateValueParser.parseCount(matcher.group(1)), matcher.group(2));
        }
        matcher = BOUNDARY_PATTERN.matcher(normalized);
        if (matcher.matches()) {
            return Optional.of(boundary(matcher.group(1), offset(matcher.group(2)), matcher.group(3)));
        }
        matcher = RELATIVE_PATTERN.matcher(normalized);
        if (matcher.matches()) {
            return relative(offset(matcher.group(1)), matcher.group(2));
        }
        matcher = MONTH_DAY_PATTERN.matcher(normalized);
        if (matcher.matches()) {
            return monthDay(matcher.group(1), matcher.group(2), matcher.group(3));
        }
        matcher = DAY_MONTH_PATTERN.matcher(normalized);
        if (matcher.matches()) {
            return monthDay(matcher.group(2), matcher.group(1), matcher.group(3));
        }
        return Optional.empty();
    }

    /**
     * 结果超出 LocalDate 范围时没有可匹配的日期，返回空。
     */
    private Optional<LocalDate> shift(long amount, String unit) {
        try {
            if (unit.startsWith("week")) {
                return Optional.of(today.plusWeeks(amount));
            }
            if (unit.startsWith("month")) {
                return Optional.of(today.plusMonths(amount));
            }
            return Optional.of(today.plusDays(amount));
        } catch (DateTimeException | ArithmeticException outOfRange) {
            return Optional.empty();
        }
    }

    private static int offset(String qualifier) {
        if ("next".equals(qualifier)) {
            return 1;
        }
        if ("last".equals(qualifier)) {
            return -1;
        }
        return 0;
    }

    /**
     * next/this/last 加星期几时，取目标周内的那一天；加 week/month/year 时取该周期的第一天。
     */
    private Optional<LocalDate> relative(int offset, String unit) {
        DayOfWeek weekday = WEEKDAYS.get(unit);
        if (weekday != null) {
            LocalDate targetWeekStart = startOfWeek().plusWeeks(offset);
            return Optional.of(targetWeekStart.with(TemporalAdjusters.nextOrSame(weekday)));
        }
        return switch (unit) {
            case "week" -> Optional.of(startOfWeek().plusWeeks(offset));
            case "month" -> Optional.of(today.withDayOfMonth(1).plusMonths(offset));
            case "year" -> Optional.of(today.withDayOfYear(1).plusYears(offset));
            default -> Optional.empty();
        };
    }

    private LocalDate boundary(String edge, int offset, String unit) {
        boolean end = "end".equals(edge);
        return switch (unit) {
            case "week" -> {
                LocalDate start = startOfWeek().plusWeeks(offset);
                yield end ? start.plusDays(6) : start;
            }
            case "month" -> {
                LocalDate start = today.withDayOfMonth(1).plusMonths(offset);
                yield end ? start.with(TemporalAdjusters.lastDayOfMonth()) : start;
            }
            default -> {
                LocalDate start = today.withDayOfYear(1).plusYears(offset);
                yield end ? start.with(TemporalAdjusters.lastDayOfYear()) : start;
            }
        };
    }

    private Optional<LocalDate> monthDay(String monthText, String dayText, String yearText) {
        Optional<Month> month = parseMonth(monthText);
        if (month.isEmpty()) {
            return Optional.empty();
        }
        int year = yearText == null ? today.getYear() : Integer.parseInt(yearText);
        try {
            return Optional.of(LocalDate.of(year, month.get(), Integer.parseInt(dayText)));
        } catch (DateTimeException invalidDate) {
            return Optional.empty();
        }
    }

    private static Optional<Month> parseMonth(String text) {
        if (text.length() < 3) {
            return Optional.empty();
        }
        for (Month month : Month.values()) {
            String name = month.name().toLowerCase(Locale.ROOT);
            if (name.equals(text) || name.substring(0, 3).equals(text)) {
                return Optional.of(month);
            }
        }
        if ("sept".equals(text)) {
            return Optional.of(Month.SEPTEMBER);
        }
        return Optional.empty();
    }

    private LocalDate startOfWeek() {
        return today.with(TemporalAdjusters.previousOrSame(weekStart));
    }
}
