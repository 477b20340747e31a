package com.taskquery.date;

import com.taskquery.config.SearchSettings;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;
import java.util.Optional;

/**
 * 以固定的"今天"和每周起始日判断任务日期是否落在解析后的日期表达式内。
 */
public class DateMatcher {
    private final LocalDate today;
    private final DayOfWeek weekStart;

    public DateMatcher(LocalDate today, DayOfWeek weekStart) {
        this.today = today;
        this.weekStart = weekStart;
    }

    public static DateMatcher forSettings(SearchSettings settings) {
        return new DateMatcher(settings.today(), settings.getWeekStartsOn());
    }

    /**
     * none 只匹配空日期；其余表达式遇到空日期一律不匹配。
     */
    public boolean matches(ParsedDate parsed, LocalDate date) {
        if (parsed instanceof ParsedDate.Relative relative && relative.keyword() == RelativeDate.NONE) {
            return date == null;
        }
        if (date == null) {
            return false;
        }
        if (parsed instanceof ParsedDate.Relative relative) {
            return matchesRelative(relative, date);
        }
        if (parsed instanceof ParsedDate.Absolute absolute) {
            return absolute.contains(date);
        }
        if (parsed instanceof ParsedDate.Range range) {
            return range.contains(date);
        }
        throw new IllegalStateException("未知日期表达式: " + parsed);
    }

    /**
     * start..end 区间：起点取表达式窗口的第一天，终点取窗口的最后一天（含）。
     * 无法确定边界的表达式（如 overdue）不匹配任何日期。
     */
    public boolean matchesBetween(ParsedDate start, ParsedDate end, LocalDate date) {
        if (date == null) {
            return false;
        }
        Optional<LocalDate> lower = lowerBound(start);
        Optional<LocalDate> upper = upperBoundExclusive(end);
        if (lower.isEmpty() || upper.isEmpty()) {
            return false;
        }
        return !date.isBefore(lower.get()) && date.isBefore(upper.get());
    }

    private boolean matchesRelative(ParsedDate.Relative relative, LocalDate date) {
        LocalDate weekBegin = today.with(TemporalAdjusters.previousOrSame(weekStart));
        return switch (relative.keyword()) {
            case NONE -> false;
            case OVERDUE -> date.isBefore(today);
            case DUE -> !date.isAfter(today);
            case TODAY -> date.equals(today);
            case TOMORROW -> date.equals(today.plusDays(1));
            case THIS_WEEK -> !date.isBefore(weekBegin) && date.isBefore(weekBegin.plusWeeks(1));
            case NEXT_WEEK -> !date.isBefore(weekBegin.plusWeeks(1)) && date.isBefore(weekBegin.plusWeeks(2));
            case THIS_MONTH -> YearMonth.from(date).equals(YearMonth.from(today));
            case NEXT_MONTH -> YearMonth.from(date).equals(YearMonth.from(today).plusMonths(1));
            case NEXT_N_DAYS -> !date.isBefore(today) && !date.isAfter(daysAhead(relative.days()));
        };
    }

    /**
     * 天数超过 LocalDate 能表示的范围时收敛到 LocalDate.MAX。
     */
    private LocalDate daysAhead(long days) {
        long remaining = ChronoUnit.DAYS.between(today, LocalDate.MAX);
        return days >= remaining ? LocalDate.MAX : today.plusDays(days);
    }

    private Optional<LocalDate> lowerBound(ParsedDate parsed) {
        if (parsed instanceof ParsedDate.Absolute absolute) {
            return Optional.of(absolute.windowStart());
        }
        if (parsed instanceof ParsedDate.Range range) {
            return Optional.of(range.start());
        }
        return anchor(parsed);
    }

    private Optional<LocalDate> upperBoundExclusive(ParsedDate parsed) {
        if (parsed instanceof ParsedDate.Absolute absolute) {
            return Optional.of(absolute.windowEndExclusive());
        }
        if (parsed instanceof ParsedDate.Range range) {
            return Optional.of(range.endExclusive());
        }
        return anchor(parsed).map(date -> date.plusDays(1));
    }

    /** today/tomorrow 可作为区间端点 */
    private Optional<LocalDate> anchor(ParsedDate parsed) {
        if (parsed instanceof ParsedDate.Relative relative) {
            if (relative.keyword() == RelativeDate.TODAY) {
                return Optional.of(today);
            }
            if (relative.keyword() == RelativeDate.TOMORROW) {
                return Optional.of(today.plusDays(1));
            }
        }
        return Optional.empty();
    }
}
