package com.taskquery.config;

import com.taskquery.property.PropertyLookup;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.Objects;

/**
 * 查询求值时的运行时配置
 *
 * 由宿主在每次 evaluate 时注入；为 null 时使用 {@link #defaults()}
 */
public class SearchSettings {
    private DayOfWeek weekStartsOn = Constants.DEFAULT_WEEK_START;
    private Clock clock = Clock.systemDefaultZone();
    private PropertyLookup propertyLookup = PropertyLookup.NONE;

    public DayOfWeek getWeekStartsOn() {
        return weekStartsOn;
    }

    /**
     * 只接受周一或周日作为每周起始日。
     */
    public void setWeekStartsOn(DayOfWeek weekStartsOn) {
        if (weekStartsOn != DayOfWeek.MONDAY && weekStartsOn != DayOfWeek.SUNDAY) {
            throw new IllegalArgumentException("每周起始日只能是 MONDAY 或 SUNDAY: " + weekStartsOn);
        }
        this.weekStartsOn = weekStartsOn;
    }

    public Clock getClock() {
        return clock;
    }

    public void setClock(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public PropertyLookup getPropertyLookup() {
        return propertyLookup;
    }

    public void setPropertyLookup(PropertyLookup propertyLookup) {
        this.propertyLookup = Objects.requireNonNull(propertyLookup, "propertyLookup");
    }

    /**
     * 按配置时钟计算"今天"。
     */
    public LocalDate today() {
        return LocalDate.now(clock);
    }

    /**
     * 使用默认配置创建实例
     */
    public static SearchSettings defaults() {
        return new SearchSettings();
    }
}
