package com.taskquery.date;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.DayOfWeek;
import java.time.LocalDate;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

class NaturalDateParserTest {

    /** 2025-06-18，星期三 */
    private final NaturalDateParser mondayParser = new NaturalDateParser(LocalDate.of(2025, 6, 18), DayOfWeek.MONDAY);
    private final NaturalDateParser sundayParser = new NaturalDateParser(LocalDate.of(2025, 6, 18), DayOfWeek.SUNDAY);

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "today | 2025-06-18",
            "Tomorrow | 2025-06-19",
            "yesterday | 2025-06-17",
            "friday | 2025-06-20",
            "wednesday | 2025-06-18",
            "in 3 days | 2025-06-21",
            "in 2 weeks | 2025-07-02",
            "in 1 month | 2025-07-18",
            "3 days ago | 2025-06-15",
            "next friday | 2025-06-27",
            "this friday | 2025-06-20",
            "last monday | 2025-06-09",
            "next week | 2025-06-23",
            "next month | 2025-07-01",
            "last year | 2024-01-01",
            "end of month | 2025-06-30",
            "start of next week | 2025-06-23",
            "end of the year | 2025-12-31",
            "january 15, 2026 | 2026-01-15",
            "Dec 25 | 2025-12-25",
            "3rd march | 2025-03-03",
            "sept 1st | 2025-09-01"
    })
    void testMondayWeek(String text, String expected) {
        assertEquals(LocalDate.parse(expected), mondayParser.parse(text).orElseThrow());
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "next week | 2025-06-22",
            "next monday | 2025-06-23",
            "end of week | 2025-06-21",
            "this sunday | 2025-06-15"
    })
    void testSundayWeek(String text, String expected) {
        assertEquals(LocalDate.parse(expected), sundayParser.parse(text).orElseThrow());
    }

    @ParameterizedTest
    @ValueSource(strings = {"someday", "next decade", "february 30", "in a while", "ma 5", "",
            "in 999999999999 days", "99999999999 weeks ago", "in 123456789012345678901234567890 months"})
    void testUnsupportedPhrases(String text) {
        assertTrue(mondayParser.parse(text).isEmpty());
    }
}
