package com.portfolio.backend.util;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

public final class TradingDays {

    private TradingDays() {
    }

    public static boolean isWeekend(LocalDate date) {
        DayOfWeek day = date.getDayOfWeek();
        return day == DayOfWeek.SATURDAY || day == DayOfWeek.SUNDAY;
    }

    /**
     * Weekdays from {@code end - windowDays} to {@code end}, both inclusive, oldest first.
     */
    public static List<LocalDate> window(LocalDate end, int windowDays) {
        List<LocalDate> days = new ArrayList<>();
        for (LocalDate date = end.minusDays(windowDays); !date.isAfter(end); date = date.plusDays(1)) {
            if (!isWeekend(date)) {
                days.add(date);
            }
        }
        return days;
    }
}
