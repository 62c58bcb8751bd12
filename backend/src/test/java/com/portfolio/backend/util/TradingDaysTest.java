package com.portfolio.backend.util;

import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class TradingDaysTest {

    @Test
    void windowContainsOnlyWeekdaysInclusiveOfBothEnds() {
        LocalDate friday = LocalDate.of(2024, 3, 15);

        List<LocalDate> days = TradingDays.window(friday, 30);

        assertThat(days).first().isEqualTo(LocalDate.of(2024, 2, 14));
        assertThat(days).last().isEqualTo(friday);
        assertThat(days).hasSize(23);
        assertThat(days).noneMatch(d -> d.getDayOfWeek() == DayOfWeek.SATURDAY || d.getDayOfWeek() == DayOfWeek.SUNDAY);
        assertThat(days).isSorted();
    }

    @Test
    void weekendEndDateIsExcluded() {
        LocalDate sunday = LocalDate.of(2024, 3, 17);

        assertThat(TradingDays.window(sunday, 1)).isEmpty();
        assertThat(TradingDays.window(sunday, 2)).containsExactly(LocalDate.of(2024, 3, 15));
    }
}
