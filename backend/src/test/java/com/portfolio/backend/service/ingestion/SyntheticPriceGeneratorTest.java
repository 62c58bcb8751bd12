package com.portfolio.backend.service.ingestion;

import com.portfolio.backend.service.marketdata.DailyBar;
import com.portfolio.backend.util.TradingDays;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.List;
import java.util.Random;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class SyntheticPriceGeneratorTest {

    private static final LocalDate END = LocalDate.of(2024, 3, 15);

    private final SyntheticPriceGenerator generator = new SyntheticPriceGenerator();

    @Test
    void producesOneBarPerMissingWeekday() {
        List<LocalDate> window = TradingDays.window(END, 30);

        List<DailyBar> bars = generator.generate(new BigDecimal("100"), window, Set.of(), new Random(1));

        assertThat(bars).extracting(DailyBar::date).containsExactlyElementsOf(window);
        assertThat(bars).extracting(DailyBar::date)
                .noneMatch(d -> d.getDayOfWeek() == DayOfWeek.SATURDAY || d.getDayOfWeek() == DayOfWeek.SUNDAY);
    }

    @Test
    void skipsExistingDatesAndWeekendsInInput() {
        LocalDate saturday = LocalDate.of(2024, 3, 9);
        List<LocalDate> window = List.of(LocalDate.of(2024, 3, 8), saturday, LocalDate.of(2024, 3, 11), END);

        List<DailyBar> bars = generator.generate(new BigDecimal("100"), window, Set.of(END), new Random(2));

        assertThat(bars).extracting(DailyBar::date)
                .containsExactly(LocalDate.of(2024, 3, 8), LocalDate.of(2024, 3, 11));
    }

    @Test
    void barsStayWithinGeneratedBounds() {
        List<DailyBar> bars = generator.generate(new BigDecimal("192.50"), TradingDays.window(END, 90), Set.of(), new Random(3));

        assertThat(bars).isNotEmpty().allSatisfy(bar -> {
            assertThat(bar.high()).isGreaterThanOrEqualTo(bar.open().max(bar.close()).subtract(new BigDecimal("0.0001")));
            assertThat(bar.low()).isLessThanOrEqualTo(bar.open().min(bar.close()).add(new BigDecimal("0.0001")));
            assertThat(bar.low().signum()).isPositive();
            assertThat(bar.volume()).isBetween(50_000_000L, 150_000_000L);
        });
        BigDecimal firstClose = bars.get(0).close();
        assertThat(firstClose).isBetween(new BigDecimal("192.50").multiply(new BigDecimal("0.92")),
                new BigDecimal("192.50").multiply(new BigDecimal("1.08")));
    }

    @Test
    void sameSeedGivesSameSeries() {
        List<LocalDate> window = TradingDays.window(END, 30);

        assertThat(generator.generate(new BigDecimal("100"), window, Set.of(), new Random(9)))
                .isEqualTo(generator.generate(new BigDecimal("100"), window, Set.of(), new Random(9)));
    }
}
