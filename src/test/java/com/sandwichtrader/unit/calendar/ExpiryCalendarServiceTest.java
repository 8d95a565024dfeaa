package com.sandwichtrader.unit.calendar;

import static org.assertj.core.api.Assertions.assertThat;

import com.sandwichtrader.calendar.ExpiryCalendarService;
import com.sandwichtrader.calendar.HolidayCalendarConfig;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for ExpiryCalendarService: the Thursday to Tuesday switch in September 2025,
 * holiday adjustment and the current/next lookups.
 */
class ExpiryCalendarServiceTest {

    private HolidayCalendarConfig holidayCalendarConfig;
    private ExpiryCalendarService expiryCalendarService;

    @BeforeEach
    void setUp() {
        holidayCalendarConfig = new HolidayCalendarConfig(List.of());
        expiryCalendarService = new ExpiryCalendarService(holidayCalendarConfig);
    }

    @Nested
    @DisplayName("Monthly expiry day")
    class MonthlyExpiry {

        @Test
        @DisplayName("Last Thursday up to August 2025")
        void lastThursdayBeforeSwitch() {
            assertThat(expiryCalendarService.getMonthlyExpiry(YearMonth.of(2025, 1))).isEqualTo(LocalDate.of(2025, 1, 30));
            assertThat(expiryCalendarService.getMonthlyExpiry(YearMonth.of(2025, 8))).isEqualTo(LocalDate.of(2025, 8, 28));
        }

        @Test
        @DisplayName("Last Tuesday from September 2025")
        void lastTuesdayAfterSwitch() {
            LocalDate september = expiryCalendarService.getMonthlyExpiry(YearMonth.of(2025, 9));

            assertThat(september).isEqualTo(LocalDate.of(2025, 9, 30));
            assertThat(september.getDayOfWeek()).isEqualTo(DayOfWeek.TUESDAY);
            assertThat(expiryCalendarService.getMonthlyExpiry(YearMonth.of(2025, 10))).isEqualTo(LocalDate.of(2025, 10, 28));
            assertThat(expiryCalendarService.getMonthlyExpiry(YearMonth.of(2026, 1))).isEqualTo(LocalDate.of(2026, 1, 27));
        }

        @Test
        @DisplayName("A holiday moves the expiry to the previous trading day")
        void holidayMovesBack() {
            holidayCalendarConfig.setHolidays(List.of(LocalDate.of(2025, 10, 28)));

            assertThat(expiryCalendarService.getMonthlyExpiry(YearMonth.of(2025, 10))).isEqualTo(LocalDate.of(2025, 10, 27));
        }

        @Test
        @DisplayName("Consecutive holidays and a weekend are all skipped")
        void skipsWeekendAndHolidays() {
            // Tue 2026-03-31 and Mon 2026-03-30 closed: back to Friday 2026-03-27
            holidayCalendarConfig.setHolidays(List.of(LocalDate.of(2026, 3, 31), LocalDate.of(2026, 3, 30)));

            assertThat(expiryCalendarService.getMonthlyExpiry(YearMonth.of(2026, 3))).isEqualTo(LocalDate.of(2026, 3, 27));
        }
    }

    @Nested
    @DisplayName("Current and next expiry")
    class CurrentAndNext {

        @Test
        @DisplayName("Current expiry is the expiry of the date's month, even after it passed")
        void currentIsCalendarMonth() {
            assertThat(expiryCalendarService.getCurrentMonthlyExpiry(LocalDate.of(2025, 10, 3)))
                    .isEqualTo(LocalDate.of(2025, 10, 28));
            assertThat(expiryCalendarService.getCurrentMonthlyExpiry(LocalDate.of(2025, 10, 30)))
                    .isEqualTo(LocalDate.of(2025, 10, 28));
        }

        @Test
        @DisplayName("Next expiry is the following month's, across the year end")
        void nextAcrossYearEnd() {
            assertThat(expiryCalendarService.getNextMonthlyExpiry(LocalDate.of(2025, 10, 28)))
                    .isEqualTo(LocalDate.of(2025, 11, 25));
            assertThat(expiryCalendarService.getNextMonthlyExpiry(LocalDate.of(2025, 12, 30)))
                    .isEqualTo(LocalDate.of(2026, 1, 27));
        }

        @Test
        @DisplayName("Expiry day detection and days to expiry")
        void expiryDayAndDaysTo() {
            assertThat(expiryCalendarService.isMonthlyExpiryDay(LocalDate.of(2025, 10, 28))).isTrue();
            assertThat(expiryCalendarService.isMonthlyExpiryDay(LocalDate.of(2025, 10, 21))).isFalse();
            assertThat(expiryCalendarService.daysToExpiry(LocalDate.of(2025, 11, 24), LocalDate.of(2025, 11, 25)))
                    .isEqualTo(1);
            assertThat(expiryCalendarService.daysToExpiry(LocalDate.of(2025, 11, 26), LocalDate.of(2025, 11, 25)))
                    .isEqualTo(-1);
        }

        @Test
        @DisplayName("Lists the expiries inside a range, inclusive")
        void expiriesBetween() {
            List<LocalDate> expiries = expiryCalendarService.getMonthlyExpiriesBetween(
                    LocalDate.of(2025, 7, 31), LocalDate.of(2025, 10, 28));

            assertThat(expiries)
                    .containsExactly(
                            LocalDate.of(2025, 7, 31),
                            LocalDate.of(2025, 8, 28),
                            LocalDate.of(2025, 9, 30),
                            LocalDate.of(2025, 10, 28));
        }

        @Test
        @DisplayName("Weekends and holidays are not trading days")
        void tradingDays() {
            holidayCalendarConfig.setHolidays(List.of(LocalDate.of(2025, 10, 21)));

            assertThat(expiryCalendarService.isTradingDay(LocalDate.of(2025, 10, 20))).isTrue();
            assertThat(expiryCalendarService.isTradingDay(LocalDate.of(2025, 10, 21))).isFalse();
            assertThat(expiryCalendarService.isTradingDay(LocalDate.of(2025, 10, 25))).isFalse();
        }
    }
}
