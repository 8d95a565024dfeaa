package com.sandwichtrader.calendar;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Calculates NSE monthly expiry dates for BANKNIFTY derivatives.
 *
 * <p>The monthly expiry is the last Thursday of the month up to August 2025 and the last
 * Tuesday from September 2025 onwards. If that day is a weekend or holiday, the expiry
 * moves back to the previous trading day (this matches NSE's actual behavior).
 *
 * <p>"Current" and "next" are calendar-month based: the current monthly expiry of a date
 * is the expiry of that date's month, even once it has passed.
 */
@Service
public class ExpiryCalendarService {

    private static final Logger log = LoggerFactory.getLogger(ExpiryCalendarService.class);

    /** First month on which monthly contracts expire on Tuesday. */
    static final YearMonth TUESDAY_EXPIRY_FROM = YearMonth.of(2025, 9);

    private final HolidayCalendarConfig holidayCalendarConfig;

    public ExpiryCalendarService(HolidayCalendarConfig holidayCalendarConfig) {
        this.holidayCalendarConfig = holidayCalendarConfig;
    }

    public LocalDate getMonthlyExpiry(YearMonth month) {
        DayOfWeek expiryDay = month.isBefore(TUESDAY_EXPIRY_FROM) ? DayOfWeek.THURSDAY : DayOfWeek.TUESDAY;
        LocalDate lastExpiryDay = month.atEndOfMonth().with(TemporalAdjusters.previousOrSame(expiryDay));
        LocalDate adjusted = adjustForHoliday(lastExpiryDay);
        if (!adjusted.equals(lastExpiryDay)) {
            log.debug("Expiry for {} moved from {} to {} (holiday)", month, lastExpiryDay, adjusted);
        }
        return adjusted;
    }

    public LocalDate getCurrentMonthlyExpiry(LocalDate referenceDate) {
        return getMonthlyExpiry(YearMonth.from(referenceDate));
    }

    public LocalDate getNextMonthlyExpiry(LocalDate referenceDate) {
        return getMonthlyExpiry(YearMonth.from(referenceDate).plusMonths(1));
    }

    public boolean isMonthlyExpiryDay(LocalDate date) {
        return date.equals(getCurrentMonthlyExpiry(date));
    }

    /** Calendar days from {@code from} to {@code expiry}; negative once the expiry has passed. */
    public long daysToExpiry(LocalDate from, LocalDate expiry) {
        return ChronoUnit.DAYS.between(from, expiry);
    }

    /**
     * Gets all monthly expiry dates between two dates (inclusive).
     */
    public List<LocalDate> getMonthlyExpiriesBetween(LocalDate from, LocalDate to) {
        List<LocalDate> expiries = new ArrayList<>();
        YearMonth month = YearMonth.from(from);
        YearMonth last = YearMonth.from(to);
        while (!month.isAfter(last)) {
            LocalDate expiry = getMonthlyExpiry(month);
            if (!expiry.isBefore(from) && !expiry.isAfter(to)) {
                expiries.add(expiry);
            }
            month = month.plusMonths(1);
        }
        return expiries;
    }

    public boolean isTradingDay(LocalDate date) {
        DayOfWeek day = date.getDayOfWeek();
        return day != DayOfWeek.SATURDAY && day != DayOfWeek.SUNDAY && !holidayCalendarConfig.isHoliday(date);
    }

    private LocalDate adjustForHoliday(LocalDate date) {
        while (!isTradingDay(date)) {
            date = date.minusDays(1);
        }
        return date;
    }
}
