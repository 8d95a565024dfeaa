package com.sandwichtrader.calendar;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * NSE trading holidays, bound from {@code sandwich.calendar.*}.
 *
 * <p>The list is updated annually from the NSE published calendar. ExpiryCalendarService
 * uses it to move an expiry that falls on a holiday back to the previous trading day.
 */
@Component
@ConfigurationProperties(prefix = "sandwich.calendar")
public class HolidayCalendarConfig {

    private List<LocalDate> holidays = new ArrayList<>();

    public HolidayCalendarConfig() {}

    public HolidayCalendarConfig(List<LocalDate> holidays) {
        this.holidays = new ArrayList<>(holidays);
    }

    public List<LocalDate> getHolidays() {
        return holidays;
    }

    public void setHolidays(List<LocalDate> holidays) {
        this.holidays = holidays;
    }

    public boolean isHoliday(LocalDate date) {
        return holidays.contains(date);
    }
}
