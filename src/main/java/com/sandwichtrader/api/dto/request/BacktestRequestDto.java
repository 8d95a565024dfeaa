package com.sandwichtrader.api.dto.request;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Map;
import lombok.Data;

/** Backtest window plus daily spot closes keyed by ISO date. */
@Data
public class BacktestRequestDto {

    @NotNull
    private LocalDate from;

    @NotNull
    private LocalDate to;

    @NotEmpty
    private Map<LocalDate, BigDecimal> dailySpots;
}
