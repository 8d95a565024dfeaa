package com.sandwichtrader.api.dto.request;

import com.sandwichtrader.domain.model.EntryRequest;
import jakarta.validation.constraints.Positive;
import java.math.BigDecimal;
import java.time.LocalDate;
import lombok.Data;

/**
 * Manual entry request. Every field is optional; an empty body behaves like the scheduled
 * entry and is refused outside the expiry-day entry window.
 */
@Data
public class EntryRequestDto {

    /** Skip the expiry-day and entry-time checks. */
    private boolean force;

    @Positive
    private BigDecimal spotOverride;

    @Positive
    private BigDecimal futureOverride;

    private LocalDate currentExpiry;
    private LocalDate nextExpiry;

    public EntryRequest toEntryRequest() {
        return EntryRequest.builder()
                .force(force)
                .spotOverride(spotOverride)
                .futureOverride(futureOverride)
                .currentExpiry(currentExpiry)
                .nextExpiry(nextExpiry)
                .build();
    }
}
