package com.sandwichtrader.api.dto.request;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.math.BigDecimal;
import lombok.Data;

@Data
public class PaperSpotRequest {

    @NotNull
    @Positive
    private BigDecimal spot;
}
