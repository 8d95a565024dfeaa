package com.sandwichtrader.observability;

import java.time.LocalDateTime;
import java.util.Map;
import lombok.Builder;
import lombok.Data;

/** One entry of the in-memory decision log. */
@Data
@Builder
public class DecisionRecord {

    private LocalDateTime timestamp;
    private String category;
    private String message;
    private Map<String, Object> context;
}
