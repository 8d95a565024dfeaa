package com.sandwichtrader.api.dto.response;

import com.sandwichtrader.domain.enums.InstrumentType;
import com.sandwichtrader.domain.enums.LegRole;
import com.sandwichtrader.domain.enums.OrderSide;
import com.sandwichtrader.domain.model.Leg;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Data;

/** Flattened view of a leg for the API, including its current or realised P&L. */
@Data
@Builder
public class LegResponse {

    private long id;
    private LegRole role;
    private String tradingSymbol;
    private InstrumentType instrumentType;
    private Integer strike;
    private OrderSide side;
    private int quantity;
    private BigDecimal entryPrice;
    private BigDecimal lastPrice;
    private BigDecimal exitPrice;
    private boolean open;
    private BigDecimal pnl;
    private LocalDateTime openedAt;
    private LocalDateTime closedAt;

    public static LegResponse from(Leg leg) {
        return LegResponse.builder()
                .id(leg.getId())
                .role(leg.getRole())
                .tradingSymbol(leg.getTradingSymbol())
                .instrumentType(leg.getInstrumentType())
                .strike(leg.getStrike())
                .side(leg.getSide())
                .quantity(leg.getQuantity())
                .entryPrice(leg.getEntryPrice())
                .lastPrice(leg.getLastPrice())
                .exitPrice(leg.getExitPrice())
                .open(leg.isOpen())
                .pnl(leg.isOpen() ? leg.unrealizedPnl() : leg.realizedPnl())
                .openedAt(leg.getOpenedAt())
                .closedAt(leg.getClosedAt())
                .build();
    }
}
