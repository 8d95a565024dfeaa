package com.sandwichtrader.domain.model;

import com.sandwichtrader.domain.enums.InstrumentType;
import com.sandwichtrader.domain.enums.LegRole;
import com.sandwichtrader.domain.enums.OrderSide;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * One future or option contract held within the sandwich.
 *
 * <p>Identity (id, symbol, type, strike, side, quantity, role) is fixed at creation.
 * Only the observed price and the open/closed status change afterwards. A closed leg
 * is never reopened: adjustments close it and append a new leg, so the full list of
 * legs is an audit trail of every structure the strategy has held.
 *
 * <p>Quantity is in lots and always positive; the direction lives in {@link #side}.
 * The entry price is null while no fill or quote has been seen for the contract; the
 * first price observed then becomes the entry price.
 */
@Getter
@Builder
@ToString
public class Leg {

    private final long id;
    private final String tradingSymbol;
    private final InstrumentType instrumentType;

    /** Strike price, null for futures. */
    private final Integer strike;

    private final OrderSide side;
    private final int quantity;
    private final LegRole role;
    private final LocalDateTime openedAt;

    private BigDecimal entryPrice;
    private BigDecimal lastPrice;

    @Builder.Default
    private boolean open = true;

    private BigDecimal exitPrice;
    private LocalDateTime closedAt;

    /**
     * Records a newly observed price. A pending entry price is filled from the first
     * observation. Ignored once the leg is closed.
     */
    public void markPrice(BigDecimal price) {
        if (!open || price == null) {
            return;
        }
        if (entryPrice == null) {
            entryPrice = price;
        }
        lastPrice = price;
    }

    /** Marks the leg closed at the given exit price (last price when null). */
    public void close(BigDecimal price, LocalDateTime at) {
        if (!open) {
            return;
        }
        this.exitPrice = price != null ? price : lastPrice;
        this.closedAt = at;
        this.open = false;
    }

    /**
     * Mark-to-market P&L of an open leg: (last - entry) x sign x quantity.
     * Closed legs and legs without an entry price contribute zero.
     */
    public BigDecimal unrealizedPnl() {
        if (!open) {
            return BigDecimal.ZERO;
        }
        return pnlAgainst(lastPrice);
    }

    /** Locked-in P&L of a closed leg. Zero while open. */
    public BigDecimal realizedPnl() {
        if (open) {
            return BigDecimal.ZERO;
        }
        return pnlAgainst(exitPrice);
    }

    public boolean isLong() {
        return side == OrderSide.BUY;
    }

    private BigDecimal pnlAgainst(BigDecimal price) {
        if (entryPrice == null || price == null) {
            return BigDecimal.ZERO;
        }
        return price.subtract(entryPrice).multiply(BigDecimal.valueOf((long) side.sign() * quantity));
    }
}
