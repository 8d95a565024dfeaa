package com.sandwichtrader.domain.enums;

/**
 * Structural purpose of a leg within the sandwich.
 *
 * <p>The three CORE roles form the "sausage": a short future hedged by a long call and
 * financed by a short put. The four OUTER roles are the "bread": short strangle wings
 * at the bread distance, each protected by a long option one hedge offset further out.
 *
 * <p>Each role fixes the side, contract type and lot count of its legs. Adjustments
 * never change a leg's role; they close the old generation and append a new one.
 */
public enum LegRole {
    CORE_FUTURE(OrderSide.SELL, InstrumentType.FUT, 1),
    CORE_CALL_LONG(OrderSide.BUY, InstrumentType.CE, 1),
    CORE_PUT_SHORT(OrderSide.SELL, InstrumentType.PE, 1),
    OUTER_CALL_SHORT(OrderSide.SELL, InstrumentType.CE, 2),
    OUTER_CALL_LONG(OrderSide.BUY, InstrumentType.CE, 2),
    OUTER_PUT_SHORT(OrderSide.SELL, InstrumentType.PE, 2),
    OUTER_PUT_LONG(OrderSide.BUY, InstrumentType.PE, 2);

    private final OrderSide side;
    private final InstrumentType instrumentType;
    private final int lots;

    LegRole(OrderSide side, InstrumentType instrumentType, int lots) {
        this.side = side;
        this.instrumentType = instrumentType;
        this.lots = lots;
    }

    public OrderSide getSide() {
        return side;
    }

    public InstrumentType getInstrumentType() {
        return instrumentType;
    }

    public int getLots() {
        return lots;
    }
}
