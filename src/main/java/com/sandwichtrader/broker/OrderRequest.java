package com.sandwichtrader.broker;

import com.sandwichtrader.domain.enums.InstrumentType;
import com.sandwichtrader.domain.enums.LegRole;
import com.sandwichtrader.domain.enums.OrderSide;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Data;

/**
 * A market order for one leg. {@code quantity} is in exchange units (lots x lot size);
 * {@code referencePrice} is the last quote seen for the contract and may be null.
 */
@Data
@Builder
public class OrderRequest {

    private String tradingSymbol;
    private InstrumentType instrumentType;
    private Integer strike;
    private OrderSide side;
    private int quantity;
    private BigDecimal referencePrice;

    /** Leg role the order opens or closes. */
    private LegRole role;
}
