package com.sandwichtrader.broker;

/**
 * Order placement seam between the strategy and the broker. The strategy never talks to
 * Kite classes directly.
 *
 * <p>Implementations:
 * <ul>
 *   <li>{@link KiteOrderGateway}: Kite Connect, used in LIVE mode</li>
 *   <li>{@link PaperOrderGateway}: in-memory fills, used in PAPER and HYBRID modes and by backtests</li>
 * </ul>
 */
public interface OrderGateway {

    /**
     * Places a market order.
     *
     * @return the result; a rejection is reported as {@code accepted=false}, not thrown
     * @throws com.sandwichtrader.exception.BrokerException if the broker call itself fails
     */
    OrderResult placeOrder(OrderRequest request);
}
