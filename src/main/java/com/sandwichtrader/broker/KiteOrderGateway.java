package com.sandwichtrader.broker;

import com.sandwichtrader.domain.enums.OrderSide;
import com.sandwichtrader.exception.BrokerException;
import com.zerodhatech.kiteconnect.KiteConnect;
import com.zerodhatech.kiteconnect.kitehttp.exceptions.KiteException;
import com.zerodhatech.kiteconnect.utils.Constants;
import com.zerodhatech.models.Order;
import com.zerodhatech.models.OrderParams;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import java.io.IOException;
import org.json.JSONException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Places sandwich orders through Kite Connect: NFO, MARKET, NRML, DAY validity.
 *
 * <p>Resilience4j decorators:
 * <ul>
 *   <li><b>Circuit breaker</b> ({@code kiteApi}): opens after repeated failures so a Kite outage
 *       doesn't stall every monitor cycle</li>
 *   <li><b>Retry</b> ({@code kiteApi}): BrokerException, attempts and wait in application.yml</li>
 * </ul>
 *
 * <p>Kite's checked exceptions (KiteException, JSONException, IOException) are wrapped
 * into {@link BrokerException}. Market orders report no fill price synchronously, so the
 * result carries the request's reference price.
 */
public class KiteOrderGateway implements OrderGateway {

    private static final Logger log = LoggerFactory.getLogger(KiteOrderGateway.class);

    private final KiteConnect kiteConnect;

    public KiteOrderGateway(KiteConnect kiteConnect) {
        this.kiteConnect = kiteConnect;
    }

    @Override
    @CircuitBreaker(name = "kiteApi")
    @Retry(name = "kiteApi")
    public OrderResult placeOrder(OrderRequest request) {
        OrderParams params = toOrderParams(request);
        try {
            Order kiteOrder = kiteConnect.placeOrder(params, Constants.VARIETY_REGULAR);
            log.info(
                    "Order placed: orderId={} symbol={} side={} qty={}",
                    kiteOrder.orderId,
                    request.getTradingSymbol(),
                    request.getSide(),
                    request.getQuantity());
            return OrderResult.accepted(kiteOrder.orderId, request.getReferencePrice());
        } catch (KiteException e) {
            log.error("Kite order placement failed for {}: {}", request.getTradingSymbol(), e.message);
            throw new BrokerException("Order placement failed: " + e.message, request.getTradingSymbol(), e);
        } catch (JSONException | IOException e) {
            log.error("Order placement error for {}", request.getTradingSymbol(), e);
            throw new BrokerException("Order placement error: " + e.getMessage(), request.getTradingSymbol(), e);
        }
    }

    OrderParams toOrderParams(OrderRequest request) {
        OrderParams params = new OrderParams();
        params.tradingsymbol = request.getTradingSymbol();
        params.exchange = Constants.EXCHANGE_NFO;
        params.transactionType = request.getSide() == OrderSide.BUY
                ? Constants.TRANSACTION_TYPE_BUY
                : Constants.TRANSACTION_TYPE_SELL;
        params.orderType = Constants.ORDER_TYPE_MARKET;
        params.quantity = request.getQuantity();
        params.product = Constants.PRODUCT_NRML;
        params.validity = Constants.VALIDITY_DAY;
        return params;
    }
}
