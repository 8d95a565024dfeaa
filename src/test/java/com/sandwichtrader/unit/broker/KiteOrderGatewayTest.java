package com.sandwichtrader.unit.broker;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.sandwichtrader.broker.KiteOrderGateway;
import com.sandwichtrader.broker.OrderRequest;
import com.sandwichtrader.broker.OrderResult;
import com.sandwichtrader.domain.enums.InstrumentType;
import com.sandwichtrader.domain.enums.LegRole;
import com.sandwichtrader.domain.enums.OrderSide;
import com.sandwichtrader.exception.BrokerException;
import com.zerodhatech.kiteconnect.KiteConnect;
import com.zerodhatech.kiteconnect.kitehttp.exceptions.KiteException;
import com.zerodhatech.kiteconnect.utils.Constants;
import com.zerodhatech.models.Order;
import com.zerodhatech.models.OrderParams;
import java.io.IOException;
import java.math.BigDecimal;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/**
 * Unit tests for {@link KiteOrderGateway}. Resilience4j annotations are not active without
 * a Spring context, so only the mapping and error wrapping are covered.
 */
@ExtendWith(MockitoExtension.class)
class KiteOrderGatewayTest {

    @Mock
    private KiteConnect kiteConnect;

    private KiteOrderGateway kiteOrderGateway;

    @BeforeEach
    void setUp() {
        kiteOrderGateway = new KiteOrderGateway(kiteConnect);
    }

    private static OrderRequest outerCallShort() {
        return OrderRequest.builder()
                .tradingSymbol("BANKNIFTY25NOV47000CE")
                .instrumentType(InstrumentType.CE)
                .strike(47000)
                .side(OrderSide.SELL)
                .quantity(70)
                .referencePrice(new BigDecimal("82.40"))
                .role(LegRole.OUTER_CALL_SHORT)
                .build();
    }

    @Test
    @DisplayName("Places an NFO MARKET NRML order sized in contracts")
    void placesMarketOrder() throws Throwable {
        Order kiteResponse = new Order();
        kiteResponse.orderId = "251028000001234";
        when(kiteConnect.placeOrder(any(OrderParams.class), eq(Constants.VARIETY_REGULAR)))
                .thenReturn(kiteResponse);

        OrderResult result = kiteOrderGateway.placeOrder(outerCallShort());

        assertThat(result.isAccepted()).isTrue();
        assertThat(result.getOrderId()).isEqualTo("251028000001234");
        assertThat(result.getFillPrice()).isEqualByComparingTo("82.40");

        ArgumentCaptor<OrderParams> captor = ArgumentCaptor.forClass(OrderParams.class);
        verify(kiteConnect).placeOrder(captor.capture(), eq(Constants.VARIETY_REGULAR));
        OrderParams params = captor.getValue();
        assertThat(params.tradingsymbol).isEqualTo("BANKNIFTY25NOV47000CE");
        assertThat(params.exchange).isEqualTo("NFO");
        assertThat(params.transactionType).isEqualTo("SELL");
        assertThat(params.orderType).isEqualTo("MARKET");
        assertThat(params.product).isEqualTo("NRML");
        assertThat(params.quantity).isEqualTo(70);
    }

    @Test
    @DisplayName("Wraps KiteException as BrokerException")
    void wrapsKiteException() throws Throwable {
        when(kiteConnect.placeOrder(any(OrderParams.class), any()))
                .thenThrow(new KiteException("Insufficient margin", 400));

        assertThatThrownBy(() -> kiteOrderGateway.placeOrder(outerCallShort()))
                .isInstanceOf(BrokerException.class)
                .hasMessageContaining("Insufficient margin")
                .hasFieldOrPropertyWithValue("instrument", "BANKNIFTY25NOV47000CE");
    }

    @Test
    @DisplayName("Wraps IOException as BrokerException")
    void wrapsIoException() throws Throwable {
        when(kiteConnect.placeOrder(any(OrderParams.class), any())).thenThrow(new IOException("timeout"));

        assertThatThrownBy(() -> kiteOrderGateway.placeOrder(outerCallShort()))
                .isInstanceOf(BrokerException.class)
                .hasCauseInstanceOf(IOException.class);
    }
}
