package com.sandwichtrader.unit.marketdata;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

import com.sandwichtrader.domain.enums.InstrumentType;
import com.sandwichtrader.domain.enums.LegRole;
import com.sandwichtrader.domain.model.Leg;
import com.sandwichtrader.exception.BrokerException;
import com.sandwichtrader.marketdata.MarketDataSource;
import com.sandwichtrader.marketdata.PricingAdapter;
import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class PricingAdapterTest {

    @Mock
    private MarketDataSource marketDataSource;

    private PricingAdapter pricingAdapter;

    @BeforeEach
    void setUp() {
        pricingAdapter = new PricingAdapter(marketDataSource);
    }

    private static Leg leg(long id, LegRole role, String symbol, Integer strike, String price) {
        Leg leg = Leg.builder()
                .id(id)
                .tradingSymbol(symbol)
                .instrumentType(role.getInstrumentType())
                .strike(strike)
                .side(role.getSide())
                .quantity(role.getLots())
                .role(role)
                .build();
        leg.markPrice(new BigDecimal(price));
        return leg;
    }

    @Test
    @DisplayName("Broker failures become empty lookups")
    void brokerFailureIsEmpty() {
        when(marketDataSource.getSpot()).thenThrow(new BrokerException("LTP lookup failed: timeout", "NSE:NIFTY BANK"));

        assertThat(pricingAdapter.spot()).isEmpty();
    }

    @Test
    @DisplayName("spotOrLast falls back to the last spot seen")
    void spotFallsBackToLast() {
        when(marketDataSource.getSpot())
                .thenReturn(Optional.of(new BigDecimal("45000")))
                .thenReturn(Optional.empty());

        assertThat(pricingAdapter.spotOrLast()).contains(new BigDecimal("45000"));
        assertThat(pricingAdapter.spotOrLast()).contains(new BigDecimal("45000"));
        assertThat(pricingAdapter.lastSpot()).contains(new BigDecimal("45000"));
    }

    @Test
    @DisplayName("A remembered override counts as the last spot")
    void rememberedSpot() {
        pricingAdapter.rememberSpot(new BigDecimal("46000"));

        assertThat(pricingAdapter.lastSpot()).contains(new BigDecimal("46000"));
    }

    @Test
    @DisplayName("Futures and options are routed to their own lookups")
    void quoteRouting() {
        when(marketDataSource.getFuture("BANKNIFTY25NOVFUT")).thenReturn(Optional.of(new BigDecimal("45090")));
        when(marketDataSource.getOptionPrice("BANKNIFTY25NOV45600CE", 45600, InstrumentType.CE))
                .thenReturn(Optional.of(new BigDecimal("210.5")));

        assertThat(pricingAdapter.quote("BANKNIFTY25NOVFUT", InstrumentType.FUT, null))
                .contains(new BigDecimal("45090"));
        assertThat(pricingAdapter.quote("BANKNIFTY25NOV45600CE", InstrumentType.CE, 45600))
                .contains(new BigDecimal("210.5"));
    }

    @Test
    @DisplayName("Refresh marks what it can and counts the misses")
    void refreshCountsMisses() {
        Leg call = leg(1, LegRole.CORE_CALL_LONG, "BANKNIFTY25NOV45600CE", 45600, "80");
        Leg put = leg(2, LegRole.CORE_PUT_SHORT, "BANKNIFTY25NOV44600PE", 44600, "80");
        when(marketDataSource.getOptionPrice("BANKNIFTY25NOV45600CE", 45600, InstrumentType.CE))
                .thenReturn(Optional.of(new BigDecimal("150")));
        when(marketDataSource.getOptionPrice("BANKNIFTY25NOV44600PE", 44600, InstrumentType.PE))
                .thenThrow(new BrokerException("LTP lookup failed", "NFO:BANKNIFTY25NOV44600PE"));

        int missing = pricingAdapter.refresh(List.of(call, put));

        assertThat(missing).isEqualTo(1);
        assertThat(call.getLastPrice()).isEqualByComparingTo("150");
        assertThat(put.getLastPrice()).isEqualByComparingTo("80");
    }
}
