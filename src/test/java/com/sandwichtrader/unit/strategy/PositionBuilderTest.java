package com.sandwichtrader.unit.strategy;

import static org.assertj.core.api.Assertions.assertThat;

import com.sandwichtrader.broker.OrderRequest;
import com.sandwichtrader.broker.PaperOrderGateway;
import com.sandwichtrader.domain.enums.LegRole;
import com.sandwichtrader.domain.enums.MonthType;
import com.sandwichtrader.domain.enums.OrderSide;
import com.sandwichtrader.domain.model.Leg;
import com.sandwichtrader.marketdata.PricingAdapter;
import com.sandwichtrader.marketdata.SyntheticMarketDataSource;
import com.sandwichtrader.strategy.sandwich.DecisionJournal;
import com.sandwichtrader.strategy.sandwich.LegBook;
import com.sandwichtrader.strategy.sandwich.LegExecutor;
import com.sandwichtrader.strategy.sandwich.PositionBuilder;
import com.sandwichtrader.strategy.sandwich.SandwichConfig;
import com.sandwichtrader.strategy.sandwich.StrikeResolver;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class PositionBuilderTest {

    private static final BigDecimal SPOT = new BigDecimal("45000");
    private static final BigDecimal FUTURE = new BigDecimal("45090");
    private static final LocalDate NEXT_EXPIRY = LocalDate.of(2025, 11, 25);
    private static final LocalDateTime ENTRY = LocalDateTime.of(2025, 10, 28, 15, 0);

    private SandwichConfig config;
    private LegBook legBook;
    private PaperOrderGateway orderGateway;
    private PositionBuilder positionBuilder;

    @BeforeEach
    void setUp() {
        config = SandwichConfig.builder().build();
        legBook = new LegBook();
        orderGateway = new PaperOrderGateway();
        SyntheticMarketDataSource market = new SyntheticMarketDataSource(new BigDecimal("0.002"), new BigDecimal("80"));
        market.setSpot(SPOT);
        StrikeResolver strikeResolver = new StrikeResolver("BANKNIFTY", 100);
        LegExecutor legExecutor = new LegExecutor(
                legBook, orderGateway, new PricingAdapter(market), DecisionJournal.logging(this), config.getLotSize());
        positionBuilder = new PositionBuilder(config, strikeResolver, legExecutor);
    }

    @Nested
    @DisplayName("Strike ladder")
    class Ladder {

        @Test
        @DisplayName("Short cycle: core from the future, bread 2000 from spot, hedges 500 further out")
        void shortCycleLadder() {
            PositionBuilder.StrikeLadder ladder = positionBuilder.ladder(SPOT, FUTURE, MonthType.SHORT_CYCLE);

            assertThat(ladder.coreCallLong()).isEqualTo(45600);
            assertThat(ladder.corePutShort()).isEqualTo(44600);
            assertThat(ladder.outerCallShort()).isEqualTo(47000);
            assertThat(ladder.outerCallLong()).isEqualTo(47500);
            assertThat(ladder.outerPutShort()).isEqualTo(43000);
            assertThat(ladder.outerPutLong()).isEqualTo(42500);
        }

        @Test
        @DisplayName("Long cycle widens the bread to 2500")
        void longCycleLadder() {
            PositionBuilder.StrikeLadder ladder = positionBuilder.ladder(SPOT, FUTURE, MonthType.LONG_CYCLE);

            assertThat(ladder.outerCallShort()).isEqualTo(47500);
            assertThat(ladder.outerCallLong()).isEqualTo(48000);
            assertThat(ladder.outerPutShort()).isEqualTo(42500);
            assertThat(ladder.outerPutLong()).isEqualTo(42000);
            assertThat(ladder.coreCallLong()).isEqualTo(45600);
        }
    }

    @Nested
    @DisplayName("Building the position")
    class Build {

        @Test
        @DisplayName("Opens seven legs in role order with the role's side and lots")
        void opensSevenLegs() {
            List<Leg> legs = positionBuilder.build(SPOT, FUTURE, MonthType.SHORT_CYCLE, NEXT_EXPIRY, ENTRY);

            assertThat(legs).extracting(Leg::getRole).containsExactly(LegRole.values());
            assertThat(legs).extracting(Leg::getId).containsExactly(1L, 2L, 3L, 4L, 5L, 6L, 7L);
            assertThat(legs).allSatisfy(leg -> {
                assertThat(leg.getSide()).isEqualTo(leg.getRole().getSide());
                assertThat(leg.getQuantity()).isEqualTo(leg.getRole().getLots());
                assertThat(leg.isOpen()).isTrue();
            });
            assertThat(legBook.open()).hasSize(7);
        }

        @Test
        @DisplayName("Future leg is sold at the reference future with no strike")
        void futureAtReferencePrice() {
            Leg future = positionBuilder.build(SPOT, FUTURE, MonthType.SHORT_CYCLE, NEXT_EXPIRY, ENTRY).get(0);

            assertThat(future.getTradingSymbol()).isEqualTo("BANKNIFTY25NOVFUT");
            assertThat(future.getStrike()).isNull();
            assertThat(future.getSide()).isEqualTo(OrderSide.SELL);
            assertThat(future.getEntryPrice()).isEqualByComparingTo("45090");
        }

        @Test
        @DisplayName("Option legs enter at their quote and orders are sized lots x lot size")
        void optionEntryAndOrderQuantity() {
            List<Leg> legs = positionBuilder.build(SPOT, FUTURE, MonthType.SHORT_CYCLE, NEXT_EXPIRY, ENTRY);

            // every strike is out of the money against the synthetic future: time value only
            assertThat(legs.subList(1, 7)).allSatisfy(leg -> assertThat(leg.getEntryPrice()).isEqualByComparingTo("80"));

            List<OrderRequest> orders = orderGateway.getPlacedOrders();
            assertThat(orders).hasSize(7);
            assertThat(orders.get(0).getQuantity()).isEqualTo(35);
            assertThat(orders.get(3).getQuantity()).isEqualTo(70);
            assertThat(orders.get(3).getTradingSymbol()).isEqualTo("BANKNIFTY25NOV47000CE");
        }
    }
}
