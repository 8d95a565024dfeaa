package com.sandwichtrader.config;

import com.sandwichtrader.broker.KiteOrderGateway;
import com.sandwichtrader.broker.OrderGateway;
import com.sandwichtrader.broker.PaperOrderGateway;
import com.sandwichtrader.domain.enums.TradingMode;
import com.sandwichtrader.marketdata.KiteMarketDataSource;
import com.sandwichtrader.marketdata.MarketDataSource;
import com.sandwichtrader.marketdata.SyntheticMarketDataSource;
import com.sandwichtrader.strategy.sandwich.SandwichConfig;
import com.zerodhatech.kiteconnect.KiteConnect;
import java.time.Clock;
import java.time.ZoneId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the sandwich collaborators for the configured trading mode.
 *
 * <table>
 *   <tr><th>Mode</th><th>Market data</th><th>Orders</th></tr>
 *   <tr><td>PAPER</td><td>synthetic</td><td>paper</td></tr>
 *   <tr><td>HYBRID</td><td>Kite LTP</td><td>paper</td></tr>
 *   <tr><td>LIVE</td><td>Kite LTP</td><td>Kite</td></tr>
 * </table>
 */
@Configuration
public class SandwichConfiguration {

    private static final Logger log = LoggerFactory.getLogger(SandwichConfiguration.class);

    @Bean
    @ConfigurationProperties(prefix = "sandwich")
    public SandwichConfig sandwichConfig() {
        return SandwichConfig.builder().build();
    }

    @Bean
    public Clock marketClock(SandwichConfig sandwichConfig) {
        return Clock.system(ZoneId.of(sandwichConfig.getTimezone()));
    }

    @Bean
    public MarketDataSource marketDataSource(SandwichConfig sandwichConfig, ObjectProvider<KiteConnect> kiteConnect) {
        if (sandwichConfig.getTradingMode() == TradingMode.PAPER) {
            SyntheticMarketDataSource source = new SyntheticMarketDataSource(
                    sandwichConfig.getSyntheticCarry(), sandwichConfig.getSyntheticTimeValue());
            source.setSpot(sandwichConfig.getPaperSpot());
            log.info("Market data: synthetic (paper spot {})", sandwichConfig.getPaperSpot());
            return source;
        }
        log.info("Market data: Kite LTP ({})", sandwichConfig.getSpotInstrument());
        return new KiteMarketDataSource(kiteConnect.getObject(), sandwichConfig.getSpotInstrument());
    }

    @Bean
    public OrderGateway orderGateway(SandwichConfig sandwichConfig, ObjectProvider<KiteConnect> kiteConnect) {
        if (sandwichConfig.getTradingMode() == TradingMode.LIVE) {
            log.warn("Trading mode LIVE: orders go to Kite");
            return new KiteOrderGateway(kiteConnect.getObject());
        }
        log.info("Trading mode {}: paper order execution", sandwichConfig.getTradingMode());
        return new PaperOrderGateway();
    }
}
