package com.sandwichtrader.config;

import com.zerodhatech.kiteconnect.KiteConnect;
import lombok.Getter;
import lombok.Setter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Kite Connect API settings, bound from {@code kite.*}.
 *
 * <p>The {@link KiteConnect} client is only created when the trading mode uses Kite
 * (LIVE or HYBRID). The access token comes from the daily Kite login flow, done outside
 * this service, and is supplied through {@code kite.access-token}.
 */
@Configuration
@ConfigurationProperties(prefix = "kite")
@Getter
@Setter
public class KiteConfig {

    private static final Logger log = LoggerFactory.getLogger(KiteConfig.class);

    /** Kite Connect API key (from Zerodha developer console). */
    private String apiKey;

    /** Access token for the current trading day. */
    private String accessToken;

    /** Kite user id, optional. */
    private String userId;

    @Bean
    @ConditionalOnExpression("'${sandwich.trading-mode:PAPER}' != 'PAPER'")
    public KiteConnect kiteConnect() {
        log.info("Creating KiteConnect bean with API key: {}...", maskApiKey(apiKey));
        KiteConnect kiteConnect = new KiteConnect(apiKey);
        if (accessToken != null && !accessToken.isBlank()) {
            kiteConnect.setAccessToken(accessToken);
        } else {
            log.warn("kite.access-token not set, Kite calls will fail until a token is configured");
        }
        if (userId != null) {
            kiteConnect.setUserId(userId);
        }
        kiteConnect.setSessionExpiryHook(() -> log.warn("Kite session expired (detected by SDK SessionExpiryHook)"));
        return kiteConnect;
    }

    private String maskApiKey(String key) {
        if (key == null || key.length() < 4) {
            return "****";
        }
        return key.substring(0, 4) + "****";
    }
}
