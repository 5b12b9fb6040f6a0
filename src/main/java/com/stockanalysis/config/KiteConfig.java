package com.stockanalysis.config;

import com.zerodhatech.kiteconnect.KiteConnect;
import lombok.Getter;
import lombok.Setter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Kite Connect credentials and the shared SDK client, bound from {@code kite.*}.
 *
 * <p>Login and token exchange happen outside this application: the access token of an
 * already authenticated session is supplied through configuration.
 */
@Configuration
@ConfigurationProperties(prefix = "kite")
@Getter
@Setter
public class KiteConfig {

    private static final Logger log = LoggerFactory.getLogger(KiteConfig.class);

    /** Kite Connect API key (from the Zerodha developer console). */
    private String apiKey;

    /** Access token of the current session. */
    private String accessToken;

    private String userId;

    @Bean
    public KiteConnect kiteConnect() {
        log.info("Creating KiteConnect client with API key: {}...", maskApiKey(apiKey));
        KiteConnect kiteConnect = new KiteConnect(apiKey);
        if (accessToken != null && !accessToken.isBlank()) {
            kiteConnect.setAccessToken(accessToken);
        } else {
            log.warn("No kite.access-token configured; broker calls will be rejected");
        }
        if (userId != null) {
            kiteConnect.setUserId(userId);
        }
        kiteConnect.setSessionExpiryHook(() -> log.warn("Kite session expired, a new access token is required"));
        return kiteConnect;
    }

    private String maskApiKey(String key) {
        if (key == null || key.length() < 4) {
            return "****";
        }
        return key.substring(0, 4) + "****";
    }
}
