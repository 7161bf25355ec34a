package com.phillippitts.freefleet.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.web.client.RestClientCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;

import java.time.Duration;

/**
 * Timeouts and default headers for the auto-configured {@code RestClient.Builder} used by
 * provider adapters, metadata sources and policy scrapers.
 */
@Configuration
public class HttpClientConfig {

    @Bean
    @ConfigurationProperties(prefix = "fleet.http")
    public HttpTimeouts httpTimeouts() {
        return new HttpTimeouts();
    }

    @Bean
    public RestClientCustomizer fleetRestClientCustomizer(HttpTimeouts timeouts) {
        return builder -> {
            SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
            factory.setConnectTimeout(Duration.ofMillis(timeouts.getConnectTimeoutMs()));
            factory.setReadTimeout(Duration.ofMillis(timeouts.getReadTimeoutMs()));
            builder.requestFactory(factory)
                    .defaultHeader("User-Agent", "free-fleet/0.4");
        };
    }

    /**
     * Connect and read timeouts applied to every outbound call.
     */
    public static class HttpTimeouts {
        private long connectTimeoutMs = 5_000;
        private long readTimeoutMs = 10_000;

        public long getConnectTimeoutMs() {
            return connectTimeoutMs;
        }

        public void setConnectTimeoutMs(long connectTimeoutMs) {
            this.connectTimeoutMs = connectTimeoutMs;
        }

        public long getReadTimeoutMs() {
            return readTimeoutMs;
        }

        public void setReadTimeoutMs(long readTimeoutMs) {
            this.readTimeoutMs = readTimeoutMs;
        }
    }
}
