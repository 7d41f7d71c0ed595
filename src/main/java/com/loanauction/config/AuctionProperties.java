package com.loanauction.config;

import java.math.BigDecimal;
import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

import lombok.Data;

/**
 * Configuration properties for the auction engine
 */
@Data
@ConfigurationProperties(prefix = "auction")
public class AuctionProperties {

    private int leaderboardSize = 10;
    private Duration lockTimeout = Duration.ofSeconds(2);
    private int defaultDurationHours = 24;
    private BigDecimal defaultBidIncrement = new BigDecimal("0.01");
    private Audit audit = new Audit();

    @Data
    public static class Audit {
        private int poolSize = 2;
        private int queueCapacity = 1000;
    }
}
