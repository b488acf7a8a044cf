package com.nursery.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Application settings bound from application.yml under 'nursery'.
 */
@Configuration
@ConfigurationProperties(prefix = "nursery")
public class NurseryProperties {

    private Security security = new Security();
    private Records records = new Records();

    public Security getSecurity() {
        return security;
    }

    public void setSecurity(Security security) {
        this.security = security;
    }

    public Records getRecords() {
        return records;
    }

    public void setRecords(Records records) {
        this.records = records;
    }

    public static class Security {
        // HS256 key, supplied through NURSERY_TOKEN_SECRET
        private String tokenSecret;
        private Duration tokenTtl = Duration.ofDays(30);

        public String getTokenSecret() { return tokenSecret; }
        public void setTokenSecret(String tokenSecret) { this.tokenSecret = tokenSecret; }

        public Duration getTokenTtl() { return tokenTtl; }
        public void setTokenTtl(Duration tokenTtl) { this.tokenTtl = tokenTtl; }
    }

    public static class Records {
        private int listLimit = 1000;

        public int getListLimit() { return listLimit; }
        public void setListLimit(int listLimit) { this.listLimit = listLimit; }
    }
}
