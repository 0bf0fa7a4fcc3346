package com.nei10u.cosmic.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.time.LocalTime;

/**
 * 星历配置，前缀 cosmic.ephemeris。
 */
@Data
@ConfigurationProperties(prefix = "cosmic.ephemeris")
public class EphemerisProperties {

    /**
     * 出生时间未知时，行星位置按当地该时刻计算
     */
    private LocalTime unknownTimeReference = LocalTime.NOON;

    private Remote remote = new Remote();

    public boolean isRemoteConfigured() {
        return remote.isEnabled() && remote.getBaseUrl() != null && !remote.getBaseUrl().isBlank();
    }

    @Data
    public static class Remote {
        private boolean enabled = false;
        private String baseUrl;
        private String path = "/api/v4/birth-chart";
        private String apiKey;
        private String apiKeyHeader = "x-api-key";
        private Duration timeout = Duration.ofSeconds(15);
        private String houseSystem = "P";   // P = Placidus
    }
}
