package com.gameday.leaguedata.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

@Component
public class LeagueSourceSettings {

    @Value("${gameday.registry.url:}")
    private String registryUrl;

    @Value("${gameday.fetch.connect-timeout-ms:5000}")
    private int connectTimeoutMs;

    @Value("${gameday.fetch.read-timeout-ms:15000}")
    private int readTimeoutMs;

    @Value("${gameday.fetch.user-agent:GamedayLeagueData/1.0}")
    private String userAgent;

    public LeagueSourceSettings() {}

    // For tests and manual wiring
    public LeagueSourceSettings(String registryUrl, int connectTimeoutMs, int readTimeoutMs, String userAgent) {
        this.registryUrl = registryUrl;
        this.connectTimeoutMs = connectTimeoutMs;
        this.readTimeoutMs = readTimeoutMs;
        this.userAgent = userAgent;
    }

    public String getRegistryUrl() { return registryUrl; }

    public int getConnectTimeoutMs() { return connectTimeoutMs; }

    public int getReadTimeoutMs() { return readTimeoutMs; }

    public String getUserAgent() { return userAgent; }
}
