package com.gameday.leaguedata.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.client.RestClient;

@Configuration
public class FetchExecutorConfig {

    @Bean(name = "leagueFetchExecutor")
    public ThreadPoolTaskExecutor leagueFetchExecutor(
            @Value("${gameday.fetch.pool.core-size:6}") int coreSize,
            @Value("${gameday.fetch.pool.max-size:12}") int maxSize,
            @Value("${gameday.fetch.pool.queue-capacity:100}") int queueCapacity) {
        ThreadPoolTaskExecutor exec = new ThreadPoolTaskExecutor();
        exec.setCorePoolSize(coreSize);
        exec.setMaxPoolSize(maxSize);
        exec.setQueueCapacity(queueCapacity);
        exec.setThreadNamePrefix("LeagueFetch-");
        exec.initialize();
        return exec;
    }

    @Bean
    public RestClient sheetRestClient(LeagueSourceSettings settings) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(settings.getConnectTimeoutMs());
        requestFactory.setReadTimeout(settings.getReadTimeoutMs());
        return RestClient.builder()
                .requestFactory(requestFactory)
                .defaultHeader("User-Agent", settings.getUserAgent())
                .defaultHeader("Accept", "text/csv, text/plain, */*")
                .build();
    }
}
