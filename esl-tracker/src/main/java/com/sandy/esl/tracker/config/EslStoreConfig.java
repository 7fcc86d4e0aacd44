package com.sandy.esl.tracker.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sandy.esl.tracker.client.ParseClient;
import com.sandy.esl.tracker.service.EslStore;
import com.sandy.esl.tracker.service.impl.JdbcEslStore;
import com.sandy.esl.tracker.service.impl.ParseEslStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Builds the one {@link EslStore} selected by {@code esl.store.backend}.
 */
@Configuration
@Slf4j
@EnableConfigurationProperties(EslStoreProperties.class)
public class EslStoreConfig {

    @Bean
    @ConditionalOnProperty(prefix = "esl.store", name = "backend", havingValue = "parse")
    public ParseClient parseClient(EslStoreProperties properties, RestTemplateBuilder restTemplateBuilder, ObjectMapper objectMapper) {
        EslStoreProperties.Parse parse = properties.getParse();
        if (isBlank(parse.getApplicationId())) {
            throw new IllegalStateException("esl.store.parse.application-id (PARSE_APPLICATION_ID) is undefined");
        }
        if (isBlank(parse.getServerUrl())) {
            throw new IllegalStateException("esl.store.parse.server-url (PARSE_SERVER_URL) is undefined");
        }
        RestTemplateBuilder builder = restTemplateBuilder
                .setConnectTimeout(parse.getConnectTimeout())
                .setReadTimeout(parse.getReadTimeout());
        log.info("Parse backend enabled: serverUrl={} collection={} apiKey={}", parse.getServerUrl(), parse.getCollection(),
                isBlank(parse.getApiKey()) ? "none" : "set");
        return new ParseClient(parse.getApplicationId(), parse.getApiKey(), parse.getServerUrl(), builder, objectMapper);
    }

    @Bean
    @ConditionalOnProperty(prefix = "esl.store", name = "backend", havingValue = "parse")
    public EslStore parseEslStore(ParseClient parseClient, EslStoreProperties properties) {
        return new ParseEslStore(parseClient, properties.getParse().getCollection());
    }

    @Bean
    @ConditionalOnProperty(prefix = "esl.store", name = "backend", havingValue = "jdbc", matchIfMissing = true)
    public EslStore jdbcEslStore(JdbcTemplate jdbcTemplate) {
        log.info("JDBC backend enabled");
        return new JdbcEslStore(jdbcTemplate);
    }

    @Bean(name = "eslStoreExecutor")
    public ThreadPoolTaskExecutor eslStoreExecutor(EslStoreProperties properties) {
        EslStoreProperties.Executor cfg = properties.getExecutor();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(cfg.getCoreSize());
        executor.setMaxPoolSize(cfg.getMaxSize());
        executor.setQueueCapacity(cfg.getQueueCapacity());
        executor.setThreadNamePrefix("esl-store-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.initialize();
        return executor;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
