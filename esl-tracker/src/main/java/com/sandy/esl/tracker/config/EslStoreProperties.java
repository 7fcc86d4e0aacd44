package com.sandy.esl.tracker.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Settings of the record store, bound from {@code esl.store.*}.
 */
@Data
@ConfigurationProperties(prefix = "esl.store")
public class EslStoreProperties {

    /** Which backend holds the records: {@code parse} or {@code jdbc}. */
    private String backend = "jdbc";

    private Parse parse = new Parse();

    private Executor executor = new Executor();

    @Data
    public static class Parse {
        /** Sent as X-Parse-Application-Id on every request. */
        private String applicationId;
        /** Sent as X-Parse-REST-API-Key when set. */
        private String apiKey;
        /** Server root, e.g. https://parse.example.com/parse */
        private String serverUrl;
        /** Parse class holding the records. */
        private String collection = "Esl";
        private Duration connectTimeout = Duration.ofSeconds(5);
        private Duration readTimeout = Duration.ofSeconds(30);
    }

    @Data
    public static class Executor {
        private int coreSize = 4;
        private int maxSize = 16;
        private int queueCapacity = 500;
    }
}
