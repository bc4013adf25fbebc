package com.apitool.config;

import java.time.Duration;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Settings under the {@code tool-engine} prefix.
 */
@Data
@ConfigurationProperties(prefix = "tool-engine")
public class ToolEngineProperties {

    private Http http = new Http();
    private OAuth oauth = new OAuth();
    private State state = new State();
    private Seed seed = new Seed();
    private Caller caller = new Caller();

    /**
     * Timeouts of the client that calls registered tools. Tool calls are never retried.
     */
    @Data
    public static class Http {
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration responseTimeout = Duration.ofSeconds(30);
        private int maxInMemorySize = 16 * 1024 * 1024;
    }

    @Data
    public static class OAuth {
        /**
         * Base URL of the gateway answering {@code POST /oauth/check}.
         */
        private String gatewayUrl;
        private String apiKey;
        private Retry retry = new Retry();
    }

    @Data
    public static class Retry {
        private int maxAttempts = 3;
        private Duration initialBackoff = Duration.ofMillis(500);
    }

    @Data
    public static class State {
        private String directory = System.getProperty("user.home") + "/.api-tool-engine";
    }

    @Data
    public static class Seed {
        /**
         * Directory of tool-definition JSON files registered at startup; unset disables seeding.
         */
        private String directory;
    }

    /**
     * Identity the shell acts as when a command does not name one.
     */
    @Data
    public static class Caller {
        private String userId = "local-user";
        private String organizationId = "local-org";
    }
}
