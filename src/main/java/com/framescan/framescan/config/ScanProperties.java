package com.framescan.framescan.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;

import lombok.Getter;
import lombok.Setter;

/**
 * Tunables for session scanning, the classifier collaborator and video storage.
 * Defaults match the values the service has always shipped with.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "framescan")
public class ScanProperties {

    private final Scan scan = new Scan();
    private final Classifier classifier = new Classifier();
    private final Storage storage = new Storage();
    private final Cors cors = new Cors();

    @Getter
    @Setter
    public static class Scan {
        /** Virtual playback time advanced per coordinator tick, in seconds. */
        private double tickIntervalSeconds = 0.5;
        /** Real delay between coordinator ticks. */
        private long tickDelayMillis = 100;
        /** Silence on a connection before a ping is sent. */
        private long idleTimeoutSeconds = 30;
        private long keepaliveSweepMillis = 1000;
        /** Upper bound on how long teardown waits for a coordinator to stop. */
        private long teardownAwaitMillis = 5000;
        /** How long an uploaded session may wait for its first connection. */
        private long unclaimedSessionTtlSeconds = 600;
        private long unclaimedSweepMillis = 60000;
        private int maxSessions = 32;
        private int frameRequestThreads = 4;

        public Duration tickDelay() {
            return Duration.ofMillis(tickDelayMillis);
        }

        public Duration idleTimeout() {
            return Duration.ofSeconds(idleTimeoutSeconds);
        }

        public Duration unclaimedSessionTtl() {
            return Duration.ofSeconds(unclaimedSessionTtlSeconds);
        }

        public Duration teardownAwait() {
            return Duration.ofMillis(teardownAwaitMillis);
        }
    }

    @Getter
    @Setter
    public static class Classifier {
        private String benignLabel = "normal";
        /** Inference endpoint; blank leaves the classifier unavailable. */
        private String endpoint = "";
        private long connectTimeoutMillis = 2000;
        private long readTimeoutMillis = 10000;
    }

    @Getter
    @Setter
    public static class Storage {
        private String uploadDir = "videos";
        private String tempDir = "temp";
        private long maxUploadBytes = 100L * 1024 * 1024;
        private boolean purgeOnStartup = true;
    }

    @Getter
    @Setter
    public static class Cors {
        private List<String> allowedOrigins = new ArrayList<>(List.of(
                "http://localhost:5173",
                "http://localhost:3000",
                "http://127.0.0.1:5173",
                "http://127.0.0.1:3000"));
    }
}
