package com.newsintel.curator.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "curation")
@Data
public class CurationProperties {

    private Rules rules = new Rules();
    private Discovery discovery = new Discovery();
    private Normalizer normalizer = new Normalizer();
    private Pipeline pipeline = new Pipeline();
    private Scheduling scheduling = new Scheduling();

    @Data
    public static class Rules {
        private String catalogueFile = "config/url_classification_rules.yml";
        private String noiseCacheFile = "config/cached_noise_urls.yml";
    }

    @Data
    public static class Discovery {
        private int minCoverage = 3;
        private double minConsistencyPct = 70.0;
        private double dedupRatioThreshold = 0.8;
        private int minUniquePatternsForNormalization = 10;
        private int parallelism = 4;
        private Input input = new Input();

        @Data
        public static class Input {
            private InputMode mode = InputMode.JDBC;
            private String csvFile = "/data/input/labeled_urls.csv";
        }

        public enum InputMode {
            JDBC, CSV
        }
    }

    @Data
    public static class Normalizer {
        private boolean enabled = false;
        private String baseUrl = "https://api.openai.com/v1";
        private String apiKey = "";
        private String model = "gpt-4o-mini";
        private int batchSize = 40;
        private int maxPasses = 5;
        private double temperature = 0.1;
        private int maxTokens = 4000;
    }

    @Data
    public static class Pipeline {
        private String name = "daily-curation";
        private GateMode gateMode = GateMode.SEQUENTIAL;
        private int maxRunning = 1;
        private Duration stageTimeout = Duration.ofMinutes(30);
        private Duration heartbeatInterval = Duration.ofSeconds(30);
        private Duration livenessThreshold = Duration.ofMinutes(10);
        private List<StageDefinition> stages = new ArrayList<>();

        /** Effective ceiling for concurrently running executions. */
        public int ceiling() {
            return gateMode == GateMode.SEQUENTIAL ? 1 : Math.max(1, maxRunning);
        }

        public enum GateMode {
            SEQUENTIAL, BOUNDED_PARALLEL
        }
    }

    @Data
    public static class StageDefinition {
        private String name;
        private List<String> command = new ArrayList<>();
        private Duration timeout;   // falls back to pipeline.stage-timeout
    }

    @Data
    public static class Scheduling {
        private String pipelineCron = "0 0 6 * * ?";
        private String discoveryCron = "0 0 3 * * SUN";
        private long driveIntervalMs = 60_000;
        private long reaperIntervalMs = 120_000;
        private boolean runOnStartup = false;
    }
}
