package com.codelogickeep.agent.adapter.config;

import com.fasterxml.jackson.annotation.JsonMerge;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Settings for the adapter layer, bound from {@code adapters.yml}.
 */
@Data
public class AdapterConfig {
    // Sections merge field by field across configuration layers.
    @JsonMerge
    private ExecutionConfig execution = new ExecutionConfig();
    @JsonMerge
    private DetectionConfig detection = new DetectionConfig();
    @JsonMerge
    private GTestConfig gtest = new GTestConfig();
    @JsonMerge
    private PytestConfig pytest = new PytestConfig();
    private List<String> adapters; // enabled adapter names, null means all discovered

    @Data
    public static class ExecutionConfig {
        @JsonProperty("timeout-seconds")
        private long timeoutSeconds = 180;
        @JsonProperty("collect-coverage")
        private boolean collectCoverage = false;
        @JsonProperty("temp-dir-prefix")
        private String tempDirPrefix = "polytest_";

        public Duration timeout() {
            return Duration.ofSeconds(timeoutSeconds);
        }
    }

    @Data
    public static class DetectionConfig {
        /**
         * Upper bound on files visited by a single source scan.
         */
        @JsonProperty("max-scanned-files")
        private int maxScannedFiles = 20_000;
        /**
         * Characters read from the head of each candidate file.
         */
        @JsonProperty("scan-prefix-chars")
        private int scanPrefixChars = 8192;
    }

    @Data
    public static class GTestConfig {
        /**
         * Report format requested from directly executed binaries: xml or json.
         */
        @JsonProperty("output-format")
        private String outputFormat = "xml";
    }

    @Data
    public static class PytestConfig {
        /**
         * Explicit pytest executable. Empty means virtualenv lookup, then PATH.
         */
        private String command;
        @JsonProperty("extra-args")
        private List<String> extraArgs = new ArrayList<>();
    }
}
