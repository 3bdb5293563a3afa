package com.codelogickeep.agent.adapter.config;

import com.codelogickeep.agent.adapter.exception.AdapterException;
import com.codelogickeep.agent.adapter.exception.AdapterException.ErrorCode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

/**
 * Loads {@link AdapterConfig} by merging YAML layers, lowest priority first:
 * classpath {@code adapters.yml}, {@code ~/.polytest/adapters.yml},
 * {@code ./adapters.yml}, then an explicit file.
 */
@Slf4j
public class ConfigLoader {
    public static final String CONFIG_FILE = "adapters.yml";

    private final ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
    private final Path userHome;
    private final Path workingDir;
    private final Map<String, String> environment;

    public ConfigLoader() {
        this(Paths.get(System.getProperty("user.home")), Paths.get("."), System.getenv());
    }

    public ConfigLoader(Path userHome, Path workingDir, Map<String, String> environment) {
        this.userHome = userHome;
        this.workingDir = workingDir;
        this.environment = environment;
    }

    public AdapterConfig load() {
        return load(null);
    }

    /**
     * @param explicitPath highest-priority file, may be null
     * @throws AdapterException when the explicit file is missing or unreadable
     */
    public AdapterConfig load(Path explicitPath) {
        AdapterConfig config = new AdapterConfig();

        try (InputStream in = getClass().getClassLoader().getResourceAsStream(CONFIG_FILE)) {
            if (in != null) {
                mapper.readerForUpdating(config).readValue(in);
            }
        } catch (IOException e) {
            log.warn("Failed to read bundled {}: {}", CONFIG_FILE, e.getMessage());
        }

        mergeIfPresent(config, userHome.resolve(".polytest").resolve(CONFIG_FILE));
        mergeIfPresent(config, workingDir.resolve(CONFIG_FILE));

        if (explicitPath != null) {
            if (!Files.isRegularFile(explicitPath)) {
                throw new AdapterException(ErrorCode.CONFIG_NOT_FOUND,
                        "Configuration file not found: " + explicitPath);
            }
            try {
                mapper.readerForUpdating(config).readValue(explicitPath.toFile());
                log.info("Merged configuration from {}", explicitPath.toAbsolutePath());
            } catch (IOException e) {
                throw new AdapterException(ErrorCode.CONFIG_INVALID,
                        "Failed to parse configuration: " + e.getMessage(), explicitPath.toString(), e);
            }
        }

        if (config.getPytest() != null) {
            config.getPytest().setCommand(replaceEnvVars(config.getPytest().getCommand()));
        }
        validate(config);
        return config;
    }

    private void mergeIfPresent(AdapterConfig config, Path file) {
        if (!Files.isRegularFile(file)) {
            return;
        }
        try {
            mapper.readerForUpdating(config).readValue(file.toFile());
            log.info("Merged configuration from {}", file.toAbsolutePath());
        } catch (IOException e) {
            log.warn("Failed to merge config from {}: {}", file.toAbsolutePath(), e.getMessage());
        }
    }

    private void validate(AdapterConfig config) {
        if (config.getExecution() == null) {
            config.setExecution(new AdapterConfig.ExecutionConfig());
        }
        if (config.getDetection() == null) {
            config.setDetection(new AdapterConfig.DetectionConfig());
        }
        if (config.getGtest() == null) {
            config.setGtest(new AdapterConfig.GTestConfig());
        }
        if (config.getPytest() == null) {
            config.setPytest(new AdapterConfig.PytestConfig());
        }
        if (config.getExecution().getTimeoutSeconds() <= 0) {
            throw new AdapterException(ErrorCode.CONFIG_INVALID,
                    "execution.timeout-seconds must be positive, got " + config.getExecution().getTimeoutSeconds());
        }
        String format = config.getGtest().getOutputFormat();
        if (!"xml".equalsIgnoreCase(format) && !"json".equalsIgnoreCase(format)) {
            throw new AdapterException(ErrorCode.CONFIG_INVALID,
                    "gtest.output-format must be 'xml' or 'json', got '" + format + "'");
        }
    }

    /**
     * Replaces a whole-value {@code ${env:NAME}} placeholder; unknown variables are left as-is.
     */
    String replaceEnvVars(String value) {
        if (value == null || !value.startsWith("${env:") || !value.endsWith("}")) {
            return value;
        }
        String envVar = value.substring(6, value.length() - 1);
        String envValue = environment.get(envVar);
        return envValue != null ? envValue : value;
    }
}
