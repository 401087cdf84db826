package com.spnlearn.learner.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;

public class LearnerConfigLoader {

    private static final Logger logger = LoggerFactory.getLogger(LearnerConfigLoader.class);

    public static final String CONFIG_PROPERTY = "spn.config";
    public static final String DEFAULT_RESOURCE = "/spn_config.json";

    private LearnerConfigLoader() {
    }

    /**
     * Loads the file named by the {@code spn.config} system property when set,
     * otherwise the {@code /spn_config.json} classpath resource, otherwise an
     * empty config (all defaults).
     */
    public static LearnerConfig load() {
        // 1. Check System Property
        String path = System.getProperty(CONFIG_PROPERTY);
        if (path != null && !path.isEmpty()) {
            return loadFile(new File(path));
        }

        // 2. Check classpath resource
        try (InputStream is = LearnerConfigLoader.class.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (is != null) {
                return load(is);
            }
        } catch (IOException e) {
            logger.error("Failed to read {} from classpath", DEFAULT_RESOURCE, e);
            throw new IllegalStateException("Failed to read learner config " + DEFAULT_RESOURCE, e);
        }

        // 3. Default
        logger.info("No learner config found, using defaults");
        return new LearnerConfig();
    }

    public static LearnerConfig loadFile(File file) {
        try {
            LearnerConfig config = new ObjectMapper().readValue(file, LearnerConfig.class);
            logger.info("Loaded learner config from {}", file);
            return config;
        } catch (IOException e) {
            logger.error("Failed to read learner config {}", file, e);
            throw new IllegalStateException("Failed to read learner config " + file, e);
        }
    }

    public static LearnerConfig load(InputStream jsonStream) {
        try {
            return new ObjectMapper().readValue(jsonStream, LearnerConfig.class);
        } catch (IOException e) {
            logger.error("Failed to parse learner config", e);
            throw new IllegalStateException("Failed to parse learner config", e);
        }
    }
}
