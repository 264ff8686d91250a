package com.convolab.server.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;

/**
 * Loads {@link ConvolutionConfig}. Precedence: system property, then the JSON
 * resource, then the hard-coded default.
 */
public class ConfigResolver {

    private static final Logger logger = LoggerFactory.getLogger(ConfigResolver.class);

    public static final String DEFAULT_RESOURCE = "/convolution_config.json";
    public static final String PROPERTY_PREFIX = "convolab.";

    public static ConvolutionConfig resolve() {
        return resolve(DEFAULT_RESOURCE);
    }

    public static ConvolutionConfig resolve(String resource) {
        ConvolutionConfig config = load(resource);
        applySystemProperties(config);
        return config;
    }

    static ConvolutionConfig load(String resource) {
        try (InputStream is = ConfigResolver.class.getResourceAsStream(resource)) {
            if (is == null) {
                logger.warn("Config resource {} not found, using defaults", resource);
                return ConvolutionConfig.defaults();
            }
            ObjectMapper mapper = new ObjectMapper()
                    .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
            ConvolutionConfig config = mapper.readValue(is, ConvolutionConfig.class);
            logger.info("Loaded convolution config from {}", resource);
            return config;
        } catch (IOException e) {
            logger.warn("Failed to read {}: {}. Using defaults", resource, e.getMessage());
            return ConvolutionConfig.defaults();
        }
    }

    static void applySystemProperties(ConvolutionConfig config) {
        config.defaultStride = intProperty("default.stride", config.defaultStride);
        config.defaultPadding = stringProperty("default.padding", config.defaultPadding);
        config.defaultPreset = stringProperty("default.preset", config.defaultPreset);
        config.defaultKernelSize = intProperty("default.kernelSize", config.defaultKernelSize);
        config.defaultSampleSize = intProperty("default.sampleSize", config.defaultSampleSize);
        config.maxInputSize = intProperty("maxInputSize", config.maxInputSize);
        config.maxKernelSize = intProperty("maxKernelSize", config.maxKernelSize);

        String parallel = System.getProperty(PROPERTY_PREFIX + "parallel");
        if (parallel != null && !parallel.isEmpty()) {
            config.parallel = "true".equalsIgnoreCase(parallel.trim());
        }
    }

    private static String stringProperty(String name, String fallback) {
        String value = System.getProperty(PROPERTY_PREFIX + name);
        return (value != null && !value.trim().isEmpty()) ? value.trim() : fallback;
    }

    private static int intProperty(String name, int fallback) {
        String value = System.getProperty(PROPERTY_PREFIX + name);
        if (value == null || value.trim().isEmpty()) {
            return fallback;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Ignoring non-numeric system property {}{}='{}'", PROPERTY_PREFIX, name, value);
            return fallback;
        }
    }
}
