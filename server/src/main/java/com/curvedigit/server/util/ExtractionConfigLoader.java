package com.curvedigit.server.util;

import com.curvedigit.server.extraction.config.ExtractionConfig;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Locates and reads the extraction tables.
 * Order: {@code -Dcurve.config.path=<file>}, then {@code /extraction_config.json} on the
 * classpath, then the built-in tables.
 */
public class ExtractionConfigLoader {

    private static final Logger logger = LoggerFactory.getLogger(ExtractionConfigLoader.class);

    public static final String CONFIG_PATH_PROPERTY = "curve.config.path";
    public static final String DEFAULT_RESOURCE = "/extraction_config.json";

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    public static ExtractionConfig load() {
        // 1. System property
        String sysProp = System.getProperty(CONFIG_PATH_PROPERTY);
        if (sysProp != null && !sysProp.isEmpty()) {
            return loadFile(Paths.get(sysProp));
        }

        // 2. Classpath resource
        try (InputStream is = ExtractionConfigLoader.class.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (is != null) {
                ExtractionConfig cfg = read(is);
                logger.info("Loaded extraction config from classpath {}", DEFAULT_RESOURCE);
                return cfg;
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read " + DEFAULT_RESOURCE, e);
        }

        // 3. Defaults
        logger.warn("{} not found, using built-in color tables", DEFAULT_RESOURCE);
        return ExtractionConfig.builtIn();
    }

    public static ExtractionConfig loadFile(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new IllegalStateException("Extraction config not found: " + path.toAbsolutePath());
        }
        try (InputStream is = Files.newInputStream(path)) {
            ExtractionConfig cfg = read(is);
            logger.info("Loaded extraction config from {}", path.toAbsolutePath());
            return cfg;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read extraction config " + path, e);
        }
    }

    public static ExtractionConfig read(InputStream is) throws IOException {
        return MAPPER.readValue(is, ExtractionConfig.class);
    }
}
