package com.hoslog.infrastructure.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import io.vertx.core.json.JsonObject;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.util.Map;

/**
 * Loads application.yml from the classpath into the JsonObject handed to verticles
 */
@Slf4j
public final class ApplicationConfigLoader {

    public static final String DEFAULT_RESOURCE = "application.yml";

    private static final YAMLMapper YAML = new YAMLMapper();

    private ApplicationConfigLoader() {
    }

    public static JsonObject load() {
        return load(DEFAULT_RESOURCE);
    }

    public static JsonObject load(String resource) {
        try (InputStream is = ApplicationConfigLoader.class.getClassLoader().getResourceAsStream(resource)) {
            if (is == null) {
                throw new IllegalStateException(resource + " not found in classpath");
            }
            Map<String, Object> values = YAML.readValue(is, new TypeReference<Map<String, Object>>() {});
            JsonObject config = values == null ? new JsonObject() : new JsonObject(values);
            log.info("Loaded configuration from {}", resource);
            return config;
        } catch (IOException e) {
            throw new IllegalStateException("Configuration error: cannot read " + resource, e);
        }
    }
}
