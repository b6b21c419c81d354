package com.netcracker.core.provisioning.configuration;

import org.eclipse.microprofile.config.spi.ConfigSource;

import java.util.Map;
import java.util.Set;

/**
 * Translates {@code LOG_FORMAT=json|text} into {@code quarkus.log.console.json}.
 * <p>
 * The ordinal sits below {@code application.properties}, so an explicit Quarkus logging
 * property always wins.
 */
public class LogFormatConfigSource implements ConfigSource {
    static final String LOG_FORMAT_ENV = "LOG_FORMAT";
    static final String CONSOLE_JSON = "quarkus.log.console.json";
    private static final int ORDINAL = 50;

    private final Map<String, String> properties;

    public LogFormatConfigSource() {
        this(System.getenv());
    }

    LogFormatConfigSource(Map<String, String> environment) {
        String format = environment.get(LOG_FORMAT_ENV);
        if (format == null || format.isBlank()) {
            this.properties = Map.of();
        } else {
            this.properties = Map.of(CONSOLE_JSON, String.valueOf("json".equalsIgnoreCase(format.trim())));
        }
    }

    @Override
    public Map<String, String> getProperties() {
        return properties;
    }

    @Override
    public Set<String> getPropertyNames() {
        return properties.keySet();
    }

    @Override
    public String getValue(String propertyName) {
        return properties.get(propertyName);
    }

    @Override
    public String getName() {
        return "log-format";
    }

    @Override
    public int getOrdinal() {
        return ORDINAL;
    }
}
