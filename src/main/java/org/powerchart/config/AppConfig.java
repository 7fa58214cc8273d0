package org.powerchart.config;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.ZoneId;
import java.util.Objects;
import java.util.Properties;

/**
 * Settings read from {@code powerchart.properties} on the classpath.
 *
 * <p>Each key can be overridden by a JVM system property with the same name.</p>
 */
public final class AppConfig {

    public static final String RESOURCE = "/powerchart.properties";

    static final String DATA_DIRECTORY = "powerchart.data.directory";
    static final String ZONE = "powerchart.zone";
    static final String OUTPUT_FILE = "powerchart.output.file";
    static final String ENT_VOLTAGE = "powerchart.ent.voltage";
    static final String UPS_PREFIX = "powerchart.ups.prefix";
    static final String ENT_PREFIX = "powerchart.ent.prefix";

    private final Properties properties;

    AppConfig(Properties properties) {
        this.properties = Objects.requireNonNull(properties, "properties");
    }

    public static AppConfig load() {
        Properties properties = new Properties();
        try (InputStream in = AppConfig.class.getResourceAsStream(RESOURCE)) {
            if (in != null) {
                properties.load(in);
            }
        } catch (IOException ex) {
            throw new UncheckedIOException("Cannot read " + RESOURCE, ex);
        }
        for (String key : properties.stringPropertyNames()) {
            String override = System.getProperty(key);
            if (override != null) {
                properties.setProperty(key, override);
            }
        }
        return new AppConfig(properties);
    }

    public static AppConfig of(Properties properties) {
        Properties copy = new Properties();
        copy.putAll(properties);
        return new AppConfig(copy);
    }

    public Path getDataDirectory() {
        return Path.of(get(DATA_DIRECTORY, "."));
    }

    /**
     * Zone used to turn log wall-clock times into epoch seconds and back into labels.
     */
    public ZoneId getZone() {
        String zone = get(ZONE, "");
        return zone.isBlank() ? ZoneId.systemDefault() : ZoneId.of(zone);
    }

    public Path getDefaultOutputFile() {
        return Path.of(get(OUTPUT_FILE, "out.png"));
    }

    public double getEntVoltage() {
        return Double.parseDouble(get(ENT_VOLTAGE, "208.0"));
    }

    public String getUpsPrefix() {
        return get(UPS_PREFIX, "UPS");
    }

    public String getEntPrefix() {
        return get(ENT_PREFIX, "ENT");
    }

    private String get(String key, String defaultValue) {
        String value = properties.getProperty(key);
        return value == null ? defaultValue : value.trim();
    }
}
