package de.mirkosertic.searchvalidator.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Version and build time of the running validator, read once from the Maven-filtered
 * build-info.properties. Unfiltered or missing values fall back to "dev" and "unknown".
 *
 * @param version        project version
 * @param buildTimestamp ISO-8601 build time
 */
public record BuildInfo(String version, String buildTimestamp) {

    private static final Logger logger = LoggerFactory.getLogger(BuildInfo.class);

    private static final String RESOURCE = "build-info.properties";
    static final String DEV_VERSION = "dev";
    static final String UNKNOWN_TIMESTAMP = "unknown";

    public static BuildInfo current() {
        return Holder.CURRENT;
    }

    /**
     * Build from already loaded properties.
     */
    static BuildInfo from(final Properties properties) {
        return new BuildInfo(
                filtered(properties.getProperty("build.version"), DEV_VERSION),
                filtered(properties.getProperty("build.timestamp"), UNKNOWN_TIMESTAMP));
    }

    /**
     * One-line description for {@code --version}.
     */
    public String describe() {
        return "search-validator " + version + " (built " + buildTimestamp + ")";
    }

    // An IDE copies the resource without Maven filtering, leaving the ${...} placeholders in place
    private static String filtered(final String value, final String fallback) {
        return value == null || value.isBlank() || value.contains("${") ? fallback : value.trim();
    }

    private static BuildInfo load() {
        final Properties properties = new Properties();
        try (final InputStream input = BuildInfo.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (input == null) {
                logger.debug("{} not on classpath, running from sources", RESOURCE);
            } else {
                properties.load(input);
            }
        } catch (final IOException e) {
            logger.warn("Could not read {}, reporting a dev build", RESOURCE, e);
        }
        return from(properties);
    }

    private static final class Holder {
        private static final BuildInfo CURRENT = load();
    }
}
