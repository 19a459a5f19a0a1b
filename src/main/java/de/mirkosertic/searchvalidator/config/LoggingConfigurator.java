package de.mirkosertic.searchvalidator.config;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import ch.qos.logback.core.util.StatusPrinter;
import org.jspecify.annotations.Nullable;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URL;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Switches logback to file-only output when the validator runs under a process manager or a
 * dashboard ({@code -Dprofile=deployed}), so the caller's console stays reserved for the run summary.
 * Log files go to the {@code log} folder of {@link ApplicationConfig#getConfigDirectory()}.
 * <p>
 * Without that profile the logback.xml found on the classpath stays in effect.
 */
public final class LoggingConfigurator {

    public static final String PROFILE_PROPERTY = "profile";

    static final String DEPLOYED_PROFILE = "deployed";
    static final String LOG_DIR_PROPERTY = "LOG_DIR";
    static final String LOG_FILE = "search-validator.log";

    private static final String DEPLOYED_CONFIG = "logback-deployed.xml";

    private LoggingConfigurator() {
    }

    public static boolean isDeployed(final @Nullable String profile) {
        return profile != null && DEPLOYED_PROFILE.equalsIgnoreCase(profile.trim());
    }

    /**
     * Must run before the first logger is used.
     *
     * @param profile value of the {@code profile} system property, may be {@code null}
     * @return directory receiving the log files, or {@code null} if console logging stays active
     */
    public static @Nullable Path configure(final @Nullable String profile) {
        if (!isDeployed(profile)) {
            return null;
        }
        final Path logDirectory = ApplicationConfig.getConfigDirectory().resolve("log");
        configureFileLogging(logDirectory);
        return logDirectory;
    }

    static void configureFileLogging(final Path logDirectory) {
        // Logging is not up yet, so problems can only go to stderr
        try {
            Files.createDirectories(logDirectory);
        } catch (final IOException e) {
            System.err.println("Warning: Could not create log directory " + logDirectory + ": " + e.getMessage());
        }

        final URL deployedConfig = LoggingConfigurator.class.getClassLoader().getResource(DEPLOYED_CONFIG);
        if (deployedConfig == null) {
            System.err.println("Warning: " + DEPLOYED_CONFIG + " not found on classpath, keeping console logging");
            return;
        }

        final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        context.reset();
        context.putProperty(LOG_DIR_PROPERTY, logDirectory.toAbsolutePath().toString());

        final JoranConfigurator configurator = new JoranConfigurator();
        configurator.setContext(context);
        try {
            configurator.doConfigure(deployedConfig);
        } catch (final JoranException e) {
            System.err.println("Warning: Error loading " + DEPLOYED_CONFIG + ": " + e.getMessage());
        }
        StatusPrinter.printInCaseOfErrorsOrWarnings(context);
    }
}
