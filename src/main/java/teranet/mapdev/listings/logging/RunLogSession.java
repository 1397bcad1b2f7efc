package teranet.mapdev.listings.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.filter.ThresholdFilter;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.rolling.RollingFileAppender;
import ch.qos.logback.core.rolling.SizeAndTimeBasedRollingPolicy;
import ch.qos.logback.core.util.FileSize;
import org.slf4j.ILoggerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import teranet.mapdev.listings.config.EtlProperties;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * File log of a single pipeline run.
 *
 * Opening attaches a rolling file appender to the root logger; closing flushes it and
 * detaches it again, so nothing outlives the run. Falls back to a no-op handle when
 * the SLF4J backend is not Logback.
 */
public final class RunLogSession implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(RunLogSession.class);

    public static final String LOG_FILE_NAME = "etl_pipeline.log";

    private static final String APPENDER_NAME = "ETL_RUN_FILE";

    private final RollingFileAppender<ILoggingEvent> appender;
    private final ch.qos.logback.classic.Logger root;
    private final Path logFile;

    private RunLogSession(RollingFileAppender<ILoggingEvent> appender,
                          ch.qos.logback.classic.Logger root,
                          Path logFile) {
        this.appender = appender;
        this.root = root;
        this.logFile = logFile;
    }

    public static RunLogSession open(Path logDir, EtlProperties.Logging settings) {
        Path logFile = logDir.resolve(LOG_FILE_NAME);

        ILoggerFactory factory = LoggerFactory.getILoggerFactory();
        if (!(factory instanceof LoggerContext)) {
            logger.warn("Run log file requested but backend {} is not Logback; logging to console only",
                    factory.getClass().getName());
            return new RunLogSession(null, null, logFile);
        }
        LoggerContext context = (LoggerContext) factory;

        try {
            Files.createDirectories(logDir);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create log directory " + logDir, e);
        }

        PatternLayoutEncoder encoder = new PatternLayoutEncoder();
        encoder.setContext(context);
        encoder.setPattern(settings.getFormat());
        encoder.start();

        RollingFileAppender<ILoggingEvent> appender = new RollingFileAppender<>();
        appender.setContext(context);
        appender.setName(APPENDER_NAME);
        appender.setFile(logFile.toString());
        appender.setEncoder(encoder);

        SizeAndTimeBasedRollingPolicy<ILoggingEvent> policy = new SizeAndTimeBasedRollingPolicy<>();
        policy.setContext(context);
        policy.setParent(appender);
        policy.setFileNamePattern(logDir.resolve("etl_pipeline.%d{yyyy-MM-dd}.%i.log").toString());
        policy.setMaxFileSize(FileSize.valueOf(settings.getRotationFileSize()));
        policy.setMaxHistory(settings.getRetentionDays());
        policy.start();
        appender.setRollingPolicy(policy);

        ThresholdFilter threshold = new ThresholdFilter();
        threshold.setContext(context);
        threshold.setLevel(Level.toLevel(settings.getLevel(), Level.INFO).levelStr);
        threshold.start();
        appender.addFilter(threshold);

        appender.start();

        ch.qos.logback.classic.Logger root = context.getLogger(Logger.ROOT_LOGGER_NAME);
        root.addAppender(appender);

        logger.debug("Run log opened at {}", logFile);
        return new RunLogSession(appender, root, logFile);
    }

    public Path getLogFile() {
        return logFile;
    }

    public boolean isActive() {
        return appender != null && appender.isStarted();
    }

    @Override
    public void close() {
        if (appender == null) {
            return;
        }
        root.detachAppender(appender);
        appender.stop();
    }
}
