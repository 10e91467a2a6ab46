package com.mimecast.xoauth2;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.core.LogEvent;
import org.apache.logging.log4j.core.Logger;
import org.apache.logging.log4j.core.LoggerContext;
import org.apache.logging.log4j.core.appender.AbstractAppender;
import org.apache.logging.log4j.core.config.Configurator;
import org.apache.logging.log4j.core.config.Property;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * Log4j2 appender collecting the events of one class logger for assertions.
 *
 * <p>Usage example:
 * <pre>
 * LogCaptureAppender appender = LogCaptureAppender.attach(PasswordStoreSource.class);
 * try {
 *     // Exercise.
 *     assertEquals(2, appender.getMessages(Level.WARN).size());
 * } finally {
 *     appender.detach();
 * }
 * </pre>
 */
public class LogCaptureAppender extends AbstractAppender {

    private final Logger logger;
    private final List<LogEvent> events = new CopyOnWriteArrayList<>();

    private LogCaptureAppender(Logger logger) {
        super("LogCapture-" + logger.getName(), null, null, true, Property.EMPTY_ARRAY);
        this.logger = logger;
    }

    /**
     * Attaches a new appender to the logger of the given class.
     * <p>The logger level is reset to DEBUG since other tests may switch logging off.
     *
     * @param clazz Class whose logger to capture.
     * @return LogCaptureAppender instance.
     */
    public static LogCaptureAppender attach(Class<?> clazz) {
        Configurator.setLevel(clazz.getName(), Level.DEBUG);

        LoggerContext context = (LoggerContext) LogManager.getContext(false);
        LogCaptureAppender appender = new LogCaptureAppender(context.getLogger(clazz.getName()));
        appender.start();
        appender.logger.addAppender(appender);
        return appender;
    }

    @Override
    public void append(LogEvent event) {
        events.add(event.toImmutable());
    }

    /**
     * Gets formatted messages logged at a level.
     *
     * @param level Level.
     * @return List of messages.
     */
    public List<String> getMessages(Level level) {
        return events.stream()
                .filter(event -> event.getLevel().equals(level))
                .map(event -> event.getMessage().getFormattedMessage())
                .collect(Collectors.toList());
    }

    /**
     * Detaches and stops this appender.
     */
    public void detach() {
        logger.removeAppender(this);
        stop();
    }
}
