package org.javai.askdata.testsupport;

import java.io.Serializable;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.core.Layout;
import org.apache.logging.log4j.core.LogEvent;
import org.apache.logging.log4j.core.LoggerContext;
import org.apache.logging.log4j.core.appender.AbstractAppender;
import org.apache.logging.log4j.core.config.Configuration;
import org.apache.logging.log4j.core.config.LoggerConfig;
import org.apache.logging.log4j.core.config.Property;
import org.apache.logging.log4j.core.layout.PatternLayout;

/**
 * Captures what one class logs so tests can assert on it.
 *
 * <pre>
 * try (LogCaptorAppender logs = LogCaptorAppender.create(QueryValidator.class, Level.WARN)) {
 *     validator.validate(candidate);
 *     assertThat(logs.messagesAt(Level.WARN)).anyMatch(m -&gt; m.contains("DENYLIST_MATCH"));
 * }
 * </pre>
 */
public final class LogCaptorAppender extends AbstractAppender implements AutoCloseable {

	private final LoggerContext context;
	private final LoggerConfig loggerConfig;
	private final Level previousLevel;
	private final boolean addedConfig;
	private final List<LogEvent> events = new CopyOnWriteArrayList<>();

	private LogCaptorAppender(String name, LoggerContext context, LoggerConfig loggerConfig, Level previousLevel,
			boolean addedConfig, Layout<? extends Serializable> layout) {
		super(name, null, layout, false, Property.EMPTY_ARRAY);
		this.context = context;
		this.loggerConfig = loggerConfig;
		this.previousLevel = previousLevel;
		this.addedConfig = addedConfig;
	}

	public static LogCaptorAppender create(Class<?> loggerClass, Level level) {
		String loggerName = loggerClass.getName();
		LoggerContext context = (LoggerContext) LogManager.getContext(false);
		Configuration configuration = context.getConfiguration();
		LoggerConfig loggerConfig = configuration.getLoggerConfig(loggerName);

		boolean addedConfig = false;
		if (!loggerConfig.getName().equals(loggerName)) {
			LoggerConfig own = new LoggerConfig(loggerName, level, true);
			configuration.addLogger(loggerName, own);
			loggerConfig = own;
			addedConfig = true;
		}
		Level previousLevel = loggerConfig.getLevel();
		loggerConfig.setLevel(level);

		LogCaptorAppender appender = new LogCaptorAppender("captor-" + loggerClass.getSimpleName() + "-" + System.nanoTime(),
				context, loggerConfig, previousLevel, addedConfig,
				PatternLayout.newBuilder().withPattern("%-5level %msg").build());
		appender.start();
		loggerConfig.addAppender(appender, level, null);
		context.updateLoggers();
		return appender;
	}

	@Override
	public void append(LogEvent event) {
		events.add(event.toImmutable());
	}

	public List<LogEvent> events() {
		return Collections.unmodifiableList(events);
	}

	public List<String> messages() {
		return events.stream()
				.map(e -> e.getMessage().getFormattedMessage())
				.toList();
	}

	public List<String> messagesAt(Level level) {
		return events.stream()
				.filter(e -> e.getLevel() == level)
				.map(e -> e.getMessage().getFormattedMessage())
				.toList();
	}

	@Override
	public void close() {
		stop();
		loggerConfig.removeAppender(getName());
		if (addedConfig) {
			context.getConfiguration().removeLogger(loggerConfig.getName());
		}
		else {
			loggerConfig.setLevel(previousLevel);
		}
		context.updateLoggers();
		events.clear();
	}
}
