package org.zerox.junit.extensions.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.turbo.TurboFilter;
import ch.qos.logback.core.spi.FilterReply;
import org.junit.jupiter.api.extension.AfterAllCallback;
import org.junit.jupiter.api.extension.AfterEachCallback;
import org.junit.jupiter.api.extension.BeforeAllCallback;
import org.junit.jupiter.api.extension.BeforeEachCallback;
import org.junit.jupiter.api.extension.ExtensionContext;
import org.slf4j.LoggerFactory;
import org.slf4j.Marker;
import org.slf4j.helpers.MessageFormatter;

import java.lang.reflect.AnnotatedElement;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.regex.Pattern;

/**
 * Fails a test when it logs at or above the configured level (WARN by default) without an
 * {@link AllowLog} or {@link ExpectLog} permitting it, or when an {@link ExpectLog} is not met.
 * <p>
 * Matching events are swallowed so that expected compiler errors do not clutter the test output.
 */
public class LogWatchExtension implements BeforeAllCallback, BeforeEachCallback, AfterEachCallback, AfterAllCallback {

    private static final ExtensionContext.Namespace NAMESPACE = ExtensionContext.Namespace.create(LogWatchExtension.class);
    private static final String FILTER_KEY = "filter";

    @Override
    public void beforeAll(ExtensionContext context) {
        CapturingFilter filter = new CapturingFilter(Rules.resolve(context));
        filter.start();
        loggerContext().addTurboFilter(filter);
        context.getStore(NAMESPACE).put(FILTER_KEY, filter);
    }

    @Override
    public void beforeEach(ExtensionContext context) {
        CapturingFilter filter = filter(context);
        if (filter != null) {
            filter.rules = Rules.resolve(context);
            filter.events.clear();
        }
    }

    @Override
    public void afterEach(ExtensionContext context) {
        CapturingFilter filter = filter(context);
        if (filter == null) {
            return;
        }
        Rules rules = filter.rules;
        List<String> problems = new ArrayList<>();
        if (!rules.disabled) {
            for (Event event : filter.events) {
                if (event.level.isGreaterOrEqual(rules.threshold) && !rules.permits(event)) {
                    problems.add("Unexpected log: " + event);
                }
            }
        }
        for (ExpectLog expect : rules.expects) {
            long count = filter.events.stream().filter(e -> matches(e, expect)).count();
            if (count < expect.occurrences()) {
                problems.add(String.format("Missing expected log: %d x [%s] logger=\"%s\" message=\"%s\", found %d",
                        expect.occurrences(), expect.level(), expect.loggerPattern(), expect.messagePattern(), count));
            }
        }
        filter.events.clear();
        if (!problems.isEmpty()) {
            throw new AssertionError(String.join("\n", problems));
        }
    }

    @Override
    public void afterAll(ExtensionContext context) {
        CapturingFilter filter = context.getStore(NAMESPACE).remove(FILTER_KEY, CapturingFilter.class);
        if (filter != null) {
            loggerContext().getTurboFilterList().remove(filter);
            filter.stop();
        }
    }

    private static CapturingFilter filter(ExtensionContext context) {
        // The filter is stored on the class-level context; method contexts see it through the parent store.
        return context.getStore(NAMESPACE).get(FILTER_KEY, CapturingFilter.class);
    }

    private static LoggerContext loggerContext() {
        return (LoggerContext) LoggerFactory.getILoggerFactory();
    }

    private static Level toLogback(LogLevel level) {
        return switch (level) {
            case DEBUG -> Level.DEBUG;
            case INFO -> Level.INFO;
            case WARN -> Level.WARN;
            case ERROR -> Level.ERROR;
        };
    }

    private static boolean matches(Event event, AllowLog allow) {
        return matches(event, allow.level(), allow.loggerPattern(), allow.messagePattern());
    }

    private static boolean matches(Event event, ExpectLog expect) {
        return matches(event, expect.level(), expect.loggerPattern(), expect.messagePattern());
    }

    private static boolean matches(Event event, LogLevel level, String loggerPattern, String messagePattern) {
        return event.level.isGreaterOrEqual(toLogback(level))
                && Pattern.matches(loggerPattern, event.logger)
                && Pattern.matches(messagePattern, event.message);
    }

    private static final class Rules {
        final Level threshold;
        final boolean disabled;
        final List<AllowLog> allows;
        final List<ExpectLog> expects;

        private Rules(Level threshold, boolean disabled, List<AllowLog> allows, List<ExpectLog> expects) {
            this.threshold = threshold;
            this.disabled = disabled;
            this.allows = allows;
            this.expects = expects;
        }

        static Rules resolve(ExtensionContext context) {
            Optional<Class<?>> testClass = context.getTestClass();
            Optional<AnnotatedElement> element = context.getElement();
            FailOnLog failOnLog = element.map(e -> e.getAnnotation(FailOnLog.class))
                    .orElse(testClass.map(c -> c.getAnnotation(FailOnLog.class)).orElse(null));

            List<AllowLog> allows = new ArrayList<>();
            List<ExpectLog> expects = new ArrayList<>();
            testClass.ifPresent(c -> {
                allows.addAll(List.of(c.getAnnotationsByType(AllowLog.class)));
                expects.addAll(List.of(c.getAnnotationsByType(ExpectLog.class)));
            });
            element.filter(e -> !(e instanceof Class)).ifPresent(e -> {
                allows.addAll(List.of(e.getAnnotationsByType(AllowLog.class)));
                expects.addAll(List.of(e.getAnnotationsByType(ExpectLog.class)));
            });

            Level threshold = toLogback(failOnLog != null ? failOnLog.level() : LogLevel.WARN);
            boolean disabled = failOnLog != null && failOnLog.disabled();
            return new Rules(threshold, disabled, List.copyOf(allows), List.copyOf(expects));
        }

        boolean permits(Event event) {
            return allows.stream().anyMatch(a -> matches(event, a)) || expects.stream().anyMatch(e -> matches(event, e));
        }
    }

    private static final class CapturingFilter extends TurboFilter {
        final List<Event> events = new CopyOnWriteArrayList<>();
        volatile Rules rules;

        CapturingFilter(Rules rules) {
            this.rules = rules;
        }

        @Override
        public FilterReply decide(Marker marker, ch.qos.logback.classic.Logger logger, Level level,
                                  String format, Object[] params, Throwable t) {
            // A null format is a level probe such as isDebugEnabled(), not an event.
            if (level == null || format == null || !level.isGreaterOrEqual(logger.getEffectiveLevel())) {
                return FilterReply.NEUTRAL;
            }
            String message = MessageFormatter.arrayFormat(format, params).getMessage();
            Event event = new Event(logger.getName(), level, message == null ? "" : message);
            events.add(event);
            return rules.permits(event) ? FilterReply.DENY : FilterReply.NEUTRAL;
        }
    }

    private static final class Event {
        final String logger;
        final Level level;
        final String message;

        Event(String logger, Level level, String message) {
            this.logger = logger;
            this.level = level;
            this.message = message;
        }

        @Override
        public String toString() {
            return "[" + level + "] " + logger + " - " + message;
        }
    }
}
