package org.zerox.junit.extensions.logging;

import java.lang.annotation.ElementType;
import java.lang.annotation.Repeatable;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Requires a matching log event to be emitted during the test, at least {@link #occurrences()} times.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.TYPE, ElementType.METHOD})
@Repeatable(ExpectLogs.class)
public @interface ExpectLog {
    LogLevel level();
    String loggerPattern() default ".*";
    String messagePattern() default ".*";
    int occurrences() default 1;
}
