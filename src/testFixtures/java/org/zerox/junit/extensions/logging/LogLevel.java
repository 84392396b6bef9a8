package org.zerox.junit.extensions.logging;

/**
 * Log levels that tests can allow, expect or fail on.
 */
public enum LogLevel {
    DEBUG,
    INFO,
    WARN,
    ERROR
}
