package org.splc.junit.extensions.logging;

/**
 * Log levels the {@link LogWatchExtension} can watch.
 */
public enum LogLevel {
    DEBUG,
    INFO,
    WARN,
    ERROR
}
