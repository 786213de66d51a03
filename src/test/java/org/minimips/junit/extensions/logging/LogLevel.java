package org.minimips.junit.extensions.logging;

public enum LogLevel {
    DEBUG,
    INFO,
    WARN,
    ERROR
}
