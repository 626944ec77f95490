package com.lambdalab.debug;

/** Severity of a {@link Debug} message, lowest first. */
public enum DebugLevel {
    TRACE,
    DEBUG,
    INFO,
    WARN,
    ERROR
}
