package com.lambdalab.debug;

/** Pluggable debug output target (stdout, a test collector, the front end console). */
public interface DebugSink {
    void log(DebugLevel level, String tag, String message, Throwable error);
}
