package com.lambdalab.debug;

import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Process-wide log hub for the LambdaLab engine.
 *
 * Components hold a {@link Channel} bound to their tag:
 * <pre>
 *   private static final Debug.Channel LOG = Debug.channel("Runner");
 *   LOG.d("stepped");
 *   LOG.t(() -> "expensive " + render());
 * </pre>
 * Nothing is emitted until a sink is installed with {@link #setSink}.
 * Supplier messages are only built when a sink is present.
 */
public final class Debug {

    // must be initialised before INSTANCE
    private static final DebugSink NOOP = (level, tag, message, error) -> {
        // no sink installed
    };

    private static final Debug INSTANCE = new Debug();

    private final AtomicReference<DebugSink> sinkRef = new AtomicReference<>(NOOP);

    private Debug() {}

    public static Debug get() {
        return INSTANCE;
    }

    public static Channel channel(String tag) {
        return new Channel(tag);
    }

    /** Installs {@code sink}; null restores the silent default. */
    public void setSink(DebugSink sink) {
        sinkRef.set(sink == null ? NOOP : sink);
    }

    public boolean isActive() {
        return sinkRef.get() != NOOP;
    }

    public void log(DebugLevel level, String tag, String message, Throwable error) {
        sinkRef.get().log(level, tag, message, error);
    }

    /** Tag-bound front end to the hub. */
    public static final class Channel {
        private final String tag;

        private Channel(String tag) {
            this.tag = tag;
        }

        public void t(String msg) { INSTANCE.log(DebugLevel.TRACE, tag, msg, null); }
        public void d(String msg) { INSTANCE.log(DebugLevel.DEBUG, tag, msg, null); }
        public void i(String msg) { INSTANCE.log(DebugLevel.INFO,  tag, msg, null); }
        public void w(String msg) { INSTANCE.log(DebugLevel.WARN,  tag, msg, null); }
        public void e(String msg, Throwable err) { INSTANCE.log(DebugLevel.ERROR, tag, msg, err); }

        public void t(Supplier<String> msg) {
            if (INSTANCE.isActive()) t(msg.get());
        }

        public void d(Supplier<String> msg) {
            if (INSTANCE.isActive()) d(msg.get());
        }
    }
}
