package com.useless.debug;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Global debug hub for the UselessScript runtime.
 *
 * - Singleton access via Debug.get()
 * - Pluggable sink via setSink(...); no-op until one is installed
 * - Components hold a {@link Tagged} view so call sites stay short
 */
public final class Debug {

    private static final DebugSink NOOP = (level, tag, message, error) -> {
        // nothing installed
    };

    // Must follow NOOP: the constructor reads it.
    private static final Debug INSTANCE = new Debug();

    private final AtomicReference<DebugSink> sinkRef = new AtomicReference<>(NOOP);

    private Debug() {}

    public static Debug get() {
        return INSTANCE;
    }

    /** Shorthand for {@code Debug.get().tagged(tag)}. */
    public static Tagged tag(String tag) {
        return INSTANCE.tagged(tag);
    }

    public void setSink(DebugSink sink) {
        sinkRef.set(sink == null ? NOOP : sink);
    }

    public DebugSink getSink() {
        return sinkRef.get();
    }

    public boolean hasSink() {
        return sinkRef.get() != NOOP;
    }

    public Tagged tagged(String tag) {
        return new Tagged(this, tag);
    }

    public void log(DebugLevel level, String tag, String message, Throwable error) {
        sinkRef.get().log(level, tag, message, error);
    }

    /** A fixed-tag view of the hub. Message formatting is skipped when no sink is installed. */
    public static final class Tagged {
        private final Debug hub;
        private final String tag;

        private Tagged(Debug hub, String tag) {
            this.hub = hub;
            this.tag = tag;
        }

        public void t(String fmt, Object... args) { emit(DebugLevel.TRACE, fmt, args); }
        public void d(String fmt, Object... args) { emit(DebugLevel.DEBUG, fmt, args); }
        public void i(String fmt, Object... args) { emit(DebugLevel.INFO, fmt, args); }
        public void w(String fmt, Object... args) { emit(DebugLevel.WARN, fmt, args); }

        private void emit(DebugLevel level, String fmt, Object... args) {
            if (!hub.hasSink()) return;
            String msg = (args == null || args.length == 0) ? fmt : String.format(fmt, args);
            hub.log(level, tag, msg, null);
        }
    }
}
