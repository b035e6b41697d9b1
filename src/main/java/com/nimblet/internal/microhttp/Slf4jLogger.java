package com.nimblet.internal.microhttp;

import java.util.StringJoiner;

/**
 * Routes event loop diagnostics to SLF4J at debug level.
 */
public final class Slf4jLogger implements Logger {
    private final org.slf4j.Logger delegate;

    public Slf4jLogger(org.slf4j.Logger delegate) {
        this.delegate = delegate;
    }

    @Override
    public boolean enabled() {
        return delegate.isDebugEnabled();
    }

    @Override
    public void log(LogField... fields) {
        delegate.debug(render(fields));
    }

    @Override
    public void log(Exception e, LogField... fields) {
        delegate.debug(render(fields), e);
    }

    static String render(LogField... fields) {
        StringJoiner joiner = new StringJoiner(", ");
        for (LogField field : fields) {
            joiner.add(field.key() + "=" + field.value());
        }
        return joiner.toString();
    }
}
