package com.github.anirbanmu.classcal.source;

import java.io.IOException;

/**
 * An authenticated portal session. Obtaining one logs in; {@link #close()} logs out, so
 * try-with-resources releases it on every exit path and a logout failure is attached to the
 * original error as suppressed instead of replacing it.
 */
public interface PortalSession extends ScheduleSource, AutoCloseable {
    boolean loggedIn();

    @Override
    void close() throws IOException, InterruptedException;
}
