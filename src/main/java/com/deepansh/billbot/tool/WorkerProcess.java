package com.deepansh.billbot.tool;

import java.io.InputStream;
import java.io.OutputStream;
import java.util.concurrent.CompletableFuture;

/**
 * The slice of an OS process the tool connection needs. Production code wraps
 * {@link Process}; tests substitute an in-memory worker over piped streams.
 */
public interface WorkerProcess {

    OutputStream stdin();

    InputStream stdout();

    InputStream stderr();

    boolean isAlive();

    /** Completes with the exit code once the process has terminated. */
    CompletableFuture<Integer> onExit();

    /** Polite termination (SIGTERM). */
    void destroy();

    void destroyForcibly();

    long pid();
}
