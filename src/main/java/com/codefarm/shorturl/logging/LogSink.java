package com.codefarm.shorturl.logging;

import java.util.concurrent.CompletableFuture;

/**
 * Structured log collaborator. Delivery is best effort: the returned future always completes
 * normally, whatever happens to the log line.
 */
public interface LogSink {

    CompletableFuture<Void> log(String stack, String level, String packageName, String message);
}
