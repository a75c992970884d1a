package com.codefarm.shorturl.logging;

import java.util.concurrent.CompletableFuture;

public class NoOpLogSink implements LogSink {

    @Override
    public CompletableFuture<Void> log(String stack, String level, String packageName, String message) {
        return CompletableFuture.completedFuture(null);
    }
}
