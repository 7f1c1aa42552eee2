package com.questrail.mitm.transport;

import java.net.InetSocketAddress;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Test-only {@link StreamConnector}. Connect attempts stay pending until the
 * test completes or fails them.
 */
public final class FakeStreamConnector implements StreamConnector {

    public static final class Attempt {
        private final InetSocketAddress remote;
        private final FrameListener listener;
        private final CompletableFuture<FrameChannel> future = new CompletableFuture<>();

        private Attempt(InetSocketAddress remote, FrameListener listener) {
            this.remote = remote;
            this.listener = listener;
        }

        public InetSocketAddress remote() {
            return remote;
        }

        /**
         * Completes the attempt with {@code channel}, wired to the caller's listener.
         */
        public FakeFrameChannel succeed(FakeFrameChannel channel) {
            channel.setListener(listener);
            future.complete(channel);
            return channel;
        }

        public void fail(Throwable cause) {
            future.completeExceptionally(cause);
        }
    }

    private final List<Attempt> attempts = new ArrayList<>();
    private boolean shutdown;

    @Override
    public synchronized CompletableFuture<FrameChannel> connect(InetSocketAddress remote, FrameListener listener) {
        Objects.requireNonNull(remote, "remote");
        Objects.requireNonNull(listener, "listener");
        Attempt attempt = new Attempt(remote, listener);
        attempts.add(attempt);
        return attempt.future;
    }

    @Override
    public synchronized void shutdown() {
        shutdown = true;
    }

    public synchronized List<Attempt> attempts() {
        return new ArrayList<>(attempts);
    }

    public synchronized Attempt lastAttempt() {
        if (attempts.isEmpty()) {
            throw new IllegalStateException("No connect attempt");
        }
        return attempts.get(attempts.size() - 1);
    }

    public synchronized boolean isShutdown() {
        return shutdown;
    }
}
