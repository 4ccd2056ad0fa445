package io.skipkp.http;

import com.sun.net.httpserver.HttpServer;
import io.skipkp.runtime.KeyProviderRuntime;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Plain HTTP listener for the protocol endpoints. TLS is terminated in front of it.
 */
public final class KeyProviderServer implements AutoCloseable {
    private static final int STOP_DELAY_SECONDS = 0;

    private final HttpServer server;
    private final ExecutorService executor;

    public KeyProviderServer(KeyProviderRuntime runtime, String host, int port) throws IOException {
        this.server = HttpServer.create(new InetSocketAddress(host, port), 0);
        AtomicInteger seq = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(Math.max(1, runtime.config().httpThreads()), r -> {
            Thread thread = new Thread(r, "skip-kp-http-" + seq.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
        server.createContext("/", new ProtocolHandler(runtime));
        server.setExecutor(executor);
    }

    public void start() {
        server.start();
    }

    /**
     * Bound port; differs from the requested one when 0 was passed.
     */
    public int port() {
        return server.getAddress().getPort();
    }

    public String baseUrl() {
        return "http://" + server.getAddress().getHostString() + ":" + port();
    }

    public void stop() {
        server.stop(STOP_DELAY_SECONDS);
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void close() {
        stop();
    }
}
