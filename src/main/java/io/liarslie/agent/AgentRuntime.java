package io.liarslie.agent;

import io.liarslie.config.LiarsLieConfig;
import io.liarslie.lifecycle.ShutdownSignal;
import io.liarslie.net.PeerChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * The listening side of one agent.
 *
 * <p>{@link #run()} binds the socket, acknowledges readiness with the agent id and accepts
 * connections until the shutdown signal fires. Every accepted connection is handed to its
 * own handler task. Firing the signal closes the listening socket; handlers already running
 * finish their exchange. Peer queries issued by relay requests run on a separate pool that
 * is shut down only after those handlers are done.
 *
 * <p>A bind failure completes {@link #readiness()} exceptionally and the runtime ends
 * without ever accepting.
 */
public final class AgentRuntime implements Runnable {
    private static final Logger LOG = LoggerFactory.getLogger(AgentRuntime.class);

    private final AgentIdentity identity;
    private final ShutdownSignal shutdownSignal;
    private final AgentConnectionHandler handler;
    private final ExecutorService workers;
    private final ExecutorService fetchers;
    private final long drainTimeoutMs;
    private final CompletableFuture<Integer> readiness;
    private final CompletableFuture<Void> terminated;

    public AgentRuntime(AgentIdentity identity, LiarsLieConfig config, ShutdownSignal shutdownSignal) {
        this(identity, config, shutdownSignal, Tamperer.forAgent(identity));
    }

    public AgentRuntime(AgentIdentity identity, LiarsLieConfig config, ShutdownSignal shutdownSignal, Tamperer tamperer) {
        this.identity = identity;
        this.shutdownSignal = shutdownSignal;
        this.workers = Executors.newCachedThreadPool(namedThreads(identity.agentId(), "worker"));
        this.fetchers = Executors.newCachedThreadPool(namedThreads(identity.agentId(), "fetch"));
        PeerChannel peerChannel = PeerChannel.from(config);
        // A handler reads its request, then may spend one peer exchange collecting values.
        this.drainTimeoutMs = (long) config.readTimeoutMs() + peerChannel.exchangeBudgetMs();
        this.handler = new AgentConnectionHandler(
                identity,
                shutdownSignal,
                peerChannel,
                fetchers,
                tamperer,
                config.readTimeoutMs()
        );
        this.readiness = new CompletableFuture<>();
        this.terminated = new CompletableFuture<>();
    }

    public CompletableFuture<Integer> readiness() {
        return readiness;
    }

    public CompletableFuture<Void> terminated() {
        return terminated;
    }

    public ShutdownSignal shutdownSignal() {
        return shutdownSignal;
    }

    @Override
    public void run() {
        ServerSocket server;
        try {
            server = new ServerSocket();
            server.setReuseAddress(true);
            server.bind(new InetSocketAddress(identity.address(), identity.port()));
        } catch (IOException e) {
            LOG.warn("failed to bind agent {} to {}:{} - {}", identity.agentId(), identity.address(), identity.port(), e.getMessage());
            workers.shutdown();
            fetchers.shutdown();
            readiness.completeExceptionally(e);
            terminated.complete(null);
            return;
        }

        shutdownSignal.onFire(() -> closeListener(server));
        LOG.info("spawned agent {} listening on {}:{}", identity.agentId(), identity.address(), identity.port());
        readiness.complete(identity.agentId());

        try {
            acceptLoop(server);
        } finally {
            closeListener(server);
            workers.shutdown();
            LOG.info("agent {} stopped accepting connections", identity.agentId());
            terminated.complete(null);
            drainHandlers();
        }
    }

    private void drainHandlers() {
        try {
            if (!workers.awaitTermination(drainTimeoutMs, TimeUnit.MILLISECONDS)) {
                LOG.warn("agent {}: handlers still running after {} ms", identity.agentId(), drainTimeoutMs);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            fetchers.shutdown();
        }
    }

    private void acceptLoop(ServerSocket server) {
        while (!shutdownSignal.isFired()) {
            Socket connection;
            try {
                connection = server.accept();
            } catch (IOException e) {
                if (shutdownSignal.isFired() || server.isClosed()) {
                    break;
                }
                LOG.warn("agent {}: couldn't accept connection - {}", identity.agentId(), e.getMessage());
                continue;
            }
            try {
                workers.execute(() -> handler.handle(connection));
            } catch (RuntimeException e) {
                LOG.warn("agent {}: unable to schedule connection handler - {}", identity.agentId(), e.getMessage());
                closeConnection(connection);
            }
        }
    }

    private void closeListener(ServerSocket server) {
        try {
            server.close();
        } catch (IOException e) {
            LOG.debug("agent {}: error closing listener - {}", identity.agentId(), e.getMessage());
        }
    }

    private void closeConnection(Socket connection) {
        try {
            connection.close();
        } catch (IOException e) {
            LOG.debug("agent {}: error closing connection - {}", identity.agentId(), e.getMessage());
        }
    }

    private static ThreadFactory namedThreads(int agentId, String role) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "agent-" + agentId + "-" + role + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
