package io.liarslie.lifecycle;

import io.liarslie.agent.Agent;
import io.liarslie.agent.AgentIdentity;
import io.liarslie.agent.AgentRuntime;
import io.liarslie.config.LiarsLieConfig;
import io.liarslie.model.AgentStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BiFunction;

/**
 * Owns the runtimes of spawned agents and is the only writer of {@link Agent#status()}.
 *
 * <p>{@link #spawn(List)} starts a runtime for every uninitialized agent, then waits for each
 * one-shot readiness acknowledgment. Agents that acknowledged become READY; agents whose
 * runtime ended or timed out without acknowledging are reported as failed so the caller can
 * prune them. An agent becomes KILLED when its runtime stops accepting.
 */
public final class AgentSupervisor implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(AgentSupervisor.class);

    private final LiarsLieConfig config;
    private final BiFunction<AgentIdentity, ShutdownSignal, AgentRuntime> runtimeFactory;
    private final ExecutorService listeners;
    private final ConcurrentMap<Integer, AgentRuntime> running;

    public AgentSupervisor(LiarsLieConfig config) {
        this(config, (identity, signal) -> new AgentRuntime(identity, config, signal));
    }

    public AgentSupervisor(LiarsLieConfig config, BiFunction<AgentIdentity, ShutdownSignal, AgentRuntime> runtimeFactory) {
        this.config = config;
        this.runtimeFactory = runtimeFactory;
        AtomicInteger counter = new AtomicInteger();
        this.listeners = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "agent-listener-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
        this.running = new ConcurrentHashMap<>();
    }

    public SpawnReport spawn(List<Agent> agents) {
        Map<Agent, AgentRuntime> launched = new LinkedHashMap<>();
        for (Agent agent : agents) {
            if (agent.status() != AgentStatus.UNINITIALIZED) {
                continue;
            }
            AgentRuntime runtime = runtimeFactory.apply(agent.identity(), new ShutdownSignal());
            running.put(agent.id(), runtime);
            runtime.terminated().thenRun(() -> {
                running.remove(agent.id(), runtime);
                agent.markKilled();
            });
            launched.put(agent, runtime);
            listeners.execute(runtime);
        }

        List<Integer> spawned = new ArrayList<>();
        List<Integer> failed = new ArrayList<>();
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(config.readyTimeoutMs());
        for (Map.Entry<Agent, AgentRuntime> entry : launched.entrySet()) {
            Agent agent = entry.getKey();
            AgentRuntime runtime = entry.getValue();
            if (awaitReady(agent, runtime, deadline) && agent.markReady()) {
                spawned.add(agent.id());
            } else {
                failed.add(agent.id());
            }
        }
        if (!failed.isEmpty()) {
            LOG.warn("{} of {} agents failed to start: {}", failed.size(), launched.size(), failed);
        }
        return new SpawnReport(List.copyOf(spawned), List.copyOf(failed));
    }

    // Stops the runtime locally, without going through the network. Used for rollback and teardown.
    public void stop(Agent agent) {
        AgentRuntime runtime = running.get(agent.id());
        if (runtime != null) {
            runtime.shutdownSignal().fire();
        }
        agent.markKilled();
    }

    // Waits for the runtime to stop accepting, then records the agent as killed.
    public boolean awaitStopped(Agent agent, long timeoutMs) {
        AgentRuntime runtime = running.get(agent.id());
        if (runtime != null) {
            try {
                runtime.terminated().get(timeoutMs, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            } catch (ExecutionException | TimeoutException e) {
                LOG.warn("agent {} still running after {} ms", agent.id(), timeoutMs);
                return false;
            }
        }
        agent.markKilled();
        return true;
    }

    @Override
    public void close() {
        for (AgentRuntime runtime : running.values()) {
            runtime.shutdownSignal().fire();
        }
        listeners.shutdown();
        try {
            if (!listeners.awaitTermination(config.readyTimeoutMs(), TimeUnit.MILLISECONDS)) {
                LOG.warn("agent listeners still running after {} ms", config.readyTimeoutMs());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private boolean awaitReady(Agent agent, AgentRuntime runtime, long deadlineNanos) {
        long remaining = Math.max(0L, deadlineNanos - System.nanoTime());
        try {
            Integer acknowledged = runtime.readiness().get(remaining, TimeUnit.NANOSECONDS);
            return acknowledged != null && acknowledged == agent.id();
        } catch (ExecutionException e) {
            LOG.warn("agent {} did not start - {}", agent.id(), e.getCause() == null ? e.getMessage() : e.getCause().getMessage());
            return false;
        } catch (TimeoutException e) {
            LOG.warn("agent {} did not acknowledge readiness within {} ms", agent.id(), config.readyTimeoutMs());
            runtime.shutdownSignal().fire();
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            runtime.shutdownSignal().fire();
            return false;
        }
    }

    public record SpawnReport(List<Integer> spawned, List<Integer> failed) {
    }
}
