package io.liarslie.game;

import io.liarslie.agent.Agent;
import io.liarslie.client.ExpertSubsetSampler;
import io.liarslie.client.GameClient;
import io.liarslie.config.LiarsLieConfig;
import io.liarslie.lifecycle.AgentSupervisor;
import io.liarslie.lifecycle.SequenceAllocator;
import io.liarslie.model.AgentDescriptor;
import io.liarslie.model.AgentStatus;
import io.liarslie.storage.AgentRosterStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * One game session: the agents it spawned, the settings it was started with and the roster
 * file that publishes them to the client.
 *
 * <p>Killed agents stay in the session so the roster keeps listing them; agents that never
 * came up are dropped right after spawning. Not thread-safe; the shell drives it from one
 * thread.
 */
public final class Game implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(Game.class);

    public static final String NOT_STARTED_MESSAGE = "The game has not yet been started!";
    public static final String ALREADY_STARTED_MESSAGE = "The game has already been started!";

    private final LiarsLieConfig config;
    private final GameClient client;
    private final AgentSupervisor supervisor;
    private final AgentRosterStore roster;
    private final SequenceAllocator sequence;
    private final ExpertSubsetSampler sampler;
    private final List<Agent> agents;

    private boolean started;
    private long value;
    private long maxValue;
    private double tamperProbability;

    public Game(LiarsLieConfig config) {
        this(
                config,
                new GameClient(config),
                new AgentSupervisor(config),
                new AgentRosterStore(config.rosterFile()),
                new SequenceAllocator(config.firstAgentId(), config.basePort()),
                new ExpertSubsetSampler()
        );
    }

    public Game(
            LiarsLieConfig config,
            GameClient client,
            AgentSupervisor supervisor,
            AgentRosterStore roster,
            SequenceAllocator sequence,
            ExpertSubsetSampler sampler
    ) {
        this.config = config;
        this.client = client;
        this.supervisor = supervisor;
        this.roster = roster;
        this.sequence = sequence;
        this.sampler = sampler;
        this.agents = new ArrayList<>();
    }

    public boolean isStarted() {
        return started;
    }

    public List<Agent> agents() {
        return List.copyOf(agents);
    }

    /**
     * Spawns the initial population and publishes the roster. If the roster cannot be written
     * the spawned agents are stopped and the game stays unstarted.
     */
    public SpawnResult start(long value, long maxValue, int numAgents, double liarRatio, double tamperProbability)
            throws IOException {
        if (started) {
            throw new IllegalStateException(ALREADY_STARTED_MESSAGE);
        }
        if (value < 1 || maxValue < 2 || value > maxValue) {
            throw new IllegalArgumentException("value must be within [1, " + maxValue + "] and max value greater than 1");
        }
        if (tamperProbability < 0.0d || tamperProbability > 1.0d) {
            throw new IllegalArgumentException("tamper probability must be within [0.0, 1.0]: " + tamperProbability);
        }
        AgentDistribution distribution = AgentDistribution.of(numAgents, liarRatio);
        List<Agent> created = createAgents(distribution, value, maxValue, tamperProbability);
        agents.addAll(created);
        SpawnResult result = spawnAndPrune(created);
        try {
            roster.write(descriptors());
        } catch (IOException e) {
            LOG.warn("failed to write roster {}, stopping {} spawned agents", roster.file(), agents.size());
            agents.forEach(supervisor::stop);
            agents.clear();
            throw e;
        }
        this.value = value;
        this.maxValue = maxValue;
        this.tamperProbability = tamperProbability;
        this.started = true;
        LOG.info("game started with {} honest agents and {} liars", distribution.honest(), distribution.liars());
        return result;
    }

    /** Queries every agent listed in the roster directly. */
    public RoundResult play() throws IOException {
        requireStarted();
        List<AgentDescriptor> peers = loadRoster();
        List<Long> values = client.queryStandardRound(peers);
        return new RoundResult(peers.stream().map(AgentDescriptor::agentId).toList(), values);
    }

    /**
     * Adds agents with the settings the game was started with. On a roster write failure the
     * new agents are stopped and the session returns to its previous population.
     */
    public SpawnResult extend(int numAgents, double liarRatio) throws IOException {
        if (!started || !roster.exists()) {
            throw new IllegalStateException(NOT_STARTED_MESSAGE);
        }
        AgentDistribution distribution = AgentDistribution.of(numAgents, liarRatio);
        List<Agent> backup = List.copyOf(agents);
        List<Agent> created = createAgents(distribution, value, maxValue, tamperProbability);
        agents.addAll(created);
        SpawnResult result = spawnAndPrune(created);
        try {
            roster.write(descriptors());
        } catch (IOException e) {
            LOG.warn("failed to write roster {}, rolling back {} new agents", roster.file(), created.size());
            created.forEach(supervisor::stop);
            agents.clear();
            agents.addAll(backup);
            throw e;
        }
        return result;
    }

    /**
     * Plays a round through a random subset of relays. The subset sizes follow the same
     * distribution rule as {@link #start}; an unsatisfiable request fails before any query.
     */
    public RoundResult playExpert(int numAgents, double liarRatio) throws IOException {
        requireStarted();
        loadRoster();
        AgentDistribution distribution = AgentDistribution.of(numAgents, liarRatio);
        List<AgentDescriptor> subset = sampler.sample(agents, distribution.honest(), distribution.liars());
        List<Long> values = client.queryExpertRound(subset);
        return new RoundResult(subset.stream().map(AgentDescriptor::agentId).toList(), values);
    }

    /** Kills one running agent over the network. The roster is left as it is. */
    public AgentDescriptor kill(int agentId) throws IOException {
        requireStarted();
        Agent target = findActive(agentId)
                .orElseThrow(() -> new IllegalArgumentException(
                        "the ID '" + agentId + "' does not correspond to any active agent"));
        client.killAgent(target.id(), target.address(), target.port());
        if (!supervisor.awaitStopped(target, config.readTimeoutMs())) {
            LOG.warn("agent {} acknowledged no shutdown within {} ms", target.id(), config.readTimeoutMs());
        }
        return target.toDescriptor();
    }

    /**
     * Kills every running agent, removes the roster and releases the session's threads.
     * Individual failures are collected so the teardown always runs to the end.
     */
    public StopResult stop() {
        List<Integer> killed = new ArrayList<>();
        List<String> failures = new ArrayList<>();
        if (started) {
            for (Agent agent : agents) {
                if (agent.status() != AgentStatus.READY) {
                    continue;
                }
                try {
                    client.killAgent(agent.id(), agent.address(), agent.port());
                    killed.add(agent.id());
                } catch (IOException e) {
                    failures.add("unable to kill agent " + agent.id() + " - " + e.getMessage());
                }
            }
            try {
                roster.delete();
            } catch (IOException e) {
                failures.add("unable to remove " + roster.file() + " - " + e.getMessage());
            }
        }
        close();
        return new StopResult(killed, failures);
    }

    @Override
    public void close() {
        agents.forEach(supervisor::stop);
        started = false;
        supervisor.close();
        client.close();
    }

    private void requireStarted() {
        if (!started) {
            throw new IllegalStateException(NOT_STARTED_MESSAGE);
        }
    }

    // The roster, not the session, is what the client trusts for addresses and keys.
    private List<AgentDescriptor> loadRoster() throws IOException {
        List<AgentDescriptor> peers = roster.read();
        client.registry().replaceAll(peers);
        return peers;
    }

    private Optional<Agent> findActive(int agentId) {
        return agents.stream()
                .filter(agent -> agent.id() == agentId && agent.status() == AgentStatus.READY)
                .findFirst();
    }

    private List<Agent> createAgents(AgentDistribution distribution, long honestValue, long max, double tamper) {
        String address = config.agentAddress();
        String clientKey = client.publicKey();
        List<Agent> created = new ArrayList<>(distribution.total());
        for (int i = 0; i < distribution.honest(); i++) {
            created.add(Agent.honest(sequence, address, honestValue, clientKey));
        }
        for (int i = 0; i < distribution.liars(); i++) {
            created.add(Agent.liar(sequence, address, honestValue, max, clientKey, tamper));
        }
        return created;
    }

    private SpawnResult spawnAndPrune(List<Agent> created) {
        AgentSupervisor.SpawnReport report = supervisor.spawn(created);
        Set<Integer> failed = new HashSet<>(report.failed());
        agents.removeIf(agent -> failed.contains(agent.id()));
        return new SpawnResult(report.spawned(), report.failed());
    }

    private List<AgentDescriptor> descriptors() {
        return agents.stream().map(Agent::toDescriptor).toList();
    }
}
