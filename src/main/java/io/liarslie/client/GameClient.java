package io.liarslie.client;

import io.liarslie.codec.Envelope;
import io.liarslie.config.LiarsLieConfig;
import io.liarslie.model.AgentDescriptor;
import io.liarslie.net.PeerChannel;
import io.liarslie.protocol.Message;
import io.liarslie.protocol.MessageCodec;
import io.liarslie.protocol.Messages;
import io.liarslie.security.AuthException;
import io.liarslie.security.Signatures;
import io.liarslie.security.SigningKeys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * The coordinating side of the game.
 *
 * <p>Both rounds fan out one task per peer and join them all before aggregating; a peer that
 * cannot be reached or whose answer does not authenticate simply contributes nothing.
 * Every vote is verified against the key of the agent that reported it, so a relay can drop
 * votes but cannot forge them.
 */
public final class GameClient implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(GameClient.class);
    static final int RELAY_MARGIN_MS = 1_000;

    private final SigningKeys keys;
    private final PeerRegistry registry;
    private final PeerChannel channel;
    private final PeerChannel relayChannel;
    private final ExecutorService executor;

    public GameClient(LiarsLieConfig config) {
        this(Signatures.generateKeyPair(), new PeerRegistry(), PeerChannel.from(config), queryThreads());
    }

    public GameClient(SigningKeys keys, PeerRegistry registry, PeerChannel channel, ExecutorService executor) {
        this.keys = keys;
        this.registry = registry;
        this.channel = channel;
        // A relay may spend a full peer exchange on its slowest peer before it answers.
        this.relayChannel = channel.withReadTimeout(channel.exchangeBudgetMs() + RELAY_MARGIN_MS);
        this.executor = executor;
    }

    public String publicKey() {
        return keys.publicKey();
    }

    public PeerRegistry registry() {
        return registry;
    }

    /** Asks every peer for its own value and keeps the answers signed by that peer. */
    public List<Long> queryStandardRound(List<AgentDescriptor> peers) {
        Envelope query = Signatures.seal(keys, Messages.queryValue());
        List<CompletableFuture<Optional<Long>>> pending = new ArrayList<>(peers.size());
        for (AgentDescriptor peer : peers) {
            pending.add(submit(peer, () -> queryValue(peer, query), Optional.empty()));
        }
        List<Long> values = new ArrayList<>(pending.size());
        for (CompletableFuture<Optional<Long>> future : pending) {
            future.join().ifPresent(values::add);
        }
        return values;
    }

    /**
     * Asks each relay of the subset to poll every registered agent and forward the answers.
     * Votes are deduplicated by (reporter, value), so the same vote relayed twice counts once.
     *
     * @return one value per distinct authenticated vote
     */
    public List<Long> queryExpertRound(List<AgentDescriptor> expertSubset) {
        List<AgentDescriptor> allPeers = registry.list();
        List<CompletableFuture<List<Vote>>> pending = new ArrayList<>(expertSubset.size());
        for (AgentDescriptor relay : expertSubset) {
            Envelope fetch = Signatures.seal(keys, Messages.fetchValues(relay.agentId(), allPeers));
            pending.add(submit(relay, () -> fetchVotes(relay, fetch), List.of()));
        }
        Set<Vote> votes = new LinkedHashSet<>();
        for (CompletableFuture<List<Vote>> future : pending) {
            votes.addAll(future.join());
        }
        return votes.stream().map(Vote::value).toList();
    }

    /** Sends a signed kill directive. No reply is expected. */
    public void killAgent(int agentId, String address, int port) throws IOException {
        channel.send(address, port, Signatures.seal(keys, Messages.killAgent(agentId)));
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
    }

    private <T> CompletableFuture<T> submit(AgentDescriptor peer, Supplier<T> task, T fallback) {
        try {
            return CompletableFuture.supplyAsync(task, executor).exceptionally(error -> {
                LOG.warn("query task for agent {} failed - {}", peer.agentId(), error.getMessage());
                return fallback;
            });
        } catch (RejectedExecutionException e) {
            LOG.warn("query for agent {} not scheduled - {}", peer.agentId(), e.getMessage());
            return CompletableFuture.completedFuture(fallback);
        }
    }

    private Optional<Long> queryValue(AgentDescriptor peer, Envelope query) {
        try {
            Envelope reply = channel.request(peer.address(), peer.port(), query);
            Message message = MessageCodec.deserialize(reply.payload());
            if (!(message instanceof Message.SendValue)) {
                LOG.warn("expected SEND_VALUE from agent {}, received {}", peer.agentId(), message.type());
                return Optional.empty();
            }
            Signatures.verifyEnvelope(reply, peer.publicKey());
            Message.SendValue value = (Message.SendValue) message;
            if (value.agentId() != peer.agentId()) {
                LOG.warn("agent {} answered on behalf of agent {}", peer.agentId(), value.agentId());
                return Optional.empty();
            }
            return Optional.of(value.value());
        } catch (AuthException e) {
            LOG.warn("reply from agent {} failed authentication - {}", peer.agentId(), e.getMessage());
            return Optional.empty();
        } catch (IOException e) {
            LOG.warn("unable to query agent {} at {} - {}", peer.agentId(), peer.endpoint(), e.getMessage());
            return Optional.empty();
        }
    }

    private List<Vote> fetchVotes(AgentDescriptor relay, Envelope fetch) {
        try {
            Envelope reply = relayChannel.request(relay.address(), relay.port(), fetch);
            Message message = MessageCodec.deserialize(reply.payload());
            if (!(message instanceof Message.FwdValues)) {
                LOG.warn("expected FWD_VALUES from agent {}, received {}", relay.agentId(), message.type());
                return List.of();
            }
            Signatures.verifyEnvelope(reply, relay.publicKey());
            List<Vote> votes = new ArrayList<>();
            for (Envelope forwarded : ((Message.FwdValues) message).peerValues()) {
                authenticateVote(relay, forwarded).ifPresent(votes::add);
            }
            return votes;
        } catch (AuthException e) {
            LOG.warn("forwarded values from agent {} failed authentication - {}", relay.agentId(), e.getMessage());
            return List.of();
        } catch (IOException e) {
            LOG.warn("unable to fetch values through agent {} at {} - {}", relay.agentId(), relay.endpoint(), e.getMessage());
            return List.of();
        }
    }

    // Forwarded votes are checked against the reporter's registered key, never the relay's.
    private Optional<Vote> authenticateVote(AgentDescriptor relay, Envelope forwarded) {
        try {
            Message message = MessageCodec.deserialize(forwarded.payload());
            if (!(message instanceof Message.SendValue)) {
                LOG.debug("relay {} forwarded a {}, ignored", relay.agentId(), message.type());
                return Optional.empty();
            }
            Message.SendValue value = (Message.SendValue) message;
            Optional<String> reporterKey = registry.publicKeyOf(value.agentId());
            if (reporterKey.isEmpty()) {
                LOG.debug("relay {} forwarded a vote from unknown agent {}", relay.agentId(), value.agentId());
                return Optional.empty();
            }
            Signatures.verifyEnvelope(forwarded, reporterKey.get());
            return Optional.of(new Vote(value.agentId(), value.value()));
        } catch (IOException | AuthException e) {
            LOG.debug("relay {} forwarded an invalid vote - {}", relay.agentId(), e.getMessage());
            return Optional.empty();
        }
    }

    private static ExecutorService queryThreads() {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "client-query-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    record Vote(int agentId, long value) {
    }
}
