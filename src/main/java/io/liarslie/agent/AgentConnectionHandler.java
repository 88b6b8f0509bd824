package io.liarslie.agent;

import io.liarslie.codec.DecodeException;
import io.liarslie.codec.Envelope;
import io.liarslie.codec.EnvelopeCodec;
import io.liarslie.codec.Frames;
import io.liarslie.lifecycle.ShutdownSignal;
import io.liarslie.model.AgentDescriptor;
import io.liarslie.net.PeerChannel;
import io.liarslie.protocol.Message;
import io.liarslie.protocol.MessageCodec;
import io.liarslie.protocol.Messages;
import io.liarslie.security.AuthException;
import io.liarslie.security.Signatures;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.Socket;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Serves exactly one request on one accepted connection.
 *
 * <p>Dispatch:
 * <ul>
 *   <li>QueryValue: reply with a signed SendValue.</li>
 *   <li>KillAgent: authenticate against the client key and own id, then fire the shutdown signal.</li>
 *   <li>FetchValues: authenticate, poll the listed peers concurrently, tamper if a liar, reply with a signed FwdValues.
 *       Polling stops after one peer exchange budget; replies that arrived by then are forwarded.</li>
 *   <li>SendValue, FwdValues: never valid as requests; dropped.</li>
 * </ul>
 * Anything that fails to decode or authenticate is logged and gets no reply.
 */
public final class AgentConnectionHandler {
    private static final Logger LOG = LoggerFactory.getLogger(AgentConnectionHandler.class);

    private final AgentIdentity identity;
    private final ShutdownSignal shutdownSignal;
    private final PeerChannel peerChannel;
    private final Executor fetchExecutor;
    private final Tamperer tamperer;
    private final int readTimeoutMs;

    public AgentConnectionHandler(
            AgentIdentity identity,
            ShutdownSignal shutdownSignal,
            PeerChannel peerChannel,
            Executor fetchExecutor,
            Tamperer tamperer,
            int readTimeoutMs
    ) {
        this.identity = identity;
        this.shutdownSignal = shutdownSignal;
        this.peerChannel = peerChannel;
        this.fetchExecutor = fetchExecutor;
        this.tamperer = tamperer;
        this.readTimeoutMs = readTimeoutMs;
    }

    public void handle(Socket connection) {
        try (Socket socket = connection) {
            socket.setSoTimeout(readTimeoutMs);
            byte[] frame = Frames.deframe(socket.getInputStream(), peerChannel.maxFrameBytes());
            Optional<Envelope> reply = dispatch(EnvelopeCodec.decode(frame));
            if (reply.isPresent()) {
                Frames.write(socket.getOutputStream(), EnvelopeCodec.encode(reply.get()));
            }
        } catch (DecodeException e) {
            LOG.warn("agent {}: unable to decode request - {}", identity.agentId(), e.getMessage());
        } catch (AuthException e) {
            LOG.warn("agent {}: rejected request - {}", identity.agentId(), e.getMessage());
        } catch (IOException e) {
            LOG.warn("agent {}: connection failed - {}", identity.agentId(), e.getMessage());
        }
    }

    Optional<Envelope> dispatch(Envelope request) throws DecodeException, AuthException {
        Message message = MessageCodec.deserialize(request.payload());
        return switch (message.type()) {
            case QUERY_VALUE -> Optional.of(valueReply());
            case KILL_AGENT -> {
                Message.KillAgent kill = (Message.KillAgent) message;
                authenticateDirective(request, kill.agentId());
                LOG.info("agent {}: authenticated kill request, shutting down", identity.agentId());
                shutdownSignal.fire();
                yield Optional.empty();
            }
            case FETCH_VALUES -> {
                Message.FetchValues fetch = (Message.FetchValues) message;
                authenticateDirective(request, fetch.agentId());
                yield Optional.of(relay(fetch.peerAddresses()));
            }
            case SEND_VALUE, FWD_VALUES -> {
                LOG.warn("agent {}: protocol violation, unexpected {} request", identity.agentId(), message.type());
                yield Optional.empty();
            }
        };
    }

    private Envelope valueReply() {
        return Signatures.seal(identity.keys(), Messages.sendValue(identity.agentId(), identity.reportedValue()));
    }

    // Directives must be signed by the trusted client and addressed to this agent.
    private void authenticateDirective(Envelope request, int addressedTo) throws AuthException {
        Signatures.verifyEnvelope(request, identity.trustedClientPublicKey());
        if (addressedTo != identity.agentId()) {
            throw new AuthException("directive addressed to agent " + addressedTo + ", not " + identity.agentId());
        }
    }

    private Envelope relay(List<AgentDescriptor> peers) {
        List<Envelope> collected = collectPeerValues(peers);
        List<Envelope> forwarded = identity.liar() ? tamperer.apply(collected) : collected;
        LOG.debug("agent {}: relaying {} of {} peer replies", identity.agentId(), forwarded.size(), peers.size());
        return Signatures.seal(identity.keys(), Messages.fwdValues(identity.agentId(), forwarded));
    }

    // Replies are collected as received; checking them is left to the client.
    private List<Envelope> collectPeerValues(List<AgentDescriptor> peers) {
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(peerChannel.exchangeBudgetMs());
        Envelope query = Signatures.seal(identity.keys(), Messages.queryValue());
        List<CompletableFuture<Optional<Envelope>>> pending = new ArrayList<>(peers.size());
        for (AgentDescriptor peer : peers) {
            try {
                pending.add(CompletableFuture
                        .supplyAsync(() -> queryPeer(peer, query), fetchExecutor)
                        .exceptionally(error -> {
                            LOG.warn("agent {}: fetch task for agent {} failed - {}", identity.agentId(), peer.agentId(), error.getMessage());
                            return Optional.empty();
                        }));
            } catch (RejectedExecutionException e) {
                // The agent is shutting down; the peer contributes nothing.
                LOG.warn("agent {}: fetch for agent {} not scheduled - {}", identity.agentId(), peer.agentId(), e.getMessage());
            }
        }
        List<Envelope> replies = new ArrayList<>(pending.size());
        for (CompletableFuture<Optional<Envelope>> future : pending) {
            long remaining = Math.max(0L, deadline - System.nanoTime());
            try {
                future.get(remaining, TimeUnit.NANOSECONDS).ifPresent(replies::add);
            } catch (TimeoutException e) {
                LOG.warn("agent {}: peer fetch still pending at the relay deadline, skipped", identity.agentId());
            } catch (ExecutionException e) {
                LOG.warn("agent {}: peer fetch failed - {}", identity.agentId(), e.getMessage());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                LOG.warn("agent {}: interrupted while collecting peer values", identity.agentId());
                break;
            }
        }
        return replies;
    }

    private Optional<Envelope> queryPeer(AgentDescriptor peer, Envelope query) {
        try {
            return Optional.of(peerChannel.request(peer.address(), peer.port(), query));
        } catch (IOException e) {
            LOG.warn("agent {}: unable to fetch value from agent {} at {} - {}",
                    identity.agentId(), peer.agentId(), peer.endpoint(), e.getMessage());
            return Optional.empty();
        }
    }
}
