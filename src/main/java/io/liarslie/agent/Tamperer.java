package io.liarslie.agent;

import io.liarslie.codec.DecodeException;
import io.liarslie.codec.Envelope;
import io.liarslie.protocol.Message;
import io.liarslie.protocol.MessageCodec;
import io.liarslie.protocol.Messages;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * A liar's corruption of the answers it relays. Each forwarded envelope is replaced with
 * probability {@code probability} by a forged one. Forged envelopes keep the genuine
 * signature, which no longer matches, so an honest client drops them.
 *
 * <p>Tampering is best effort: if any forgery fails, the untouched replies are forwarded.
 */
public final class Tamperer {
    private static final Logger LOG = LoggerFactory.getLogger(Tamperer.class);

    private final double probability;
    private final DoubleSupplier trials;
    private final Forger forger;

    public Tamperer(double probability, DoubleSupplier trials, Forger forger) {
        if (probability < 0.0d || probability > 1.0d) {
            throw new IllegalArgumentException("tamper probability must be within [0.0, 1.0]: " + probability);
        }
        this.probability = probability;
        this.trials = trials;
        this.forger = forger;
    }

    public static Tamperer forAgent(AgentIdentity identity) {
        return new Tamperer(
                identity.tamperProbability(),
                () -> ThreadLocalRandom.current().nextDouble(),
                replaceValueWith(identity.reportedValue())
        );
    }

    public List<Envelope> apply(List<Envelope> replies) {
        if (replies.isEmpty() || probability == 0.0d) {
            return replies;
        }
        List<Envelope> tampered = new ArrayList<>(replies.size());
        int forged = 0;
        try {
            for (Envelope reply : replies) {
                if (trials.getAsDouble() < probability) {
                    tampered.add(forger.forge(reply));
                    forged++;
                } else {
                    tampered.add(reply);
                }
            }
        } catch (DecodeException | RuntimeException e) {
            LOG.debug("tampering abandoned, forwarding {} original replies: {}", replies.size(), e.getMessage());
            return replies;
        }
        LOG.debug("tampered with {} of {} relayed replies", forged, replies.size());
        return List.copyOf(tampered);
    }

    // Rewrites a SendValue so it claims {@code value} for the same reporting agent.
    public static Forger replaceValueWith(long value) {
        return genuine -> {
            Message message = MessageCodec.deserialize(genuine.payload());
            if (!(message instanceof Message.SendValue)) {
                throw new DecodeException("cannot forge a " + message.type() + " as a value reply");
            }
            Message.SendValue original = (Message.SendValue) message;
            return new Envelope(Messages.sendValue(original.agentId(), value), genuine.signature());
        };
    }

    @FunctionalInterface
    public interface Forger {
        Envelope forge(Envelope genuine) throws DecodeException;
    }
}
