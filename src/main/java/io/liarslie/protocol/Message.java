package io.liarslie.protocol;

import io.liarslie.codec.Envelope;
import io.liarslie.model.AgentDescriptor;

import java.util.List;

/**
 * The protocol vocabulary exchanged between the client and agents.
 *
 * <ul>
 *   <li>{@link QueryValue} asks the receiver for its value.</li>
 *   <li>{@link SendValue} answers a query; signed by {@code agentId}.</li>
 *   <li>{@link KillAgent} stops agent {@code agentId}; signed by the client.</li>
 *   <li>{@link FetchValues} asks agent {@code agentId} to poll peers for the client; signed by the client.</li>
 *   <li>{@link FwdValues} relays the peers' untouched signed answers; signed by the relay.</li>
 * </ul>
 */
public interface Message {
    MessageType type();

    record QueryValue() implements Message {
        @Override
        public MessageType type() {
            return MessageType.QUERY_VALUE;
        }
    }

    record SendValue(int agentId, long value) implements Message {
        @Override
        public MessageType type() {
            return MessageType.SEND_VALUE;
        }
    }

    record KillAgent(int agentId) implements Message {
        @Override
        public MessageType type() {
            return MessageType.KILL_AGENT;
        }
    }

    record FetchValues(int agentId, List<AgentDescriptor> peerAddresses) implements Message {
        public FetchValues {
            peerAddresses = peerAddresses == null ? List.of() : List.copyOf(peerAddresses);
        }

        @Override
        public MessageType type() {
            return MessageType.FETCH_VALUES;
        }
    }

    record FwdValues(int agentId, List<Envelope> peerValues) implements Message {
        public FwdValues {
            peerValues = peerValues == null ? List.of() : List.copyOf(peerValues);
        }

        @Override
        public MessageType type() {
            return MessageType.FWD_VALUES;
        }
    }
}
