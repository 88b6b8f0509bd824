package io.liarslie.protocol;

import io.liarslie.codec.Envelope;
import io.liarslie.model.AgentDescriptor;

import java.util.List;

/**
 * Builders returning serialized messages, ready to be signed and put in an envelope.
 */
public final class Messages {
    private Messages() {
    }

    public static byte[] queryValue() {
        return MessageCodec.serialize(new Message.QueryValue());
    }

    public static byte[] sendValue(int agentId, long value) {
        return MessageCodec.serialize(new Message.SendValue(agentId, value));
    }

    public static byte[] killAgent(int agentId) {
        return MessageCodec.serialize(new Message.KillAgent(agentId));
    }

    public static byte[] fetchValues(int agentId, List<AgentDescriptor> peerAddresses) {
        return MessageCodec.serialize(new Message.FetchValues(agentId, peerAddresses));
    }

    public static byte[] fwdValues(int agentId, List<Envelope> peerValues) {
        return MessageCodec.serialize(new Message.FwdValues(agentId, peerValues));
    }
}
