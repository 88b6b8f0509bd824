package io.liarslie.protocol;

import io.liarslie.codec.DecodeException;
import io.liarslie.codec.Envelope;
import io.liarslie.codec.EnvelopeCodec;
import io.liarslie.codec.MsgPack;
import io.liarslie.model.AgentDescriptor;
import org.msgpack.core.MessageBufferPacker;
import org.msgpack.core.MessagePack;
import org.msgpack.core.MessagePacker;
import org.msgpack.core.MessageUnpacker;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Fixed tagged encoding for {@link Message}: a msgpack array whose first element is the
 * {@link MessageType#tag()} and whose remaining elements are the variant's fields in
 * declaration order.
 *
 * <pre>
 * QueryValue   [0]
 * SendValue    [1, agentId, value]
 * KillAgent    [2, agentId]
 * FetchValues  [3, agentId, [[agentId, address, port, publicKey], ...]]
 * FwdValues    [4, agentId, [[payload, signature|nil], ...]]
 * </pre>
 */
public final class MessageCodec {
    private static final int DESCRIPTOR_FIELDS = 4;

    private MessageCodec() {
    }

    public static byte[] serialize(Message message) {
        if (message == null) {
            throw new IllegalArgumentException("message cannot be null");
        }
        try (MessageBufferPacker packer = MessagePack.newDefaultBufferPacker()) {
            switch (message.type()) {
                case QUERY_VALUE -> packer.packArrayHeader(1).packInt(MessageType.QUERY_VALUE.tag());
                case SEND_VALUE -> {
                    Message.SendValue send = (Message.SendValue) message;
                    packer.packArrayHeader(3)
                            .packInt(MessageType.SEND_VALUE.tag())
                            .packInt(send.agentId())
                            .packLong(send.value());
                }
                case KILL_AGENT -> {
                    Message.KillAgent kill = (Message.KillAgent) message;
                    packer.packArrayHeader(2)
                            .packInt(MessageType.KILL_AGENT.tag())
                            .packInt(kill.agentId());
                }
                case FETCH_VALUES -> {
                    Message.FetchValues fetch = (Message.FetchValues) message;
                    packer.packArrayHeader(3)
                            .packInt(MessageType.FETCH_VALUES.tag())
                            .packInt(fetch.agentId())
                            .packArrayHeader(fetch.peerAddresses().size());
                    for (AgentDescriptor peer : fetch.peerAddresses()) {
                        packDescriptor(packer, peer);
                    }
                }
                case FWD_VALUES -> {
                    Message.FwdValues fwd = (Message.FwdValues) message;
                    packer.packArrayHeader(3)
                            .packInt(MessageType.FWD_VALUES.tag())
                            .packInt(fwd.agentId())
                            .packArrayHeader(fwd.peerValues().size());
                    for (Envelope envelope : fwd.peerValues()) {
                        EnvelopeCodec.pack(packer, envelope);
                    }
                }
                default -> throw new IllegalArgumentException("unsupported message type: " + message.type());
            }
            return packer.toByteArray();
        } catch (IOException e) {
            throw new UncheckedIOException("failed to serialize " + message.type(), e);
        }
    }

    public static Message deserialize(byte[] bytes) throws DecodeException {
        if (bytes == null || bytes.length == 0) {
            throw new DecodeException("message: empty input");
        }
        try (MessageUnpacker unpacker = MsgPack.reader(bytes)) {
            int fields = MsgPack.readArrayHeader(unpacker, "message");
            if (fields < 1) {
                throw new DecodeException("message: missing tag");
            }
            int tag = MsgPack.readInt(unpacker, "message.tag");
            MessageType type = MessageType.fromTag(tag)
                    .orElseThrow(() -> new DecodeException("message: unknown tag " + tag));
            Message message = switch (type) {
                case QUERY_VALUE -> {
                    requireFields(type, fields, 1);
                    yield new Message.QueryValue();
                }
                case SEND_VALUE -> {
                    requireFields(type, fields, 3);
                    int agentId = MsgPack.readInt(unpacker, "send_value.agent_id");
                    long value = MsgPack.readLong(unpacker, "send_value.value");
                    yield new Message.SendValue(agentId, value);
                }
                case KILL_AGENT -> {
                    requireFields(type, fields, 2);
                    yield new Message.KillAgent(MsgPack.readInt(unpacker, "kill_agent.agent_id"));
                }
                case FETCH_VALUES -> {
                    requireFields(type, fields, 3);
                    int agentId = MsgPack.readInt(unpacker, "fetch_values.agent_id");
                    int count = MsgPack.readArrayHeader(unpacker, "fetch_values.peers");
                    List<AgentDescriptor> peers = new ArrayList<>(Math.min(count, bytes.length));
                    for (int i = 0; i < count; i++) {
                        peers.add(unpackDescriptor(unpacker));
                    }
                    yield new Message.FetchValues(agentId, peers);
                }
                case FWD_VALUES -> {
                    requireFields(type, fields, 3);
                    int agentId = MsgPack.readInt(unpacker, "fwd_values.agent_id");
                    int count = MsgPack.readArrayHeader(unpacker, "fwd_values.peer_values");
                    List<Envelope> values = new ArrayList<>(Math.min(count, bytes.length));
                    for (int i = 0; i < count; i++) {
                        values.add(EnvelopeCodec.unpack(unpacker, bytes.length));
                    }
                    yield new Message.FwdValues(agentId, values);
                }
            };
            MsgPack.requireFullyConsumed(unpacker, "message");
            return message;
        } catch (DecodeException e) {
            throw e;
        } catch (IOException e) {
            throw new DecodeException("message: unreadable input", e);
        }
    }

    private static void requireFields(MessageType type, int actual, int expected) throws DecodeException {
        if (actual != expected) {
            throw new DecodeException(type + ": expected " + expected + " fields, found " + actual);
        }
    }

    private static void packDescriptor(MessagePacker packer, AgentDescriptor peer) throws IOException {
        packer.packArrayHeader(DESCRIPTOR_FIELDS)
                .packInt(peer.agentId())
                .packString(peer.address())
                .packInt(peer.port())
                .packString(peer.publicKey());
    }

    private static AgentDescriptor unpackDescriptor(MessageUnpacker unpacker) throws DecodeException {
        MsgPack.expectArray(unpacker, DESCRIPTOR_FIELDS, "descriptor");
        int agentId = MsgPack.readInt(unpacker, "descriptor.agent_id");
        String address = MsgPack.readString(unpacker, "descriptor.address");
        int port = MsgPack.readInt(unpacker, "descriptor.port");
        String publicKey = MsgPack.readString(unpacker, "descriptor.public_key");
        try {
            return new AgentDescriptor(agentId, address, port, publicKey);
        } catch (IllegalArgumentException e) {
            throw new DecodeException("descriptor: " + e.getMessage(), e);
        }
    }
}
