package io.liarslie.protocol;

import io.liarslie.codec.DecodeException;
import io.liarslie.codec.Envelope;
import io.liarslie.model.AgentDescriptor;
import org.junit.jupiter.api.Test;
import org.msgpack.core.MessageBufferPacker;
import org.msgpack.core.MessagePack;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;

class MessageCodecTest {
    private static final String KEY = "MCowBQYDK2VwAyEAGb9ECWmEzf6FQbrBZ9w7lshQhqowtrbLDFw4rXAxZuE=";

    @Test
    void everyVariantShouldDeserializeToAnEqualMessage() throws Exception {
        List<AgentDescriptor> peers = List.of(
                new AgentDescriptor(1, "127.0.0.1", 5000, KEY),
                new AgentDescriptor(2, "localhost", 5001, KEY)
        );
        List<Envelope> forwarded = List.of(
                new Envelope(Messages.sendValue(1, 42L), new byte[64]),
                Envelope.unsigned(Messages.sendValue(2, 7L))
        );
        List<Message> messages = List.of(
                new Message.QueryValue(),
                new Message.SendValue(3, Long.MAX_VALUE),
                new Message.KillAgent(9),
                new Message.FetchValues(4, peers),
                new Message.FetchValues(4, List.of()),
                new Message.FwdValues(5, forwarded)
        );
        for (Message message : messages) {
            assertEquals(message, MessageCodec.deserialize(MessageCodec.serialize(message)), message.type().name());
        }
    }

    @Test
    void buildersShouldProduceTheMatchingVariant() throws Exception {
        assertInstanceOf(Message.QueryValue.class, MessageCodec.deserialize(Messages.queryValue()));
        assertEquals(new Message.SendValue(1, 5L), MessageCodec.deserialize(Messages.sendValue(1, 5L)));
        assertEquals(new Message.KillAgent(2), MessageCodec.deserialize(Messages.killAgent(2)));
        assertEquals(MessageType.FETCH_VALUES, MessageCodec.deserialize(Messages.fetchValues(3, List.of())).type());
        assertEquals(MessageType.FWD_VALUES, MessageCodec.deserialize(Messages.fwdValues(3, List.of())).type());
    }

    @Test
    void unknownTagShouldBeRejected() throws Exception {
        try (MessageBufferPacker packer = MessagePack.newDefaultBufferPacker()) {
            packer.packArrayHeader(1).packInt(99);
            byte[] bytes = packer.toByteArray();
            DecodeException error = assertThrows(DecodeException.class, () -> MessageCodec.deserialize(bytes));
            assertEquals("message: unknown tag 99", error.getMessage());
        }
    }

    @Test
    void wrongArityShouldBeRejected() throws Exception {
        try (MessageBufferPacker packer = MessagePack.newDefaultBufferPacker()) {
            packer.packArrayHeader(2).packInt(MessageType.SEND_VALUE.tag()).packInt(1);
            byte[] bytes = packer.toByteArray();
            assertThrows(DecodeException.class, () -> MessageCodec.deserialize(bytes));
        }
    }

    @Test
    void wrongFieldTypeShouldBeRejected() throws Exception {
        try (MessageBufferPacker packer = MessagePack.newDefaultBufferPacker()) {
            packer.packArrayHeader(2).packInt(MessageType.KILL_AGENT.tag()).packString("seven");
            byte[] bytes = packer.toByteArray();
            assertThrows(DecodeException.class, () -> MessageCodec.deserialize(bytes));
        }
    }

    @Test
    void invalidDescriptorShouldBeRejected() throws Exception {
        try (MessageBufferPacker packer = MessagePack.newDefaultBufferPacker()) {
            packer.packArrayHeader(3)
                    .packInt(MessageType.FETCH_VALUES.tag())
                    .packInt(1)
                    .packArrayHeader(1)
                    .packArrayHeader(4).packInt(1).packString("127.0.0.1").packInt(70000).packString(KEY);
            byte[] bytes = packer.toByteArray();
            assertThrows(DecodeException.class, () -> MessageCodec.deserialize(bytes));
        }
    }

    @Test
    void truncatedOrPaddedInputShouldBeRejected() {
        byte[] encoded = Messages.fetchValues(1, List.of(new AgentDescriptor(2, "127.0.0.1", 5001, KEY)));
        for (int cut = 0; cut < encoded.length; cut++) {
            byte[] truncated = Arrays.copyOf(encoded, cut);
            assertThrows(DecodeException.class, () -> MessageCodec.deserialize(truncated), "cut at " + cut);
        }
        byte[] padded = Arrays.copyOf(encoded, encoded.length + 1);
        assertThrows(DecodeException.class, () -> MessageCodec.deserialize(padded));
    }
}
