package io.liarslie.protocol;

import java.util.Optional;

public enum MessageType {
    QUERY_VALUE(0),
    SEND_VALUE(1),
    KILL_AGENT(2),
    FETCH_VALUES(3),
    FWD_VALUES(4);

    private final int tag;

    MessageType(int tag) {
        this.tag = tag;
    }

    public int tag() {
        return tag;
    }

    public static Optional<MessageType> fromTag(int tag) {
        for (MessageType value : values()) {
            if (value.tag == tag) {
                return Optional.of(value);
            }
        }
        return Optional.empty();
    }
}
