package com.bko.team.bus;

import java.util.function.Function;

/**
 * Fields of a {@link TeamMessage} a {@link MessageFilter} can match on.
 */
public enum MessageField {
    ID(TeamMessage::id),
    CONTENT(TeamMessage::content),
    SENDER_ID(TeamMessage::senderId),
    SENDER_ROLE(TeamMessage::senderRole),
    RECIPIENT_ID(TeamMessage::recipientId),
    RECIPIENT_ROLE(TeamMessage::recipientRole),
    MESSAGE_TYPE(TeamMessage::messageType);

    private final Function<TeamMessage, Object> accessor;

    MessageField(Function<TeamMessage, Object> accessor) {
        this.accessor = accessor;
    }

    public Object valueOf(TeamMessage message) {
        return accessor.apply(message);
    }
}
