package com.questrail.hal.bus;

import java.util.Objects;
import java.util.Set;

/**
 * Registered shape of one message type.
 *
 * @param type          message type name (the tag carried by {@link HalMessage#type()})
 * @param payloadType   the one payload class messages of this type must carry
 * @param responseTypes response payload classes handlers may append
 */
public record MessageDefinition(
        String type,
        Class<? extends MessagePayload> payloadType,
        Set<Class<? extends ResponsePayload>> responseTypes
) {
    public MessageDefinition {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(payloadType, "payloadType");
        responseTypes = Set.copyOf(Objects.requireNonNull(responseTypes, "responseTypes"));
        if (type.isBlank()) {
            throw new IllegalArgumentException("type must not be blank");
        }
    }

    @SafeVarargs
    public static MessageDefinition of(String type,
                                       Class<? extends MessagePayload> payloadType,
                                       Class<? extends ResponsePayload>... responseTypes) {
        return new MessageDefinition(type, payloadType, Set.of(responseTypes));
    }

    public boolean accepts(MessagePayload payload) {
        return payloadType.isInstance(payload);
    }

    public boolean allowsResponse(ResponsePayload payload) {
        for (Class<? extends ResponsePayload> allowed : responseTypes) {
            if (allowed.isInstance(payload)) {
                return true;
            }
        }
        return false;
    }
}
