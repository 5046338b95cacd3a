package com.questrail.hal.bus;

import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * MessageRegistry
 * -----------------------------------------------------------------------------
 * Open, type-checked catalogue of the message types the bus will carry.
 *
 * <h2>Open set</h2>
 * Camera messages form a closed set known to the camera controller, but any
 * module may introduce its own message types. The registry is the single place
 * those types meet; the bus refuses anything not registered here.
 *
 * <h2>Re-registration</h2>
 * Several modules may legitimately register the same type (every camera
 * registers "get camera functionality"). Such callers pass
 * {@code checkExists = false}: an identical definition is then accepted, while a
 * conflicting one is still rejected.
 */
public final class MessageRegistry
{
    private final ConcurrentMap<String, MessageDefinition> definitions = new ConcurrentHashMap<>();

    /**
     * Registers a new message type.
     *
     * @throws IllegalStateException if the type is already registered
     */
    public void register(MessageDefinition definition) {
        register(definition, true);
    }

    public void register(MessageDefinition definition, boolean checkExists) {
        Objects.requireNonNull(definition, "definition");

        MessageDefinition existing = definitions.putIfAbsent(definition.type(), definition);
        if (existing == null) {
            return;
        }
        if (checkExists) {
            throw new IllegalStateException("Message type '" + definition.type() + "' is already registered");
        }
        if (!existing.equals(definition)) {
            throw new IllegalStateException("Conflicting definition for message type '"
                    + definition.type() + "': " + existing + " vs " + definition);
        }
    }

    public Optional<MessageDefinition> find(String type) {
        return Optional.ofNullable(definitions.get(type));
    }

    public boolean isRegistered(String type) {
        return definitions.containsKey(type);
    }

    public Set<String> registeredTypes() {
        return Set.copyOf(definitions.keySet());
    }

    /**
     * Checks a message against its registered definition.
     *
     * @return the definition the message conforms to
     * @throws ProtocolViolationException for an unknown type or a payload of the
     *                                    wrong class
     */
    public MessageDefinition validate(HalMessage message) {
        Objects.requireNonNull(message, "message");

        MessageDefinition definition = definitions.get(message.type());
        if (definition == null) {
            throw new ProtocolViolationException("Unknown message type '" + message.type() + "'");
        }
        if (!definition.accepts(message.data())) {
            throw new ProtocolViolationException("Message '" + message.type() + "' carries "
                    + message.data().getClass().getSimpleName() + ", expected "
                    + definition.payloadType().getSimpleName());
        }
        return definition;
    }
}
