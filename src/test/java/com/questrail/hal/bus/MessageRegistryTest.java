package com.questrail.hal.bus;

import com.questrail.hal.bus.TestMessages.Other;
import com.questrail.hal.bus.TestMessages.Ping;
import com.questrail.hal.bus.TestMessages.Pong;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * MessageRegistryTest
 * -----------------------------------------------------------------------------
 * Registration rules and validation of outgoing messages.
 */
class MessageRegistryTest {

    @Test
    void registerRejectsExistingTypeByDefault() {
        MessageRegistry registry = new MessageRegistry();
        registry.register(MessageDefinition.of("ping", Ping.class, Pong.class));

        assertThrows(IllegalStateException.class,
                () -> registry.register(MessageDefinition.of("ping", Ping.class, Pong.class)));
    }

    @Test
    void identicalReRegistrationToleratedWithoutExistsCheck() {
        MessageRegistry registry = new MessageRegistry();
        registry.register(MessageDefinition.of("ping", Ping.class, Pong.class), false);
        registry.register(MessageDefinition.of("ping", Ping.class, Pong.class), false);

        assertTrue(registry.isRegistered("ping"));
        assertEquals(1, registry.registeredTypes().size());
    }

    @Test
    void conflictingReRegistrationAlwaysRejected() {
        MessageRegistry registry = new MessageRegistry();
        registry.register(MessageDefinition.of("ping", Ping.class, Pong.class), false);

        assertThrows(IllegalStateException.class,
                () -> registry.register(MessageDefinition.of("ping", Other.class), false));
    }

    @Test
    void validateRejectsUnknownTypeAndWrongPayload() {
        MessageRegistry registry = new MessageRegistry();
        registry.register(MessageDefinition.of("ping", Ping.class, Pong.class));

        assertThrows(ProtocolViolationException.class,
                () -> registry.validate(new HalMessage("test", "pong", new Ping("x"))));
        assertThrows(ProtocolViolationException.class,
                () -> registry.validate(new HalMessage("test", "ping", new Other())));

        MessageDefinition def = registry.validate(new HalMessage("test", "ping", new Ping("x")));
        assertEquals(Ping.class, def.payloadType());
    }

    @Test
    void findReturnsEmptyForUnknownType() {
        assertTrue(new MessageRegistry().find("nothing").isEmpty());
    }
}
