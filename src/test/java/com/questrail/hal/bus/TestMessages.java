package com.questrail.hal.bus;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.BiFunction;

/**
 * Message types and a scriptable module shared by the bus tests.
 */
final class TestMessages {

    static final String PING = "ping";

    record Ping(String text) implements MessagePayload {}

    record Other() implements MessagePayload {}

    record Pong(String from) implements ResponsePayload {}

    record Undeclared() implements ResponsePayload {}

    private TestMessages() {}

    static void registerPing(MessageRegistry registry) {
        registry.register(MessageDefinition.of(PING, Ping.class, Pong.class), false);
    }

    static HalMessage ping(String text) {
        return new HalMessage("test", PING, new Ping(text));
    }

    /**
     * Module whose handling of each message is supplied by the test.
     */
    static final class ScriptedModule extends AbstractHalModule {
        final List<String> seen = new CopyOnWriteArrayList<>();
        final List<String> cleanUps = new CopyOnWriteArrayList<>();
        private final BiFunction<ScriptedModule, HalMessage, Dispatch> handler;

        ScriptedModule(String name, BiFunction<ScriptedModule, HalMessage, Dispatch> handler) {
            super(name);
            this.handler = handler;
        }

        /** Appends a pong from this module and handles the message synchronously. */
        static ScriptedModule answering(String name) {
            return new ScriptedModule(name, (m, msg) -> {
                msg.addResponse(new HalMessageResponse(m.moduleName(), new Pong(m.moduleName())));
                return Dispatch.SYNCHRONOUS;
            });
        }

        @Override
        protected void onAttach(MessageRegistry registry) {
            registerPing(registry);
        }

        @Override
        protected Dispatch processMessage(HalMessage message) {
            seen.add(message.data(Ping.class).text());
            return handler.apply(this, message);
        }

        @Override
        protected void onCleanUp() {
            cleanUps.add(Thread.currentThread().getName());
        }

        void task(HalMessage message, Runnable work) {
            runWorkerTask(message, work);
        }

        void task(HalMessage message, Runnable work, Runnable then) {
            runWorkerTask(message, work, then);
        }

        void respond(HalMessage message) {
            message.addResponse(new HalMessageResponse(moduleName(), new Pong(moduleName())));
        }
    }
}
