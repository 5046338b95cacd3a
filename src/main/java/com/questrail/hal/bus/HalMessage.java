package com.questrail.hal.bus;

import io.netty.util.concurrent.Future;
import io.netty.util.concurrent.Promise;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * HalMessage
 * -----------------------------------------------------------------------------
 * A typed message travelling over the {@link HalMessageBus}.
 *
 * <h2>Contents</h2>
 * <ul>
 *   <li>{@code type}: the registered message type name</li>
 *   <li>{@code source}: name of the module that sent it</li>
 *   <li>{@code data}: the payload, whose class is fixed by the type's
 *       {@link MessageDefinition}</li>
 *   <li>an append-only, ordered list of {@link HalMessageResponse}s</li>
 * </ul>
 *
 * <h2>Lifecycle</h2>
 * A message is sent exactly once. While modules handle it they may append
 * responses; they can never remove or reorder them. The message stays open
 * while any module still holds it (its scoped task has not finished). When the
 * last hold is released {@link #outcome()} completes and the sender reads the
 * responses.
 *
 * <h2>Threading</h2>
 * Responses may be appended from the dispatch thread and from module worker
 * threads. A single module never appends concurrently with itself, so the
 * responses of one module appear in the order that module appended them.
 */
public final class HalMessage
{
    private final String source;
    private final String type;
    private final MessagePayload data;

    private final List<HalMessageResponse> responses = new CopyOnWriteArrayList<>();
    private final List<MessageOutcome.ModuleFailure> failures = new CopyOnWriteArrayList<>();

    private final AtomicBoolean sent = new AtomicBoolean(false);
    private final AtomicInteger holds = new AtomicInteger(0);

    private volatile MessageDefinition definition;
    private volatile Promise<MessageOutcome> outcome;

    public HalMessage(String source, String type, MessagePayload data) {
        this.source = Objects.requireNonNull(source, "source");
        this.type = Objects.requireNonNull(type, "type");
        this.data = Objects.requireNonNull(data, "data");
    }

    public String source() {
        return source;
    }

    public String type() {
        return type;
    }

    public boolean isType(String candidate) {
        return type.equals(candidate);
    }

    public MessagePayload data() {
        return data;
    }

    /**
     * Returns the payload as the expected class.
     *
     * @throws ProtocolViolationException if the payload has a different class
     */
    public <T extends MessagePayload> T data(Class<T> payloadType) {
        if (!payloadType.isInstance(data)) {
            throw new ProtocolViolationException("Message '" + type + "' carries "
                    + data.getClass().getSimpleName() + ", not " + payloadType.getSimpleName());
        }
        return payloadType.cast(data);
    }

    /**
     * Appends a response. Only legal while the message is being handled.
     *
     * @throws ProtocolViolationException if the message type does not declare
     *                                    the response's payload class
     */
    public void addResponse(HalMessageResponse response) {
        Objects.requireNonNull(response, "response");

        MessageDefinition def = definition;
        if (def == null) {
            throw new IllegalStateException("Message '" + type + "' has not been sent");
        }
        if (outcome.isDone()) {
            throw new IllegalStateException("Message '" + type + "' has already completed");
        }
        if (!def.allowsResponse(response.data())) {
            throw new ProtocolViolationException("Message '" + type + "' does not declare response "
                    + response.data().getClass().getSimpleName());
        }
        responses.add(response);
    }

    /**
     * Snapshot of the responses appended so far, in append order.
     */
    public List<HalMessageResponse> responses() {
        return List.copyOf(responses);
    }

    /**
     * Response payloads of one class, in append order.
     */
    public <T extends ResponsePayload> List<T> responses(Class<T> payloadType) {
        return responses.stream()
                .map(HalMessageResponse::data)
                .filter(payloadType::isInstance)
                .map(payloadType::cast)
                .toList();
    }

    public boolean isSent() {
        return sent.get();
    }

    /**
     * Completes once every module has handled this message and every scoped
     * task started for it has finished.
     *
     * @throws IllegalStateException if the message has not been sent
     */
    public Future<MessageOutcome> outcome() {
        Promise<MessageOutcome> p = outcome;
        if (p == null) {
            throw new IllegalStateException("Message '" + type + "' has not been sent");
        }
        return p;
    }

    // ---------------------------------------------------------------------
    // Bus-side bookkeeping
    // ---------------------------------------------------------------------

    /**
     * Binds the message to its definition and outcome. The bus holds the
     * message until fan-out is complete.
     */
    void bind(MessageDefinition definition, Promise<MessageOutcome> outcome) {
        if (!sent.compareAndSet(false, true)) {
            throw new IllegalStateException("Message '" + type + "' has already been sent");
        }
        holds.set(1);
        this.outcome = Objects.requireNonNull(outcome, "outcome");
        this.definition = Objects.requireNonNull(definition, "definition");
    }

    void hold() {
        holds.incrementAndGet();
    }

    void release() {
        int remaining = holds.decrementAndGet();
        if (remaining == 0) {
            outcome.trySuccess(new MessageOutcome(this, List.copyOf(failures)));
        } else if (remaining < 0) {
            throw new IllegalStateException("Message '" + type + "' released more often than held");
        }
    }

    void recordFailure(String module, Throwable cause) {
        failures.add(new MessageOutcome.ModuleFailure(module, cause));
    }

    @Override
    public String toString() {
        return "HalMessage{" + type + " from " + source + ", " + data + "}";
    }
}
