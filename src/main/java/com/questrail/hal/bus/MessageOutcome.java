package com.questrail.hal.bus;

import java.util.List;
import java.util.Objects;

/**
 * Final result of sending a {@link HalMessage}, available once every module has
 * handled it and every scoped task it started has finished.
 *
 * @param message  the message, with all responses appended
 * @param failures modules that failed while handling it, in failure order
 */
public record MessageOutcome(HalMessage message, List<ModuleFailure> failures)
{
    public MessageOutcome {
        Objects.requireNonNull(message, "message");
        failures = List.copyOf(failures);
    }

    public boolean isSuccess() {
        return failures.isEmpty();
    }

    public List<HalMessageResponse> responses() {
        return message.responses();
    }

    /**
     * One module's failure to handle the message.
     */
    public record ModuleFailure(String module, Throwable cause) {
        public ModuleFailure {
            Objects.requireNonNull(module, "module");
            Objects.requireNonNull(cause, "cause");
        }
    }
}
