package com.questrail.hal.bus;

/**
 * A participant on the {@link HalMessageBus}.
 * <p>
 * Modules never reference each other. Everything they know about the rest of
 * the application arrives as messages, and everything they contribute leaves as
 * responses or newly emitted messages.
 */
public interface HalModule
{
    /**
     * The module's identity on the bus. Addressed messages name it; responses
     * carry it as their source.
     */
    String moduleName();

    /**
     * Releases the module's resources. Called once, when the application stops.
     */
    void cleanUp();
}
