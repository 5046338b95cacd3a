package com.questrail.hal.bus;

/**
 * Marker for the typed {@code data} carried by a {@link HalMessage}.
 * <p>
 * Payloads must be immutable. Each registered message type fixes exactly one
 * payload class (see {@link MessageDefinition}).
 */
public interface MessagePayload
{
}
