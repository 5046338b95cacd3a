package com.questrail.hal.bus;

/**
 * Marker for the typed {@code data} of a {@link HalMessageResponse}.
 */
public interface ResponsePayload
{
}
