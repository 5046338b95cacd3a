package com.questrail.hal.bus;

import java.util.Objects;

/**
 * One response appended to a {@link HalMessage} by a module handling it.
 *
 * @param source name of the module that produced the response
 * @param data   typed response payload
 */
public record HalMessageResponse(String source, ResponsePayload data)
{
    public HalMessageResponse {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(data, "data");
    }
}
