package com.questrail.hal.bus;

/**
 * How a module chose to handle one message.
 */
public enum Dispatch
{
    /** Handled completely on the dispatch thread. */
    SYNCHRONOUS,

    /** Handed to the module's scoped task runner; the message stays open until the task finishes. */
    SCOPED_TASK,

    /** Not for this module (wrong type or addressed to another module). */
    IGNORED
}
