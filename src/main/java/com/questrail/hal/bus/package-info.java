/**
 * HAL Message Bus
 * =============================================================================
 *
 * <p>In-process plumbing that lets modules cooperate without holding references
 * to each other. A module sends a typed {@link com.questrail.hal.bus.HalMessage};
 * every attached module sees it, in the same order, on a single dispatch
 * thread; handlers append typed responses; the sender reads them from the
 * message's outcome.</p>
 *
 * <h2>Flow</h2>
 * <pre>
 *   HalMessageBus.send(message)
 *        → MessageRegistry.validate      (unknown type / wrong payload rejected here)
 *            → dispatch thread: each AbstractHalModule in registration order
 *                → processMessage        (SYNCHRONOUS / SCOPED_TASK / IGNORED)
 *                    → ScopedTaskRunner  (blocking work on the module's worker)
 *        ← outcome completes after the last module and the last task
 * </pre>
 *
 * <h2>Boundaries</h2>
 * <ul>
 *   <li>Nothing here knows about cameras. Message types are open and are
 *       registered by the modules that understand them.</li>
 *   <li>Netty's {@code netty-common} executors provide the threads and futures;
 *       no network transport is involved.</li>
 * </ul>
 */
package com.questrail.hal.bus;
