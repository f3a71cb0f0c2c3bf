/**
 * Protocol-centric core for the event relay.
 *
 * <p>This module is deliberately framework-neutral. It contains only:
 * <ul>
 *   <li>Wire constants and the message model</li>
 *   <li>The SSE frame renderer and the incremental event framer</li>
 *   <li>The failure taxonomy shared by server and client</li>
 * </ul>
 *
 * <p>HTTP client/server bindings live in other modules.
 */
package io.eventrelay.core;
