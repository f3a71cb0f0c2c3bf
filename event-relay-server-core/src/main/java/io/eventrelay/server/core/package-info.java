/**
 * Framework-neutral server side of the event relay.
 *
 * <p>{@link io.eventrelay.server.core.EventRelayServer} wires a bounded
 * {@link io.eventrelay.server.core.ConnectionRegistry}, the
 * {@link io.eventrelay.server.core.EventDispatcher} that fans messages out to it, the keepalive pinger and the
 * {@link io.eventrelay.server.core.StreamEndpoint}. HTTP servers plug in through
 * {@link io.eventrelay.server.core.StreamExchange}.
 */
package io.eventrelay.server.core;
