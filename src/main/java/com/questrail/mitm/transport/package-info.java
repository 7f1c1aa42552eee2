/**
 * Transport Ports
 * =============================================================================
 *
 * <p>Framework-agnostic boundary between a concrete stream transport (Netty TCP
 * in production, a fake in tests) and the relay, source and destination
 * roles.</p>
 *
 * <p>Everything above these ports sees only:</p>
 * <ul>
 *   <li>frames as {@code byte[]}, split on the newline terminator</li>
 *   <li>remote peers as {@link java.net.SocketAddress}</li>
 *   <li>a single close notification per connection, with an optional cause</li>
 * </ul>
 *
 * <h2>Constraints</h2>
 * Implementations perform I/O only. They do not decode messages, apply attack
 * policies, or schedule anything.
 */
package com.questrail.mitm.transport;
