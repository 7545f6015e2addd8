/**
 * Transport Ports
 * =============================================================================
 *
 * Framework-agnostic boundary between a concrete TCP implementation (blocking
 * sockets, Netty, or a test double) and the participant state machine.
 *
 * <p>Everything above the transport adapter sees only:</p>
 * <ul>
 *   <li>Whole message bodies as {@code byte[]}, with the length prefix already
 *       stripped on the way in and added on the way out</li>
 *   <li>Connection lifecycle notifications (up/down)</li>
 * </ul>
 *
 * <h2>Architectural constraints (binding)</h2>
 * Implementations of these ports MUST:
 * <ul>
 *   <li>Perform transport I/O and stream framing only</li>
 *   <li>Not decode messages</li>
 *   <li>Not schedule votes, blocks, or retries</li>
 * </ul>
 */
package network.compose.twopc.sim.transport;
