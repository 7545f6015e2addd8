/**
 * Wire-level implementation of the coordinator codec.
 *
 * <p>Field numbers ({@code ProtocolFields}), tags ({@code WireTag}), varints,
 * the tag/value reader and writer, and the length-prefix framing all live
 * here. Nothing outside this package sees a wire type or a field number.</p>
 *
 * <p>Internal failures are {@code WireFormatException}s; they are converted to
 * {@link network.compose.twopc.sim.codec.DecodeResult.Rejected} at the
 * {@link network.compose.twopc.sim.codec.impl.DefaultMessageDecoder} boundary.</p>
 */
package network.compose.twopc.sim.codec.impl;
