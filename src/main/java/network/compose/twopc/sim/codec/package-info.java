/**
 * Coordinator Wire Codec
 * =============================================================================
 *
 * <p>This package defines the <strong>codec layer</strong> for the coordinator
 * protocol. The codec layer implements the wire-level rules of the protocol:</p>
 *
 * <ul>
 *   <li>Base-128 varints and {@code (field << 3) | wireType} tags</li>
 *   <li>Length-delimited nested payloads</li>
 *   <li>Forward-compatible skipping of unknown fields</li>
 *   <li>4-byte big-endian length-prefix framing on the stream</li>
 * </ul>
 *
 * <h2>Architectural Placement</h2>
 * <p>The codec layer sits <strong>below</strong> the participant state machine
 * and <strong>above</strong> transport I/O:</p>
 *
 * <pre>
 *   stream bytes
 *        → LengthPrefixFrameReader   (framing, partial reads)
 *            → byte[] frame body
 *                → MessageDecoder    (tag/value walk)
 *                    → DecodeResult  (Message or DecodeError)
 * </pre>
 *
 * <h2>Important Boundaries</h2>
 * <ul>
 *   <li>Only {@code codec.impl} knows field numbers and wire types.</li>
 *   <li>Decode failures are values ({@link network.compose.twopc.sim.codec.DecodeResult}),
 *       never exceptions, at the public boundary.</li>
 *   <li>The encoder always writes lengths as varints, so payloads longer than
 *       127 bytes get a multi-byte length.</li>
 * </ul>
 */
package network.compose.twopc.sim.codec;
