package network.compose.twopc.sim.model;

/**
 * The payload variants a {@link Message} may carry.
 *
 * <p>
 * The set is closed: the coordinator protocol defines exactly four payloads
 * and each maps to a fixed field number on the wire.
 * </p>
 *
 * <ul>
 *   <li>{@link XTRequest}: cross-chain proposal (field 2)</li>
 *   <li>{@link Vote}: a participant's commit/abort vote (field 3)</li>
 *   <li>{@link Decided}: the coordinator's binding decision (field 4)</li>
 *   <li>{@link Block}: block inclusion confirmation (field 5)</li>
 * </ul>
 */
public sealed interface MessagePayload
        permits XTRequest, Vote, Decided, Block
{
}
