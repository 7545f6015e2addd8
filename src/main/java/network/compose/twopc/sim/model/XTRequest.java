package network.compose.twopc.sim.model;

import java.util.List;
import java.util.Objects;

/**
 * Cross-chain transaction proposal.
 *
 * <p>
 * Carries one {@link TransactionRequest} per participating chain. The proposal
 * itself carries no transaction id; the coordinator assigns one when it
 * registers the proposal.
 * </p>
 */
public record XTRequest(
        List<TransactionRequest> transactions
) implements MessagePayload
{
    public XTRequest {
        transactions = List.copyOf(Objects.requireNonNull(transactions, "transactions"));
    }

    /**
     * Raw transactions destined for one chain.
     */
    public record TransactionRequest(
            ChainId chainId,
            List<ByteSequence> transactions
    ) {
        public TransactionRequest {
            Objects.requireNonNull(chainId, "chainId");
            transactions = List.copyOf(Objects.requireNonNull(transactions, "transactions"));
        }
    }
}
