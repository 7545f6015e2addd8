package network.compose.twopc.sim.codec.impl;

/**
 * Field numbers of the coordinator protocol.
 *
 * <p>These are the only place the numeric layout of each message lives; the
 * encoder and decoder both refer to them.</p>
 */
final class ProtocolFields
{
    private ProtocolFields() {}

    /** {@code Message} envelope. Fields 2 to 5 are mutually exclusive. */
    static final class Envelope {
        static final int SENDER_ID = 1;
        static final int XT_REQUEST = 2;
        static final int VOTE = 3;
        static final int DECIDED = 4;
        static final int BLOCK = 5;

        private Envelope() {}
    }

    static final class XtRequest {
        static final int TRANSACTIONS = 1;

        private XtRequest() {}
    }

    static final class TransactionRequest {
        static final int CHAIN_ID = 1;
        static final int TRANSACTIONS = 2;

        private TransactionRequest() {}
    }

    static final class Vote {
        static final int SENDER_CHAIN_ID = 1;
        static final int XT_ID = 2;
        static final int VOTE = 3;

        private Vote() {}
    }

    static final class Decided {
        static final int XT_ID = 1;
        static final int DECISION = 2;

        private Decided() {}
    }

    static final class Block {
        static final int CHAIN_ID = 1;
        static final int BLOCK_DATA = 2;
        static final int INCLUDED_XT_IDS = 3;

        private Block() {}
    }
}
