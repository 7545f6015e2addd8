package network.compose.twopc.sim.model;

/**
 * Identifier of one cross-chain transaction proposal.
 *
 * <p>
 * Ids are assigned by the coordinator and carried on the wire as an unsigned
 * 32-bit varint. Java has no unsigned int, so the value is held in a
 * {@code long} and range-checked on construction.
 * </p>
 */
public final class XtId implements Comparable<XtId>
{
    public static final long MIN_VALUE = 0L;

    public static final long MAX_VALUE = 0xFFFF_FFFFL;

    private final long value;

    private XtId(long value) {
        this.value = value;
    }

    /**
     * @throws IllegalArgumentException if {@code value} is outside {@code 0..2^32-1}
     */
    public static XtId of(long value) {
        if (value < MIN_VALUE || value > MAX_VALUE) {
            throw new IllegalArgumentException(
                    "xt_id must be in range " + MIN_VALUE + ".." + MAX_VALUE + " (was " + value + ")");
        }
        return new XtId(value);
    }

    public long value() {
        return value;
    }

    @Override
    public int compareTo(XtId o) {
        return Long.compare(value, o.value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof XtId that)) return false;
        return value == that.value;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(value);
    }

    @Override
    public String toString() {
        return Long.toString(value);
    }
}
