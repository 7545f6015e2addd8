package network.compose.twopc.sim.internal.time;

import java.time.Instant;

/**
 * Wall-clock source for human-readable output only.
 *
 * <p>Block markers embed the wall-clock time they were produced at. This clock
 * may jump and MUST NOT be used to compute delays.</p>
 */
public interface WallClock
{
    Instant now();
}
