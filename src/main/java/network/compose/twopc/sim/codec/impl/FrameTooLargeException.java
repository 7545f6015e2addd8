package network.compose.twopc.sim.codec.impl;

import java.io.IOException;

/**
 * A length prefix announced a frame larger than the reader accepts.
 *
 * <p>The stream cannot be resynchronised after this, so the condition is fatal
 * for the connection.</p>
 */
public final class FrameTooLargeException extends IOException
{
    public FrameTooLargeException(long declared, int max) {
        super("Frame length " + declared + " exceeds maximum " + max);
    }
}
