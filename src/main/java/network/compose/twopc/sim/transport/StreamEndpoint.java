package network.compose.twopc.sim.transport;

import java.io.IOException;
import java.time.Duration;

/**
 * StreamEndpoint
 * -----------------------------------------------------------------------------
 * Port for one framed TCP connection to the coordinator.
 *
 * <p>One endpoint carries exactly one connection attempt. There is no
 * reconnect: once the connection is down the endpoint is finished.</p>
 */
public interface StreamEndpoint
{
    /**
     * Register the listener that receives inbound frames and lifecycle events.
     *
     * <p>This must be called before {@link #start()}.</p>
     */
    void setListener(StreamEndpointListener listener);

    /**
     * Connect to the remote peer and begin receiving frames.
     *
     * <p>Returns once the connection attempt has completed. On success the
     * listener is notified via {@link StreamEndpointListener#onTransportUp()}
     * before any frame is delivered. On failure it is notified via
     * {@link StreamEndpointListener#onTransportDown(Throwable)} with the cause.</p>
     */
    void start();

    /**
     * Write one message body, prefixed with its length.
     *
     * <p>Concurrent callers are serialized; a frame is never interleaved with
     * another. A normal return means the frame was handed to the operating
     * system; it does not mean the peer has read it. Callers block until then,
     * so this must not be called from a transport's own I/O thread.</p>
     *
     * @param message serialized message, without length prefix
     * @throws IOException if the connection is not up or the write fails
     */
    void send(byte[] message) throws IOException;

    /**
     * Ask the receive side to stop cooperatively.
     *
     * <p>Does not block. The listener is notified via
     * {@link StreamEndpointListener#onTransportDown(Throwable)} once the receive
     * side has wound down.</p>
     */
    void stop();

    /**
     * Wait up to {@code timeout} for the receive side to finish after
     * {@link #stop()}.
     *
     * @return {@code true} if it finished (or never started)
     */
    boolean awaitStopped(Duration timeout) throws InterruptedException;

    /**
     * Close the connection immediately, unblocking any pending read.
     */
    void forceClose();
}
