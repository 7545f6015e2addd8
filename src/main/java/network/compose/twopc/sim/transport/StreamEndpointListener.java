package network.compose.twopc.sim.transport;

/**
 * StreamEndpointListener
 * -----------------------------------------------------------------------------
 * Callback sink for {@link StreamEndpoint}.
 *
 * <p>Callbacks for one endpoint are delivered serially, and
 * {@link #onTransportDown(Throwable)} is delivered at most once. Each endpoint
 * documents the thread it calls back on; listeners must not block it.</p>
 */
public interface StreamEndpointListener
{
    /**
     * Called when the connection is established.
     */
    void onTransportUp();

    /**
     * Called when the connection attempt failed or the connection ended.
     *
     * @param cause an exception or diagnostic cause; {@code null} for orderly
     *              local shutdown
     */
    void onTransportDown(Throwable cause);

    /**
     * Called with one complete message body, length prefix removed.
     *
     * <p>The array is owned by the listener.</p>
     */
    void onFrame(byte[] message);
}
