package network.compose.twopc.sim.transport.tcp;

import network.compose.twopc.sim.codec.impl.LengthPrefixFrameReader;
import network.compose.twopc.sim.codec.impl.LengthPrefixFraming;
import network.compose.twopc.sim.transport.StreamEndpoint;
import network.compose.twopc.sim.transport.StreamEndpointListener;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * SocketStreamEndpoint
 * =============================================================================
 * Blocking-socket implementation of the {@link StreamEndpoint} port.
 *
 * <h2>Receive loop</h2>
 * A dedicated reader thread performs timed reads. Each read waits at most the
 * configured read timeout, after which the loop checks the stop flag and
 * resumes. A frame split across a timeout is not lost;
 * {@link LengthPrefixFrameReader} keeps its partial progress.
 *
 * <h2>Callbacks</h2>
 * {@link StreamEndpointListener#onTransportUp()} is called on the thread that
 * calls {@link #start()}, before the reader thread exists. Frames and the final
 * {@link StreamEndpointListener#onTransportDown(Throwable)} are delivered on
 * the reader thread.
 *
 * <h2>Writes</h2>
 * {@link #send(byte[])} writes the whole frame under a lock, so frames from
 * different callers never interleave.
 */
public final class SocketStreamEndpoint implements StreamEndpoint
{
    private static final Logger log = LoggerFactory.getLogger(SocketStreamEndpoint.class);

    private final String name;
    private final InetSocketAddress remote;
    private final Duration connectTimeout;
    private final Duration readTimeout;
    private final int maxFrameLength;

    private final Object writeLock = new Object();
    private final AtomicBoolean downNotified = new AtomicBoolean();

    private volatile StreamEndpointListener listener;
    private volatile Socket socket;
    private volatile Thread reader;
    private volatile boolean stopping;

    public SocketStreamEndpoint(String name,
                                InetSocketAddress remote,
                                Duration connectTimeout,
                                Duration readTimeout)
    {
        this(name, remote, connectTimeout, readTimeout, LengthPrefixFraming.DEFAULT_MAX_FRAME_LENGTH);
    }

    public SocketStreamEndpoint(String name,
                                InetSocketAddress remote,
                                Duration connectTimeout,
                                Duration readTimeout,
                                int maxFrameLength)
    {
        this.name = Objects.requireNonNull(name, "name");
        this.remote = Objects.requireNonNull(remote, "remote");
        this.connectTimeout = Objects.requireNonNull(connectTimeout, "connectTimeout");
        this.readTimeout = Objects.requireNonNull(readTimeout, "readTimeout");
        if (readTimeout.isZero() || readTimeout.isNegative()) {
            throw new IllegalArgumentException("readTimeout must be positive");
        }
        this.maxFrameLength = maxFrameLength;
    }

    @Override
    public void setListener(StreamEndpointListener listener)
    {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    @Override
    public void start()
    {
        StreamEndpointListener l = requireListener();
        if (socket != null) {
            throw new IllegalStateException("Endpoint " + name + " already started");
        }

        Socket s = new Socket();
        try {
            s.setTcpNoDelay(true);
            s.connect(remote, Math.toIntExact(connectTimeout.toMillis()));
            s.setSoTimeout(Math.toIntExact(readTimeout.toMillis()));
        }
        catch (IOException e) {
            closeQuietly(s);
            notifyDown(e);
            return;
        }

        socket = s;
        log.debug("{} connected to {}", name, remote);
        l.onTransportUp();

        Thread t = new Thread(this::receiveLoop, name + "-reader");
        t.setDaemon(true);
        reader = t;
        t.start();
    }

    @Override
    public void send(byte[] message) throws IOException
    {
        Objects.requireNonNull(message, "message");

        Socket s = socket;
        if (s == null || s.isClosed()) {
            throw new IOException("Endpoint " + name + " is not connected");
        }

        byte[] frame = LengthPrefixFraming.frame(message);
        synchronized (writeLock) {
            OutputStream out = s.getOutputStream();
            out.write(frame);
            out.flush();
        }
    }

    @Override
    public void stop()
    {
        stopping = true;
        if (reader == null) {
            // Never connected; nothing will report the shutdown.
            notifyDown(null);
        }
    }

    @Override
    public boolean awaitStopped(Duration timeout) throws InterruptedException
    {
        Thread t = reader;
        if (t == null) {
            return true;
        }
        t.join(Math.max(1, timeout.toMillis()));
        return !t.isAlive();
    }

    @Override
    public void forceClose()
    {
        stopping = true;
        Socket s = socket;
        if (s != null) {
            closeQuietly(s);
        }
    }

    private void receiveLoop()
    {
        Throwable cause = null;
        try {
            LengthPrefixFrameReader frames = new LengthPrefixFrameReader(socket.getInputStream(), maxFrameLength);
            while (!stopping) {
                byte[] frame;
                try {
                    frame = frames.readFrame();
                }
                catch (SocketTimeoutException timeout) {
                    continue;
                }
                listener.onFrame(frame);
            }
        }
        catch (IOException e) {
            // A forced close surfaces here as a SocketException.
            cause = stopping ? null : e;
        }
        catch (RuntimeException e) {
            log.error("{} listener failed while handling a frame", name, e);
            cause = e;
        }
        finally {
            closeQuietly(socket);
            notifyDown(cause);
        }
    }

    private void notifyDown(Throwable cause)
    {
        StreamEndpointListener l = listener;
        if (l != null && downNotified.compareAndSet(false, true)) {
            l.onTransportDown(cause);
        }
    }

    private StreamEndpointListener requireListener()
    {
        StreamEndpointListener l = listener;
        if (l == null) {
            throw new IllegalStateException("StreamEndpointListener must be set before start()");
        }
        return l;
    }

    private void closeQuietly(Socket s)
    {
        try {
            s.close();
        }
        catch (IOException e) {
            log.debug("{} error while closing socket", name, e);
        }
    }

    @Override
    public String toString()
    {
        return "SocketStreamEndpoint[" + name + " -> " + remote + "]";
    }
}
