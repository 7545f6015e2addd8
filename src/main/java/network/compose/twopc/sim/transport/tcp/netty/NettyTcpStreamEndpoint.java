package network.compose.twopc.sim.transport.tcp.netty;

import network.compose.twopc.sim.codec.impl.LengthPrefixFraming;
import network.compose.twopc.sim.transport.StreamEndpoint;
import network.compose.twopc.sim.transport.StreamEndpointListener;

import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;
import io.netty.channel.*;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.LengthFieldBasedFrameDecoder;
import io.netty.handler.codec.LengthFieldPrepender;

import java.io.EOFException;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * NettyTcpStreamEndpoint
 * =============================================================================
 * Netty-backed implementation of the {@link StreamEndpoint} port.
 *
 * <h2>Architectural Role</h2>
 * This class is a <strong>pure transport adapter</strong>. Framing is done by
 * Netty's {@link LengthFieldBasedFrameDecoder} and {@link LengthFieldPrepender}
 * configured for the 4-byte big-endian prefix; nothing here decodes messages.
 *
 * <h2>Netty containment rule</h2>
 * Netty types (e.g., {@code Channel}, {@code EventLoopGroup}, {@code ByteBuf})
 * MUST NOT escape this package. Inbound frames are copied into {@code byte[]};
 * reference-counted buffers are released internally.
 *
 * <h2>Callbacks</h2>
 * All listener callbacks run on the channel's event loop, except the
 * connection-failure notification, which runs on the thread calling
 * {@link #start()}. {@link #start()} returns only after the listener has
 * seen {@link StreamEndpointListener#onTransportUp()}.
 *
 * <h2>Lifecycle</h2>
 * - {@link #start()} connects and waits for the outcome.
 * - {@link #stop()} closes the channel and shuts down the event loop group.
 */
public final class NettyTcpStreamEndpoint implements StreamEndpoint
{
    private final String name;
    private final InetSocketAddress remote;
    private final Duration connectTimeout;

    private final EventLoopGroup group;
    private final Bootstrap bootstrap;

    private final AtomicBoolean downNotified = new AtomicBoolean();
    private final CountDownLatch upNotified = new CountDownLatch(1);

    private volatile StreamEndpointListener listener;
    private volatile Channel channel;
    private volatile boolean stopping;

    public NettyTcpStreamEndpoint(String name, InetSocketAddress remote, Duration connectTimeout)
    {
        this(name, remote, connectTimeout, LengthPrefixFraming.DEFAULT_MAX_FRAME_LENGTH);
    }

    /**
     * Construct an endpoint with a dedicated single-threaded event loop group.
     */
    public NettyTcpStreamEndpoint(String name,
                                  InetSocketAddress remote,
                                  Duration connectTimeout,
                                  int maxFrameLength)
    {
        this.name = Objects.requireNonNull(name, "name");
        this.remote = Objects.requireNonNull(remote, "remote");
        this.connectTimeout = Objects.requireNonNull(connectTimeout, "connectTimeout");

        this.group = new NioEventLoopGroup(1);
        this.bootstrap = new Bootstrap();

        bootstrap.group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.TCP_NODELAY, true)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, Math.toIntExact(connectTimeout.toMillis()))
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch)
                    {
                        int prefix = LengthPrefixFraming.HEADER_LENGTH;
                        ChannelPipeline p = ch.pipeline();
                        p.addLast(new LengthFieldBasedFrameDecoder(maxFrameLength, 0, prefix, 0, prefix));
                        p.addLast(new LengthFieldPrepender(prefix));
                        p.addLast(new InboundHandler());
                    }
                });
    }

    @Override
    public void setListener(StreamEndpointListener listener)
    {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    @Override
    public void start()
    {
        requireListener();

        ChannelFuture f = bootstrap.connect(remote).awaitUninterruptibly();
        if (f.isSuccess()) {
            channel = f.channel();
            awaitUpNotification();
        }
        else {
            notifyDown(f.cause());
            group.shutdownGracefully(0, 0, TimeUnit.MILLISECONDS);
        }
    }

    @Override
    public void send(byte[] message) throws IOException
    {
        Objects.requireNonNull(message, "message");

        Channel ch = channel;
        if (ch == null || !ch.isActive()) {
            throw new IOException("Endpoint " + name + " is not connected");
        }

        // Write failures also close the channel through exceptionCaught.
        ChannelFuture write = ch.writeAndFlush(Unpooled.wrappedBuffer(message))
                .addListener(ChannelFutureListener.FIRE_EXCEPTION_ON_FAILURE);
        awaitWrite(write, connectTimeout, name);
    }

    /**
     * Blocks until {@code write} completes. Must not be called on an event loop.
     *
     * @throws IOException if the write failed or did not finish within {@code timeout}
     */
    static void awaitWrite(ChannelFuture write, Duration timeout, String name) throws IOException
    {
        if (!write.awaitUninterruptibly(Math.max(1, timeout.toMillis()), TimeUnit.MILLISECONDS)) {
            throw new IOException("Endpoint " + name + " write did not complete within " + timeout);
        }
        if (!write.isSuccess()) {
            throw new IOException("Endpoint " + name + " write failed", write.cause());
        }
    }

    @Override
    public void stop()
    {
        stopping = true;
        Channel ch = channel;
        if (ch != null) {
            ch.close();
        }
        else {
            notifyDown(null);
        }

        group.shutdownGracefully(0, 1, TimeUnit.SECONDS);
    }

    @Override
    public boolean awaitStopped(Duration timeout) throws InterruptedException
    {
        return group.terminationFuture().await(Math.max(1, timeout.toMillis()), TimeUnit.MILLISECONDS);
    }

    @Override
    public void forceClose()
    {
        stopping = true;
        Channel ch = channel;
        if (ch != null) {
            ch.close();
        }
        group.shutdownGracefully(0, 0, TimeUnit.MILLISECONDS);
    }

    // The connect future completes just before channelActive fires on the
    // event loop; callers expect the listener to have seen "up" on return.
    private void awaitUpNotification()
    {
        try {
            upNotified.await(Math.max(1, connectTimeout.toMillis()), TimeUnit.MILLISECONDS);
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
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

    @Override
    public String toString()
    {
        return "NettyTcpStreamEndpoint[" + name + " -> " + remote + "]";
    }

    /**
     * InboundHandler
     * -------------------------------------------------------------------------
     * Receives de-framed {@link ByteBuf}s and forwards them as plain byte arrays.
     */
    private final class InboundHandler extends SimpleChannelInboundHandler<ByteBuf>
    {
        @Override
        public void channelActive(ChannelHandlerContext ctx)
        {
            // Runs before any channelRead.
            StreamEndpointListener l = listener;
            if (l != null) {
                l.onTransportUp();
            }
            upNotified.countDown();
            ctx.fireChannelActive();
        }

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, ByteBuf frame)
        {
            StreamEndpointListener l = listener;
            if (l == null) {
                return;
            }
            l.onFrame(ByteBufUtil.getBytes(frame));
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx)
        {
            notifyDown(stopping ? null : new EOFException("Peer closed the connection"));
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            notifyDown(cause);
            ctx.close();
        }
    }
}
