package com.questrail.kducer.protocol.modbus.transport.tcp.netty;

import com.questrail.kducer.protocol.modbus.ModbusConnectTimeoutException;
import com.questrail.kducer.protocol.modbus.ModbusTransportException;
import com.questrail.kducer.protocol.modbus.transport.ModbusTransport;
import com.questrail.kducer.protocol.modbus.transport.ModbusTransportFactory;

import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ConnectTimeoutException;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.Arrays;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * NettyTcpTransport
 * =============================================================================
 * Netty-backed implementation of the {@link ModbusTransport} port.
 *
 * <h2>Architectural Role</h2>
 * A <strong>pure transport adapter</strong>: it turns Netty's asynchronous
 * channel into the blocking, byte-exact stream the exchange client expects.
 * It does not parse frames and does not reconnect.
 *
 * <h2>Netty containment rule</h2>
 * Netty types ({@code Channel}, {@code EventLoopGroup}, {@code ByteBuf}) MUST
 * NOT escape this package. Inbound buffers are copied into an internal
 * {@code byte[]} accumulator and released by the handler.
 *
 * <h2>Threading</h2>
 * The event loop thread appends to the accumulator under {@link #lock} and
 * signals {@link #dataArrived}; the single caller of {@link #receiveAll}
 * waits on that condition. {@link #close()} signals as well so that a blocked
 * receive fails promptly.
 *
 * <h2>Lifecycle</h2>
 * One instance per connection attempt. {@link #close()} closes the channel and
 * shuts down the dedicated event loop group.
 */
public final class NettyTcpTransport implements ModbusTransport
{
    private static final Logger log = LoggerFactory.getLogger(NettyTcpTransport.class);

    private final String host;
    private final int port;
    private final long exchangeTimeoutNanos;

    private final EventLoopGroup group;
    private final Bootstrap bootstrap;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition dataArrived = lock.newCondition();

    private byte[] inbound = new byte[0];
    private boolean peerClosed;
    private Throwable channelFailure;

    private volatile Channel channel;
    private volatile boolean closed;

    public NettyTcpTransport(String host, int port, Duration exchangeTimeout)
    {
        this.host = Objects.requireNonNull(host, "host");
        this.port = port;
        this.exchangeTimeoutNanos = Objects.requireNonNull(exchangeTimeout, "exchangeTimeout").toNanos();

        this.group = new NioEventLoopGroup(1);
        this.bootstrap = new Bootstrap();

        bootstrap.group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.TCP_NODELAY, true)
                .option(ChannelOption.SO_LINGER, 0)
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch)
                    {
                        ch.pipeline().addLast(new InboundHandler());
                    }
                });
    }

    /**
     * Factory suitable for the session's composition root.
     */
    public static ModbusTransportFactory factory()
    {
        return NettyTcpTransport::new;
    }

    @Override
    public void connect(Duration timeout)
    {
        Objects.requireNonNull(timeout, "timeout");
        if (closed) {
            throw new ModbusTransportException("Transport is closed");
        }
        if (isConnected()) {
            return;
        }

        final int timeoutMillis = (int) Math.max(1L, Math.min(Integer.MAX_VALUE, timeout.toMillis()));
        bootstrap.option(ChannelOption.CONNECT_TIMEOUT_MILLIS, timeoutMillis);

        log.debug("Connecting to {}:{} (timeout {} ms)", host, port, timeoutMillis);

        final ChannelFuture f;
        try {
            f = bootstrap.connect(new InetSocketAddress(host, port));
        }
        catch (RuntimeException e) {
            throw new ModbusTransportException("Connect to " + host + ":" + port + " failed", e);
        }

        // Netty enforces CONNECT_TIMEOUT_MILLIS itself; the extra margin only
        // covers name resolution and scheduling.
        if (!f.awaitUninterruptibly(timeoutMillis + 1000L)) {
            f.cancel(true);
            throw new ModbusConnectTimeoutException("Connect to " + host + ":" + port
                    + " timed out after " + timeoutMillis + " ms");
        }
        if (!f.isSuccess()) {
            Throwable cause = f.cause();
            if (cause instanceof ConnectTimeoutException) {
                throw new ModbusConnectTimeoutException("Connect to " + host + ":" + port
                        + " timed out after " + timeoutMillis + " ms", cause);
            }
            throw new ModbusTransportException("Connect to " + host + ":" + port + " failed", cause);
        }

        channel = f.channel();
        if (closed) {
            channel.close();
            throw new ModbusTransportException("Transport closed while connecting");
        }
        log.debug("Connected to {}:{}", host, port);
    }

    @Override
    public void sendAll(byte[] bytes)
    {
        Objects.requireNonNull(bytes, "bytes");
        final Channel ch = requireOpenChannel();

        lock.lock();
        try {
            if (inbound.length > 0) {
                log.debug("Discarding {} stale inbound bytes", inbound.length);
                inbound = new byte[0];
            }
        }
        finally {
            lock.unlock();
        }

        final ChannelFuture wf = ch.writeAndFlush(Unpooled.wrappedBuffer(bytes.clone()));
        if (!wf.awaitUninterruptibly(exchangeTimeoutNanos, TimeUnit.NANOSECONDS)) {
            throw new ModbusTransportException("Send of " + bytes.length + " bytes timed out");
        }
        if (!wf.isSuccess()) {
            throw new ModbusTransportException("Send of " + bytes.length + " bytes failed", wf.cause());
        }
    }

    @Override
    public byte[] receiveAll(int count)
    {
        if (count < 0) {
            throw new IllegalArgumentException("count must be >= 0: " + count);
        }
        requireOpenChannel();

        lock.lock();
        try {
            int lastSize = inbound.length;
            long remaining = exchangeTimeoutNanos;

            while (inbound.length < count) {
                if (closed) {
                    throw new ModbusTransportException("Transport closed while receiving");
                }
                if (channelFailure != null) {
                    throw new ModbusTransportException("Channel failed while receiving", channelFailure);
                }
                if (peerClosed) {
                    throw new ModbusTransportException("Connection closed by peer after "
                            + inbound.length + " of " + count + " bytes");
                }
                if (remaining <= 0L) {
                    throw new ModbusTransportException("Receive timed out after "
                            + inbound.length + " of " + count + " bytes");
                }

                try {
                    remaining = dataArrived.awaitNanos(remaining);
                }
                catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new ModbusTransportException("Interrupted while receiving", e);
                }

                if (inbound.length > lastSize) {
                    // progress resets the timeout
                    lastSize = inbound.length;
                    remaining = exchangeTimeoutNanos;
                }
            }

            final byte[] out = Arrays.copyOfRange(inbound, 0, count);
            inbound = Arrays.copyOfRange(inbound, count, inbound.length);
            return out;
        }
        finally {
            lock.unlock();
        }
    }

    @Override
    public boolean isConnected()
    {
        final Channel ch = channel;
        return !closed && ch != null && ch.isActive();
    }

    @Override
    public void close()
    {
        if (closed) {
            return;
        }
        closed = true;

        final Channel ch = channel;
        if (ch != null) {
            ch.close();
        }
        group.shutdownGracefully(0, 200, TimeUnit.MILLISECONDS);

        lock.lock();
        try {
            dataArrived.signalAll();
        }
        finally {
            lock.unlock();
        }
        log.debug("Closed transport to {}:{}", host, port);
    }

    private Channel requireOpenChannel()
    {
        final Channel ch = channel;
        if (closed || ch == null) {
            throw new ModbusTransportException("Transport is not connected");
        }
        return ch;
    }

    /**
     * InboundHandler
     * -------------------------------------------------------------------------
     * Copies inbound stream bytes into the accumulator and records peer close
     * and channel failures for the blocked receiver.
     */
    private final class InboundHandler extends SimpleChannelInboundHandler<ByteBuf>
    {
        @Override
        protected void channelRead0(ChannelHandlerContext ctx, ByteBuf msg)
        {
            final byte[] chunk = new byte[msg.readableBytes()];
            msg.getBytes(msg.readerIndex(), chunk);

            lock.lock();
            try {
                final byte[] grown = Arrays.copyOf(inbound, inbound.length + chunk.length);
                System.arraycopy(chunk, 0, grown, inbound.length, chunk.length);
                inbound = grown;
                dataArrived.signalAll();
            }
            finally {
                lock.unlock();
            }
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx)
        {
            lock.lock();
            try {
                peerClosed = true;
                dataArrived.signalAll();
            }
            finally {
                lock.unlock();
            }
            log.debug("Channel to {}:{} inactive", host, port);
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            lock.lock();
            try {
                channelFailure = cause;
                dataArrived.signalAll();
            }
            finally {
                lock.unlock();
            }
            log.debug("Channel to {}:{} failed", host, port, cause);
            ctx.close();
        }
    }
}
