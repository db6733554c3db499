package com.questrail.protowire.transport.netty;

import com.questrail.protowire.api.WireDecodeException;
import com.questrail.protowire.api.WireEncodeException;
import com.questrail.protowire.api.WireErrorKind;
import com.questrail.protowire.budget.FallibleAllocation;
import com.questrail.protowire.observability.NullObservabilitySink;
import com.questrail.protowire.observability.WireObservabilitySink;
import com.questrail.protowire.observability.WireTransportEvent;
import com.questrail.protowire.transport.WireChannel;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.util.ReferenceCountUtil;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * NettyWireChannel
 * =============================================================================
 * Netty-backed implementation of the {@link WireChannel} Stream Adapter.
 *
 * <h2>Architectural Role</h2>
 * This class is a <strong>pure transport adapter</strong>. It moves bytes and
 * nothing else: it never decodes values and holds no decoded state.
 *
 * <h2>Netty containment rule</h2>
 * Netty types (e.g., {@code ChannelHandlerContext}, inbound {@code ByteBuf}s)
 * MUST NOT escape this package. Callers see {@code byte[]} and futures only.
 *
 * <h2>Demand-driven reads</h2>
 * The channel's auto-read is switched off on attach. The adapter asks the
 * transport for more data only while a {@link #readExact(int)} is pending, so
 * bytes are pulled from the socket at the pace the decoder consumes them. Bytes
 * that arrive beyond the pending request stay in a small carry-over buffer for
 * the next read.
 *
 * <h2>Threading</h2>
 * All state is confined to the channel's event loop. Calls from other threads
 * are handed over to it. At most one read may be pending; a second concurrent
 * read fails with {@link IllegalStateException}.
 */
public final class NettyWireChannel implements WireChannel
{
    private static final Logger log = LoggerFactory.getLogger(NettyWireChannel.class);

    /** Name of the inbound handler in the channel pipeline. */
    public static final String HANDLER_NAME = "protowire-inbound";

    private final Channel channel;
    private final WireObservabilitySink observability;

    // Event-loop confined.
    private final ByteBuf carry = Unpooled.buffer();
    private PendingRead pending;
    private boolean inputClosed;
    private boolean released;
    private Throwable failure;

    private NettyWireChannel(Channel channel, WireObservabilitySink observability)
    {
        this.channel = channel;
        this.observability = observability;
    }

    /**
     * Attach a new adapter to {@code channel}. Disables auto-read and installs
     * the inbound handler at the end of the pipeline.
     */
    public static NettyWireChannel attach(Channel channel)
    {
        return attach(channel, NullObservabilitySink.INSTANCE);
    }

    public static NettyWireChannel attach(Channel channel, WireObservabilitySink observability)
    {
        Objects.requireNonNull(channel, "channel");
        Objects.requireNonNull(observability, "observability");

        NettyWireChannel adapter = new NettyWireChannel(channel, observability);
        channel.config().setAutoRead(false);
        channel.pipeline().addLast(HANDLER_NAME, adapter.new InboundHandler());
        if (!channel.isActive() && channel.isRegistered()) {
            adapter.inputClosed = true;
        }
        adapter.transportEvent(WireTransportEvent.Kind.ATTACHED, null);
        return adapter;
    }

    @Override
    public CompletableFuture<byte[]> readExact(int length)
    {
        if (length < 0) {
            throw new IllegalArgumentException("length must be non-negative: " + length);
        }
        CompletableFuture<byte[]> result = new CompletableFuture<>();
        onEventLoop(() -> register(new PendingRead(length, result)));
        return result;
    }

    @Override
    public CompletableFuture<Void> writeAll(byte[] bytes)
    {
        Objects.requireNonNull(bytes, "bytes");
        CompletableFuture<Void> result = new CompletableFuture<>();
        ChannelFuture f = channel.writeAndFlush(Unpooled.wrappedBuffer(bytes));
        f.addListener(future -> {
            if (future.isSuccess()) {
                result.complete(null);
            }
            else {
                result.completeExceptionally(new WireEncodeException(WireErrorKind.IO,
                        "write to " + channel + " failed: " + future.cause(), future.cause()));
            }
        });
        return result;
    }

    @Override
    public void close()
    {
        channel.close();
    }

    private void onEventLoop(Runnable task)
    {
        if (channel.eventLoop().inEventLoop()) {
            task.run();
        }
        else {
            channel.eventLoop().execute(task);
        }
    }

    private void register(PendingRead read)
    {
        if (pending != null) {
            read.result.completeExceptionally(new IllegalStateException(
                    "a read is already pending on " + channel + "; one stream supports one decode at a time"));
            return;
        }
        pending = read;
        drain();
        if (pending != null) {
            channel.read();
        }
    }

    // Completes the pending read if the carry-over buffer can satisfy it, or fails it if it never can.
    private void drain()
    {
        PendingRead read = pending;
        if (read == null) {
            return;
        }
        int available = released ? 0 : carry.readableBytes();
        if (available >= read.length) {
            pending = null;
            byte[] out;
            try {
                out = FallibleAllocation.bytes(read.length, "read buffer");
            }
            catch (WireDecodeException e) {
                read.result.completeExceptionally(e);
                return;
            }
            if (read.length > 0) {
                carry.readBytes(out);
                carry.discardReadBytes();
            }
            read.result.complete(out);
            return;
        }
        if (failure != null) {
            pending = null;
            read.result.completeExceptionally(new WireDecodeException(WireErrorKind.IO,
                    "transport failure on " + channel + ": " + failure, failure));
        }
        else if (inputClosed) {
            pending = null;
            read.result.completeExceptionally(WireDecodeException.endOfStream(read.length, available));
        }
    }

    private void transportEvent(WireTransportEvent.Kind kind, Throwable cause)
    {
        observability.onTransportEvent(new WireTransportEvent(Instant.now(), channel.toString(), kind, cause));
    }

    private record PendingRead(int length, CompletableFuture<byte[]> result) {}

    /**
     * InboundHandler
     * -------------------------------------------------------------------------
     * Receives inbound {@link ByteBuf}s, appends them to the carry-over buffer
     * and completes the pending read when enough bytes are present.
     */
    private final class InboundHandler extends ChannelInboundHandlerAdapter
    {
        @Override
        public void channelRead(ChannelHandlerContext ctx, Object msg)
        {
            if (!(msg instanceof ByteBuf)) {
                // Not ours; let the rest of the pipeline deal with it.
                ctx.fireChannelRead(msg);
                return;
            }
            ByteBuf in = (ByteBuf) msg;
            try {
                carry.writeBytes(in);
            }
            finally {
                ReferenceCountUtil.release(in);
            }
            drain();
        }

        @Override
        public void channelReadComplete(ChannelHandlerContext ctx)
        {
            if (pending != null && !inputClosed) {
                ctx.read();
            }
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx)
        {
            log.debug("Channel {} inactive with {} unread bytes", ctx.channel(), carry.readableBytes());
            inputClosed = true;
            drain();
            transportEvent(WireTransportEvent.Kind.CLOSED, null);
            ctx.fireChannelInactive();
        }

        @Override
        public void handlerRemoved(ChannelHandlerContext ctx)
        {
            inputClosed = true;
            drain();
            released = true;
            carry.release();
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            failure = cause;
            drain();
            transportEvent(WireTransportEvent.Kind.FAILED, cause);
            ctx.close();
        }
    }
}
