package io.codesync.transport.impl;

import io.codesync.sync.SyncMessage;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.CorruptedFrameException;
import io.netty.handler.codec.MessageToMessageCodec;
import io.netty.handler.codec.http.websocketx.BinaryWebSocketFrame;
import io.netty.handler.codec.http.websocketx.CloseWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketCloseStatus;
import io.netty.handler.codec.http.websocketx.WebSocketFrame;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Maps binary WebSocket frames to {@link SyncMessage}s.
 * <pre>
 * frame := 0x00 subtype payload   (sync; subtype 0 = step 1, 1 = step 2, 2 = update)
 *        | 0x01 payload           (awareness)
 * </pre>
 * Text frames are not part of the protocol and close the connection.
 */
@Slf4j
public final class SyncMessageCodec extends MessageToMessageCodec<WebSocketFrame, SyncMessage> {

    public static final byte MESSAGE_SYNC = 0;
    public static final byte MESSAGE_AWARENESS = 1;

    public static final byte SYNC_STEP1 = 0;
    public static final byte SYNC_STEP2 = 1;
    public static final byte SYNC_UPDATE = 2;

    @Override
    protected void encode(final ChannelHandlerContext ctx, final SyncMessage msg, final List<Object> out) {
        final byte[] payload = msg.payload();
        final ByteBuf buf = ctx.alloc().buffer(2 + payload.length);

        switch (msg.kind()) {
            case SYNC_STEP1 -> buf.writeByte(MESSAGE_SYNC).writeByte(SYNC_STEP1);
            case SYNC_STEP2 -> buf.writeByte(MESSAGE_SYNC).writeByte(SYNC_STEP2);
            case UPDATE -> buf.writeByte(MESSAGE_SYNC).writeByte(SYNC_UPDATE);
            case AWARENESS -> buf.writeByte(MESSAGE_AWARENESS);
        }
        buf.writeBytes(payload);
        out.add(new BinaryWebSocketFrame(buf));
    }

    @Override
    protected void decode(final ChannelHandlerContext ctx, final WebSocketFrame frame, final List<Object> out) {
        if (frame instanceof TextWebSocketFrame) {
            log.warn("Text frame on {}; closing", ctx.channel().remoteAddress());
            ctx.writeAndFlush(new CloseWebSocketFrame(WebSocketCloseStatus.INVALID_MESSAGE_TYPE))
                    .addListener(ChannelFutureListener.CLOSE);
            return;
        }
        if (!(frame instanceof BinaryWebSocketFrame)) {
            return;
        }
        out.add(decode(frame.content()));
    }

    /**
     * @throws CorruptedFrameException if the frame is too short or has an unknown type
     */
    static SyncMessage decode(final ByteBuf in) {
        if (!in.isReadable()) {
            throw new CorruptedFrameException("Empty frame");
        }

        final byte type = in.readByte();
        switch (type) {
            case MESSAGE_SYNC -> {
                if (!in.isReadable()) {
                    throw new CorruptedFrameException("Sync frame without subtype");
                }
                final byte subtype = in.readByte();
                final byte[] payload = ByteBufUtil.getBytes(in);
                return switch (subtype) {
                    case SYNC_STEP1 -> SyncMessage.step1(payload);
                    case SYNC_STEP2 -> SyncMessage.step2(payload);
                    case SYNC_UPDATE -> SyncMessage.update(payload);
                    default -> throw new CorruptedFrameException("Unknown sync subtype " + subtype);
                };
            }
            case MESSAGE_AWARENESS -> {
                return SyncMessage.awareness(ByteBufUtil.getBytes(in));
            }
            default -> throw new CorruptedFrameException("Unknown message type " + type);
        }
    }
}
