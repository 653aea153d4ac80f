package io.codesync.transport.impl;

import io.codesync.sync.SyncMessage;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;
import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.handler.codec.CorruptedFrameException;
import io.netty.handler.codec.http.websocketx.BinaryWebSocketFrame;
import io.netty.handler.codec.http.websocketx.CloseWebSocketFrame;
import io.netty.handler.codec.http.websocketx.PongWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketCloseStatus;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class SyncMessageCodecTest {

    @Test
    void encodesTypeAndSubtypeBytes() {
        final EmbeddedChannel ch = new EmbeddedChannel(new SyncMessageCodec());

        assertArrayEquals(new byte[]{0, 0, 5}, written(ch, SyncMessage.step1(new byte[]{5})));
        assertArrayEquals(new byte[]{0, 1, 6}, written(ch, SyncMessage.step2(new byte[]{6})));
        assertArrayEquals(new byte[]{0, 2, 7}, written(ch, SyncMessage.update(new byte[]{7})));
        assertArrayEquals(new byte[]{1, 8, 9}, written(ch, SyncMessage.awareness(new byte[]{8, 9})));
        ch.finishAndReleaseAll();
    }

    @Test
    void decodesBinaryFrames() {
        final EmbeddedChannel ch = new EmbeddedChannel(new SyncMessageCodec());

        ch.writeInbound(binary(0, 2, 1, 2, 3));
        final SyncMessage update = ch.readInbound();
        assertEquals(SyncMessage.Kind.UPDATE, update.kind());
        assertArrayEquals(new byte[]{1, 2, 3}, update.payload());

        ch.writeInbound(binary(0, 0));
        final SyncMessage step1 = ch.readInbound();
        assertEquals(SyncMessage.Kind.SYNC_STEP1, step1.kind());
        assertEquals(0, step1.payload().length);

        ch.writeInbound(binary(1, 4));
        final SyncMessage awareness = ch.readInbound();
        assertEquals(SyncMessage.Kind.AWARENESS, awareness.kind());
        assertArrayEquals(new byte[]{4}, awareness.payload());

        assertFalse(ch.finish());
    }

    @Test
    void textFramesCloseTheConnection() {
        final EmbeddedChannel ch = new EmbeddedChannel(new SyncMessageCodec());

        ch.writeInbound(new TextWebSocketFrame("hello"));

        assertNull(ch.readInbound());
        final CloseWebSocketFrame close = ch.readOutbound();
        assertEquals(WebSocketCloseStatus.INVALID_MESSAGE_TYPE.code(), close.statusCode());
        close.release();
        assertFalse(ch.isOpen());
    }

    @Test
    void controlFramesAreIgnored() {
        final EmbeddedChannel ch = new EmbeddedChannel(new SyncMessageCodec());

        ch.writeInbound(new PongWebSocketFrame());

        assertNull(ch.readInbound());
        assertTrue(ch.isOpen());
        ch.finishAndReleaseAll();
    }

    @Test
    void malformedFramesAreRejected() {
        assertThrows(CorruptedFrameException.class, () -> SyncMessageCodec.decode(Unpooled.EMPTY_BUFFER));
        assertThrows(CorruptedFrameException.class, () -> SyncMessageCodec.decode(Unpooled.wrappedBuffer(new byte[]{0})));
        assertThrows(CorruptedFrameException.class, () -> SyncMessageCodec.decode(Unpooled.wrappedBuffer(new byte[]{0, 3})));
        assertThrows(CorruptedFrameException.class, () -> SyncMessageCodec.decode(Unpooled.wrappedBuffer(new byte[]{2, 0})));

        final EmbeddedChannel ch = new EmbeddedChannel(new SyncMessageCodec());
        assertThrows(CorruptedFrameException.class, () -> ch.writeInbound(binary(7)));
        ch.finishAndReleaseAll();
    }

    private static BinaryWebSocketFrame binary(final int... bytes) {
        final byte[] b = new byte[bytes.length];
        for (int i = 0; i < bytes.length; i++) b[i] = (byte) bytes[i];
        return new BinaryWebSocketFrame(Unpooled.wrappedBuffer(b));
    }

    private static byte[] written(final EmbeddedChannel ch, final SyncMessage msg) {
        assertTrue(ch.writeOutbound(msg));
        final BinaryWebSocketFrame frame = ch.readOutbound();
        try {
            return ByteBufUtil.getBytes(frame.content());
        } finally {
            frame.release();
        }
    }
}
