package express.mvp.courier.transport.framing;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** Unit tests for {@link FrameCodec}. */
@DisplayName("FrameCodec")
class FrameCodecTest {

    private final FrameCodec codec = new FrameCodec(1024);

    @Nested
    @DisplayName("Construction")
    class ConstructionTests {

        @Test
        @DisplayName("Default codec allows 16 MiB payloads")
        void defaultCodec_allows16MiB() {
            assertEquals(16 * 1024 * 1024, FrameCodec.defaultCodec().getMaxPayloadSize());
            assertEquals(6, FrameCodec.HEADER_SIZE);
        }

        @Test
        @DisplayName("Rejects non-positive limits")
        void nonPositiveLimit_isRejected() {
            assertThrows(IllegalArgumentException.class, () -> new FrameCodec(0));
            assertThrows(IllegalArgumentException.class, () -> new FrameCodec(-1));
        }

        @Test
        @DisplayName("Rejects limits that would overflow the frame size")
        void overflowingLimit_isRejected() {
            assertThrows(IllegalArgumentException.class, () -> new FrameCodec(Integer.MAX_VALUE));
        }
    }

    @Nested
    @DisplayName("Encoding")
    class EncodingTests {

        @Test
        @DisplayName("Writes type id and length little-endian ahead of the payload")
        void encode_isLittleEndian() {
            byte[] encoded = codec.encode(new Frame(0x0102, new byte[] {9, 8, 7}));

            assertArrayEquals(new byte[] {0x02, 0x01, 3, 0, 0, 0, 9, 8, 7}, encoded);
        }

        @Test
        @DisplayName("Empty payload encodes to a bare header")
        void emptyPayload_isHeaderOnly() {
            byte[] encoded = codec.encode(new Frame(5, new byte[0]));

            assertArrayEquals(new byte[] {5, 0, 0, 0, 0, 0}, encoded);
        }

        @Test
        @DisplayName("Highest type id survives as unsigned")
        void maxTypeId_isUnsigned() {
            byte[] encoded = codec.encode(new Frame(FrameCodec.MAX_TYPE_ID, new byte[0]));

            assertEquals(FrameCodec.MAX_TYPE_ID, codec.decodeHeader(encoded, 0).typeId());
        }

        @Test
        @DisplayName("Payload over the limit is rejected")
        void oversizePayload_throws() {
            Frame frame = new Frame(1, new byte[1025]);

            assertThrows(FramingException.class, () -> codec.encode(frame));
        }

        @Test
        @DisplayName("Payload at the limit is accepted")
        void payloadAtLimit_isAccepted() {
            byte[] encoded = codec.encode(new Frame(1, new byte[1024]));

            assertEquals(FrameCodec.HEADER_SIZE + 1024, encoded.length);
        }
    }

    @Nested
    @DisplayName("Header decoding")
    class DecodingTests {

        @Test
        @DisplayName("Decodes a header at an offset")
        void decodeHeader_atOffset() {
            byte[] source = new byte[10];
            ByteBuffer.wrap(source, 4, 6).order(ByteOrder.LITTLE_ENDIAN).putShort((short) 300).putInt(17);

            FrameCodec.Header header = codec.decodeHeader(source, 4);

            assertEquals(300, header.typeId());
            assertEquals(17, header.payloadLength());
        }

        @Test
        @DisplayName("Negative length field is a framing error")
        void negativeLength_throws() {
            byte[] source = {1, 0, (byte) 0xFF, (byte) 0xFF, (byte) 0xFF, (byte) 0xFF};

            FramingException e = assertThrows(FramingException.class, () -> codec.decodeHeader(source, 0));
            assertTrue(e.getMessage().contains("negative"));
        }

        @Test
        @DisplayName("Length field over the limit is a framing error")
        void oversizeLength_throws() {
            byte[] source = new byte[6];
            ByteBuffer.wrap(source).order(ByteOrder.LITTLE_ENDIAN).putShort((short) 1).putInt(1025);

            assertThrows(FramingException.class, () -> codec.decodeHeader(source, 0));
        }

        @Test
        @DisplayName("Truncated header is out of bounds")
        void truncatedHeader_throws() {
            assertThrows(IndexOutOfBoundsException.class, () -> codec.decodeHeader(new byte[5], 0));
        }
    }

    @Nested
    @DisplayName("Frame")
    class FrameTests {

        @Test
        @DisplayName("Type id must fit in 16 bits")
        void typeIdOutOfRange_throws() {
            assertThrows(FramingException.class, () -> new Frame(-1, new byte[0]));
            assertThrows(FramingException.class, () -> new Frame(0x10000, new byte[0]));
        }

        @Test
        @DisplayName("Frames compare by payload content")
        void equality_usesPayloadContent() {
            assertEquals(new Frame(3, new byte[] {1, 2}), new Frame(3, new byte[] {1, 2}));
            assertNotEquals(new Frame(3, new byte[] {1, 2}), new Frame(4, new byte[] {1, 2}));
            assertEquals(new Frame(3, new byte[] {1}).hashCode(), new Frame(3, new byte[] {1}).hashCode());
        }
    }
}
