package com.wheelseye.respserver.protocol.resp;

import com.wheelseye.respserver.config.RespServerProperties;
import com.wheelseye.respserver.exception.RespProtocolException;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RespFrameParserTest {

    private static final String PING_FRAME = "*1\r\n$4\r\nPING\r\n";

    private RespFrameParser parser;

    @BeforeEach
    void setUp() {
        parser = new RespFrameParser();
    }

    @AfterEach
    void tearDown() {
        parser.release();
    }

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    private static byte[] concat(byte[]... parts) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        for (byte[] part : parts) {
            out.writeBytes(part);
        }
        return out.toByteArray();
    }

    private List<CommandFrame> feed(String s) {
        return parser.feed(bytes(s));
    }

    @Nested
    class Multibulk {

        @Test
        void decodesSingleCommand() {
            assertThat(feed(PING_FRAME)).containsExactly(CommandFrame.of("PING"));
            assertThat(parser.bufferedBytes()).isZero();
        }

        @Test
        void decodesEverySplitIntoTwoChunks() {
            byte[] frame = bytes(PING_FRAME);
            for (int cut = 1; cut < frame.length; cut++) {
                RespFrameParser p = new RespFrameParser();
                try {
                    assertThat(p.feed(Arrays.copyOfRange(frame, 0, cut)))
                            .as("first part up to %d", cut).isEmpty();
                    assertThat(p.feed(Arrays.copyOfRange(frame, cut, frame.length)))
                            .as("second part from %d", cut).containsExactly(CommandFrame.of("PING"));
                } finally {
                    p.release();
                }
            }
        }

        @Test
        void decodesEverySplitIntoThreeChunks() {
            byte[] frame = bytes(PING_FRAME);
            for (int first = 1; first < frame.length - 1; first++) {
                for (int second = first + 1; second < frame.length; second++) {
                    RespFrameParser p = new RespFrameParser();
                    try {
                        List<CommandFrame> frames = new ArrayList<>();
                        assertThat(p.feed(Arrays.copyOfRange(frame, 0, first))).isEmpty();
                        assertThat(p.feed(Arrays.copyOfRange(frame, first, second))).isEmpty();
                        frames.addAll(p.feed(Arrays.copyOfRange(frame, second, frame.length)));
                        assertThat(frames).as("cuts %d/%d", first, second).containsExactly(CommandFrame.of("PING"));
                    } finally {
                        p.release();
                    }
                }
            }
        }

        @Test
        void decodesOneByteAtATime() {
            byte[] frame = bytes(PING_FRAME);
            for (int i = 0; i < frame.length - 1; i++) {
                assertThat(parser.feed(new byte[] {frame[i]})).as("byte %d", i).isEmpty();
            }
            assertThat(parser.feed(new byte[] {frame[frame.length - 1]})).containsExactly(CommandFrame.of("PING"));
        }

        @Test
        void returnsConcatenatedFramesInArrivalOrder() {
            List<CommandFrame> frames = feed("*2\r\n$4\r\nECHO\r\n$1\r\na\r\n" + PING_FRAME);

            assertThat(frames).containsExactly(CommandFrame.of("ECHO", "a"), CommandFrame.of("PING"));
        }

        @Test
        void keepsTrailingFragmentForNextFeed() {
            assertThat(feed(PING_FRAME + "*2\r\n$4\r\nECHO\r\n$5\r\nhel")).containsExactly(CommandFrame.of("PING"));
            assertThat(parser.bufferedBytes()).isEqualTo("*2\r\n$4\r\nECHO\r\n$5\r\nhel".length());

            assertThat(feed("lo\r\n")).containsExactly(CommandFrame.of("ECHO", "hello"));
            assertThat(parser.bufferedBytes()).isZero();
        }

        @Test
        void waitsForCountAndLengthSpanningFeeds() {
            assertThat(feed("*")).isEmpty();
            assertThat(feed("2\r")).isEmpty();
            assertThat(feed("\n$1")).isEmpty();
            assertThat(feed("0\r\n0123456789\r\n$")).isEmpty();
            assertThat(feed("2\r\nok\r\n")).containsExactly(CommandFrame.of("0123456789", "ok"));
        }

        @Test
        void zeroLengthBulkIsEmptyString() {
            assertThat(feed("*2\r\n$4\r\nECHO\r\n$0\r\n\r\n")).containsExactly(CommandFrame.of("ECHO", ""));
        }

        @Test
        void nullBulkIsAbsentArgument() {
            List<CommandFrame> frames = feed("*2\r\n$4\r\nECHO\r\n$-1\r\n");

            assertThat(frames).hasSize(1);
            CommandFrame frame = frames.get(0);
            assertThat(frame.size()).isEqualTo(2);
            assertThat(frame.arguments().get(1)).isNull();
        }

        @Test
        void nullArrayIsConsumedWithoutFrame() {
            assertThat(feed("*-1\r\n" + PING_FRAME)).containsExactly(CommandFrame.of("PING"));
        }

        @Test
        void emptyArrayYieldsEmptyFrame() {
            assertThat(feed("*0\r\n")).containsExactly(CommandFrame.empty());
        }

        @Test
        void payloadMayContainCrlf() {
            assertThat(feed("*2\r\n$4\r\nECHO\r\n$4\r\na\r\nb\r\n")).containsExactly(CommandFrame.of("ECHO", "a\r\nb"));
        }

        @Test
        void decodesMultiByteUtf8Payload() {
            byte[] payload = bytes("héllo");
            String frame = "*2\r\n$4\r\nECHO\r\n$" + payload.length + "\r\nhéllo\r\n";

            assertThat(feed(frame)).containsExactly(CommandFrame.of("ECHO", "héllo"));
        }

        @Test
        void acceptsNettyBuffersAndAdvancesThem() {
            ByteBuf chunk = Unpooled.copiedBuffer(PING_FRAME, StandardCharsets.UTF_8);
            try {
                assertThat(parser.feed(chunk)).containsExactly(CommandFrame.of("PING"));
                assertThat(chunk.isReadable()).isFalse();
            } finally {
                chunk.release();
            }
        }
    }

    @Nested
    class Inline {

        @Test
        void splitsCrlfTerminatedLineOnWhitespace() {
            assertThat(feed("ECHO  hello \t world\r\n")).containsExactly(CommandFrame.of("ECHO", "hello", "world"));
        }

        @Test
        void splitsOnUnicodeWhitespace() {
            assertThat(feed("ECHO\u3000hello\u00A0world\r\n")).containsExactly(CommandFrame.of("ECHO", "hello", "world"));
        }

        @Test
        void acceptsBareLineFeed() {
            assertThat(feed("PING\n")).containsExactly(CommandFrame.of("PING"));
        }

        @Test
        void waitsForTerminator() {
            assertThat(feed("PI")).isEmpty();
            assertThat(feed("NG\r")).isEmpty();
            assertThat(feed("\n")).containsExactly(CommandFrame.of("PING"));
        }

        @Test
        void blankLinesYieldNoFrame() {
            assertThat(feed("\r\n   \n")).isEmpty();
            assertThat(parser.bufferedBytes()).isZero();
        }

        @Test
        void mixesWithMultibulk() {
            assertThat(feed("PING\r\n" + PING_FRAME + "ECHO x\n"))
                    .containsExactly(CommandFrame.of("PING"), CommandFrame.of("PING"), CommandFrame.of("ECHO", "x"));
        }
    }

    @Nested
    class Faults {

        @Test
        void nonNumericCountIsFault() {
            assertThatThrownBy(() -> feed("*abc\r\n"))
                    .isInstanceOf(RespProtocolException.class)
                    .hasMessageContaining("invalid multibulk length")
                    .satisfies(e -> assertThat(((RespProtocolException) e).framesBeforeFault()).isEmpty());
            assertThat(parser.isFaulted()).isTrue();
        }

        @Test
        void unterminatedNonNumericCountWaits() {
            assertThat(feed("*abc")).isEmpty();
            assertThat(parser.isFaulted()).isFalse();
        }

        @Test
        void nonNumericBulkLengthIsFault() {
            assertThatThrownBy(() -> feed("*1\r\n$x\r\nPING\r\n"))
                    .isInstanceOf(RespProtocolException.class)
                    .hasMessageContaining("invalid bulk length");
        }

        @Test
        void signedOrEmptyNumbersAreFaults() {
            assertThatThrownBy(() -> feed("*+1\r\n")).isInstanceOf(RespProtocolException.class);
            parser.release();

            parser = new RespFrameParser();
            assertThatThrownBy(() -> feed("*\r\n")).isInstanceOf(RespProtocolException.class);
        }

        @Test
        void missingBulkMarkerIsFault() {
            assertThatThrownBy(() -> feed("*1\r\n:4\r\n"))
                    .isInstanceOf(RespProtocolException.class)
                    .hasMessageContaining("expected '$', got ':'");
        }

        @Test
        void negativeLengthsOtherThanNullAreFaults() {
            assertThatThrownBy(() -> feed("*-2\r\n")).isInstanceOf(RespProtocolException.class);
            parser.release();

            parser = new RespFrameParser();
            assertThatThrownBy(() -> feed("*1\r\n$-5\r\n")).isInstanceOf(RespProtocolException.class);
        }

        @Test
        void payloadWithoutTrailingCrlfIsFault() {
            assertThatThrownBy(() -> feed("*1\r\n$4\r\nPINGxx"))
                    .isInstanceOf(RespProtocolException.class)
                    .hasMessageContaining("not terminated by CRLF");
        }

        @Test
        void carriesFramesCompletedBeforeFault() {
            assertThatThrownBy(() -> feed(PING_FRAME + "*abc\r\n"))
                    .isInstanceOf(RespProtocolException.class)
                    .satisfies(e -> assertThat(((RespProtocolException) e).framesBeforeFault())
                            .containsExactly(CommandFrame.of("PING")));
        }

        @Test
        void invalidUtf8InBulkPayloadIsFault() {
            byte[] frame = concat(bytes("*2\r\n$4\r\nECHO\r\n$1\r\n"), new byte[] {(byte) 0xFF}, bytes("\r\n"));

            assertThatThrownBy(() -> parser.feed(frame))
                    .isInstanceOf(RespProtocolException.class)
                    .hasMessageContaining("invalid UTF-8");
            assertThat(parser.isFaulted()).isTrue();
        }

        @Test
        void invalidUtf8InInlineLineIsFault() {
            byte[] line = concat(bytes("ECHO "), new byte[] {(byte) 0xC3, (byte) 0x28}, bytes("\r\n"));

            assertThatThrownBy(() -> parser.feed(line))
                    .isInstanceOf(RespProtocolException.class)
                    .hasMessageContaining("invalid UTF-8");
        }

        @Test
        void framesBeforeInvalidUtf8AreKept() {
            byte[] input = concat(bytes(PING_FRAME + "*1\r\n$1\r\n"), new byte[] {(byte) 0x80}, bytes("\r\n"));

            assertThatThrownBy(() -> parser.feed(input))
                    .isInstanceOf(RespProtocolException.class)
                    .satisfies(e -> assertThat(((RespProtocolException) e).framesBeforeFault())
                            .containsExactly(CommandFrame.of("PING")));
        }

        @Test
        void rejectsInputAfterFault() {
            assertThatThrownBy(() -> feed("*abc\r\n")).isInstanceOf(RespProtocolException.class);

            assertThatThrownBy(() -> feed(PING_FRAME)).isInstanceOf(IllegalStateException.class);
        }

        @Test
        void rejectsInputAfterRelease() {
            parser.release();

            assertThatThrownBy(() -> feed(PING_FRAME)).isInstanceOf(IllegalStateException.class);
            assertThat(parser.bufferedBytes()).isZero();
        }
    }

    @Nested
    class Limits {

        private final RespServerProperties.Protocol tight = new RespServerProperties.Protocol(16, 8, 2);

        @Test
        void inlineLineLongerThanLimitIsFault() {
            RespFrameParser p = new RespFrameParser(tight);
            try {
                assertThat(p.feed(bytes("ECHO 0123456789"))).isEmpty();
                assertThatThrownBy(() -> p.feed(bytes("0123456789")))
                        .isInstanceOf(RespProtocolException.class)
                        .hasMessageContaining("too big inline request");
            } finally {
                p.release();
            }
        }

        @Test
        void bulkLongerThanLimitIsFault() {
            RespFrameParser p = new RespFrameParser(tight);
            try {
                assertThatThrownBy(() -> p.feed(bytes("*1\r\n$9\r\n")))
                        .isInstanceOf(RespProtocolException.class)
                        .hasMessageContaining("invalid bulk length");
            } finally {
                p.release();
            }
        }

        @Test
        void countAboveLimitIsFault() {
            RespFrameParser p = new RespFrameParser(tight);
            try {
                assertThatThrownBy(() -> p.feed(bytes("*3\r\n")))
                        .isInstanceOf(RespProtocolException.class)
                        .hasMessageContaining("invalid multibulk length");
            } finally {
                p.release();
            }
        }
    }
}
