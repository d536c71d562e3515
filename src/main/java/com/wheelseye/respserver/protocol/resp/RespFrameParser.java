package com.wheelseye.respserver.protocol.resp;

import com.wheelseye.respserver.config.RespServerProperties;
import com.wheelseye.respserver.exception.RespProtocolException;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;

import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Incremental RESP frame parser - one instance per connection, never shared.
 *
 * Accepts two coexisting request formats:
 * <pre>
 * Multibulk:  *N\r\n  then N x ( $len\r\n &lt;len bytes&gt;\r\n )
 * Inline:     PING hello\r\n   (a bare \n terminator is accepted too)
 * </pre>
 *
 * Bytes are accumulated in a private buffer. A frame is consumed only once every byte
 * of it is present; until then the pending bytes stay untouched and {@link #feed}
 * returns an empty list. Payloads and inline lines must be valid UTF-8. Malformed input raises {@link RespProtocolException}, after
 * which the parser refuses further input.
 */
public final class RespFrameParser {

    private static final byte ARRAY_PREFIX = '*';
    private static final byte BULK_PREFIX = '$';
    private static final byte CR = '\r';
    private static final byte LF = '\n';
    private static final int NULL_LENGTH = -1;
    private static final int INITIAL_CAPACITY = 256;
    // Enough digits for any length below Long.MAX_VALUE
    private static final int MAX_LENGTH_DIGITS = 18;
    private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

    private final RespServerProperties.Protocol limits;
    private final ByteBuf buffer;
    private final CharsetDecoder utf8 = StandardCharsets.UTF_8.newDecoder()
            .onMalformedInput(CodingErrorAction.REPORT)
            .onUnmappableCharacter(CodingErrorAction.REPORT);
    private boolean faulted;
    private boolean released;

    public RespFrameParser() {
        this(RespServerProperties.Protocol.defaults());
    }

    public RespFrameParser(RespServerProperties.Protocol limits) {
        this.limits = limits;
        this.buffer = Unpooled.buffer(INITIAL_CAPACITY);
    }

    public List<CommandFrame> feed(byte[] chunk) {
        return feed(Unpooled.wrappedBuffer(chunk));
    }

    /**
     * Appends the readable bytes of {@code chunk} and extracts every complete frame.
     * The chunk's reader index is advanced; releasing it stays with the caller.
     *
     * @return frames in arrival order, empty when more bytes are needed
     * @throws RespProtocolException on malformed input
     */
    public List<CommandFrame> feed(ByteBuf chunk) {
        if (released) {
            throw new IllegalStateException("Parser buffer already released");
        }
        if (faulted) {
            throw new IllegalStateException("Parser rejected earlier input, connection must be closed");
        }

        buffer.writeBytes(chunk);
        List<CommandFrame> frames = new ArrayList<>();
        try {
            while (buffer.isReadable() && decodeOne(frames)) {
                // keep extracting
            }
        } catch (RespProtocolException e) {
            faulted = true;
            throw frames.isEmpty() ? e : e.withFramesBeforeFault(frames);
        }
        buffer.discardReadBytes();
        return frames;
    }

    // Bytes received but not yet part of a complete frame
    public int bufferedBytes() {
        return released ? 0 : buffer.readableBytes();
    }

    public boolean isFaulted() {
        return faulted;
    }

    /**
     * Drops any incomplete trailing fragment and frees the buffer. Idempotent.
     */
    public void release() {
        if (!released) {
            released = true;
            buffer.release();
        }
    }

    // ==================== Frame decoding ====================

    // Returns true if bytes were consumed (frame, null array or blank line), false if more input is needed
    private boolean decodeOne(List<CommandFrame> out) {
        int start = buffer.readerIndex();
        if (buffer.getByte(start) == ARRAY_PREFIX) {
            return decodeMultiBulk(start, out);
        }
        return decodeInline(start, out);
    }

    private boolean decodeMultiBulk(int start, List<CommandFrame> out) {
        int headerEnd = findCrlf(start + 1);
        if (headerEnd < 0) {
            checkUnterminated(start, "too big multibulk count string");
            return false;
        }

        long count = parseLength(start + 1, headerEnd, "multibulk length");
        int cursor = headerEnd + 2;

        if (count == NULL_LENGTH) {
            // Null array carries no command
            buffer.readerIndex(cursor);
            return true;
        }
        if (count < 0 || count > limits.maxMultibulkLength()) {
            throw new RespProtocolException("invalid multibulk length " + count);
        }

        List<String> arguments = new ArrayList<>((int) Math.min(count, 16));
        for (long i = 0; i < count; i++) {
            if (cursor >= buffer.writerIndex()) {
                return false;
            }
            byte marker = buffer.getByte(cursor);
            if (marker != BULK_PREFIX) {
                throw new RespProtocolException("expected '$', got '" + printable(marker) + "'");
            }

            int lengthEnd = findCrlf(cursor + 1);
            if (lengthEnd < 0) {
                checkUnterminated(cursor, "too big bulk count string");
                return false;
            }
            long length = parseLength(cursor + 1, lengthEnd, "bulk length");
            cursor = lengthEnd + 2;

            if (length == NULL_LENGTH) {
                arguments.add(null);
                continue;
            }
            if (length < 0 || length > limits.maxBulkLength()) {
                throw new RespProtocolException("invalid bulk length " + length);
            }
            if ((long) buffer.writerIndex() - cursor < length + 2) {
                return false;
            }

            int payloadEnd = cursor + (int) length;
            if (buffer.getByte(payloadEnd) != CR || buffer.getByte(payloadEnd + 1) != LF) {
                throw new RespProtocolException("bulk string of length " + length + " not terminated by CRLF");
            }
            arguments.add(decodeText(cursor, (int) length));
            cursor = payloadEnd + 2;
        }

        buffer.readerIndex(cursor);
        out.add(new CommandFrame(arguments));
        return true;
    }

    private boolean decodeInline(int start, List<CommandFrame> out) {
        int lf = buffer.indexOf(start, buffer.writerIndex(), LF);
        if (lf < 0) {
            checkUnterminated(start, "too big inline request");
            return false;
        }

        int lineEnd = (lf > start && buffer.getByte(lf - 1) == CR) ? lf - 1 : lf;
        if (lineEnd - start > limits.maxInlineLength()) {
            throw new RespProtocolException("too big inline request");
        }
        String line = decodeText(start, lineEnd - start);
        buffer.readerIndex(lf + 1);

        List<String> arguments = Arrays.stream(WHITESPACE.split(line))
                .filter(token -> !token.isEmpty())
                .toList();
        if (!arguments.isEmpty()) {
            out.add(new CommandFrame(arguments));
        }
        return true;
    }

    // ==================== Helpers ====================

    // Index of the CR of the first CRLF at or after from, or -1
    private int findCrlf(int from) {
        int end = buffer.writerIndex();
        int index = from;
        while (index < end) {
            int cr = buffer.indexOf(index, end, CR);
            if (cr < 0 || cr + 1 >= end) {
                return -1;
            }
            if (buffer.getByte(cr + 1) == LF) {
                return cr;
            }
            index = cr + 1;
        }
        return -1;
    }

    // Invalid UTF-8 is a fault, never replaced with U+FFFD
    private String decodeText(int from, int length) {
        try {
            return utf8.decode(buffer.nioBuffer(from, length)).toString();
        } catch (CharacterCodingException e) {
            throw new RespProtocolException("invalid UTF-8 in argument at offset " + (from - buffer.readerIndex()));
        }
    }

    // A line still missing its terminator must not grow without bound
    private void checkUnterminated(int lineStart, String message) {
        if (buffer.writerIndex() - lineStart > limits.maxInlineLength()) {
            throw new RespProtocolException(message);
        }
    }

    // Strict: optional '-', then ASCII digits only
    private long parseLength(int from, int to, String what) {
        int length = to - from;
        boolean negative = length > 0 && buffer.getByte(from) == '-';
        int digitsFrom = negative ? from + 1 : from;
        int digits = to - digitsFrom;
        if (digits < 1 || digits > MAX_LENGTH_DIGITS) {
            throw new RespProtocolException("invalid " + what + " '" + lineText(from, to) + "'");
        }

        long value = 0;
        for (int i = digitsFrom; i < to; i++) {
            byte b = buffer.getByte(i);
            if (b < '0' || b > '9') {
                throw new RespProtocolException("invalid " + what + " '" + lineText(from, to) + "'");
            }
            value = value * 10 + (b - '0');
        }
        return negative ? -value : value;
    }

    private String lineText(int from, int to) {
        int length = Math.min(to - from, 32);
        return buffer.toString(from, length, StandardCharsets.UTF_8);
    }

    private static String printable(byte b) {
        return b >= 0x20 && b < 0x7f ? String.valueOf((char) b) : String.format("\\x%02x", b & 0xff);
    }
}
