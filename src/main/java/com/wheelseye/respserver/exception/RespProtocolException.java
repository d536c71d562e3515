package com.wheelseye.respserver.exception;

import com.wheelseye.respserver.protocol.resp.CommandFrame;

import java.util.List;

/**
 * Unrecoverable framing violation detected by the frame parser.
 *
 * Framing relies on declared lengths, so the stream cannot be resynchronized
 * after one of these; the connection that produced it has to be closed.
 * Frames completed earlier in the same feed call are kept in
 * {@link #framesBeforeFault()} so they can still be answered.
 */
public class RespProtocolException extends RespServerException {

    private final transient List<CommandFrame> framesBeforeFault;

    public RespProtocolException(String message) {
        this(message, List.of());
    }

    public RespProtocolException(String message, List<CommandFrame> framesBeforeFault) {
        super("Protocol error: " + message, PROTOCOL_ERROR, message);
        this.framesBeforeFault = List.copyOf(framesBeforeFault);
    }

    /**
     * Returns a copy of this fault carrying the frames decoded before it.
     */
    public RespProtocolException withFramesBeforeFault(List<CommandFrame> frames) {
        RespProtocolException copy = new RespProtocolException(getDetails(), frames);
        copy.setStackTrace(getStackTrace());
        return copy;
    }

    public List<CommandFrame> framesBeforeFault() {
        return framesBeforeFault;
    }
}
