package com.wheelseye.respserver.protocol.resp;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandler;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.MessageToByteEncoder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Outbound pipeline stage turning {@link ReplyValue}s into RESP bytes.
 *
 * Holds no state, so one instance is shared by every channel.
 */
@Slf4j
@Component
@ChannelHandler.Sharable
public class RespReplyEncoder extends MessageToByteEncoder<ReplyValue> {

    public RespReplyEncoder() {
        super(ReplyValue.class);
    }

    @Override
    protected void encode(ChannelHandlerContext ctx, ReplyValue reply, ByteBuf out) {
        byte[] bytes = RespEncoder.encode(reply);
        out.writeBytes(bytes);

        if (log.isDebugEnabled()) {
            log.debug("📤 Encoded {} ({} bytes) for {}", reply.getClass().getSimpleName(), bytes.length,
                    ctx.channel().remoteAddress());
        }
    }
}
