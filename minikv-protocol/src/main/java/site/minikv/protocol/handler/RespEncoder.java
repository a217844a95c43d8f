package site.minikv.protocol.handler;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.MessageToByteEncoder;
import lombok.extern.slf4j.Slf4j;
import site.minikv.protocol.Resp;

/**
 * RESP协议编码器
 *
 * <p>把出站的{@link Resp}对象直接编码进Netty分配的ByteBuf。
 *
 * @author minikv
 * @since 1.0.0
 */
@Slf4j
public class RespEncoder extends MessageToByteEncoder<Resp> {

    @Override
    protected void encode(ChannelHandlerContext ctx, Resp msg, ByteBuf out) {
        msg.encode(out);
        log.debug("成功编码RESP响应: {} (大小: {} bytes)",
                msg.getClass().getSimpleName(), out.readableBytes());
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.error("RespEncoder异常: {}", cause.getMessage(), cause);
        ctx.close();
    }
}
