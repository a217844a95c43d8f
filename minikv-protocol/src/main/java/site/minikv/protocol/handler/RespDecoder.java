package site.minikv.protocol.handler;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.ByteToMessageDecoder;
import lombok.extern.slf4j.Slf4j;
import site.minikv.protocol.Resp;
import site.minikv.protocol.RespDecodeException;

import java.util.List;

/**
 * RESP协议解码器
 *
 * <p>基于Netty的ByteToMessageDecoder，把入站字节流切分为完整的RESP值。
 *
 * <ul>
 *     <li>数据不完整 - 保留已收到的字节，等待更多数据</li>
 *     <li>格式错误 - 帧结构已不可信，丢弃缓冲区并关闭连接，不写回错误</li>
 *     <li>连接关闭 - 缓冲区为空属于正常结束；仍有半个值时记录告警</li>
 * </ul>
 *
 * @author minikv
 * @since 1.0.0
 */
@Slf4j
public class RespDecoder extends ByteToMessageDecoder {

    @Override
    protected void decode(ChannelHandlerContext ctx, ByteBuf in, List<Object> out) {
        try {
            while (in.isReadable()) {
                final Resp resp = Resp.decode(in);
                if (resp == null) {
                    // 数据不完整，等待更多数据
                    return;
                }
                out.add(resp);
                log.debug("成功解码RESP对象: {}", resp.getClass().getSimpleName());
            }
        } catch (RespDecodeException e) {
            log.warn("RESP格式错误，关闭连接 {}: {}", ctx.channel().remoteAddress(), e.getMessage());
            in.skipBytes(in.readableBytes());
            ctx.close();
        }
    }

    @Override
    protected void decodeLast(ChannelHandlerContext ctx, ByteBuf in, List<Object> out) throws Exception {
        decode(ctx, in, out);
        if (in.isReadable()) {
            log.warn("连接在消息中途关闭 {}，丢弃 {} 字节未完成的数据",
                    ctx.channel().remoteAddress(), in.readableBytes());
            in.skipBytes(in.readableBytes());
        }
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.error("RespDecoder异常: {}", cause.getMessage(), cause);
        ctx.close();
    }
}
