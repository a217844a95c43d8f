package site.minikv.protocol;

import io.netty.buffer.ByteBuf;

import java.nio.charset.StandardCharsets;

/**
 * RESP空值
 *
 * <p>表示"不存在"，在线路上总是编码为空批量字符串 "$-1\r\n"。
 * 无状态，全局只有一个实例。
 */
public final class RespNull extends Resp {
    /** 空值的RESP编码 */
    public static final byte[] NULL_BYTES = "$-1\r\n".getBytes(StandardCharsets.US_ASCII);

    public static final RespNull INSTANCE = new RespNull();

    private RespNull() {
    }

    @Override
    public void encode(ByteBuf byteBuf) {
        byteBuf.writeBytes(NULL_BYTES);
    }

    @Override
    public String toString() {
        return "(nil)";
    }
}
