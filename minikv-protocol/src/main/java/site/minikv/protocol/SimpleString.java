package site.minikv.protocol;

import io.netty.buffer.ByteBuf;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.nio.charset.StandardCharsets;

/**
 * RESP简单字符串类型
 *
 * <p>编码格式为 "+内容\r\n"，内容中不能包含CR或LF。
 * 常用的响应（OK、PONG）使用预定义常量。
 *
 * @author minikv
 * @since 1.0.0
 */
@Getter
@EqualsAndHashCode(callSuper = false)
public class SimpleString extends Resp {
    /** 预定义的成功响应 */
    public static final SimpleString OK = new SimpleString("OK");

    /** 预定义的心跳响应 */
    public static final SimpleString PONG = new SimpleString("PONG");

    /** 字符串内容 */
    private final String content;

    public SimpleString(final String content) {
        this.content = content;
    }

    /**
     * 工厂方法：获取 SimpleString 实例，常用字符串返回缓存实例
     *
     * @param content 字符串内容
     * @return SimpleString 实例
     */
    public static SimpleString valueOf(final String content) {
        if ("OK".equals(content)) {
            return OK;
        } else if ("PONG".equals(content)) {
            return PONG;
        }
        return new SimpleString(content);
    }

    @Override
    public void encode(ByteBuf byteBuf) {
        byteBuf.writeByte('+');
        byteBuf.writeBytes(content.getBytes(StandardCharsets.UTF_8));
        byteBuf.writeBytes(CRLF);
    }

    @Override
    public String toString() {
        return content;
    }
}
