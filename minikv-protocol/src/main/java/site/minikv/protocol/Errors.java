package site.minikv.protocol;

import io.netty.buffer.ByteBuf;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.nio.charset.StandardCharsets;

/**
 * RESP错误消息类型
 *
 * <p>用于向客户端传递命令执行失败的原因，格式为 "-错误消息\r\n"。
 * <ul>
 *     <li>示例："-ERR unknown command 'foobar'"</li>
 *     <li>示例："-ERR wrong number of arguments for 'get' command"</li>
 * </ul>
 *
 * @author minikv
 * @since 1.0.0
 */
@Getter
@EqualsAndHashCode(callSuper = false)
public class Errors extends Resp {
    /** 错误消息内容 */
    private final String content;

    public Errors(String content) {
        this.content = content;
    }

    @Override
    public void encode(ByteBuf byteBuf) {
        byteBuf.writeByte('-');
        byteBuf.writeBytes(content.getBytes(StandardCharsets.UTF_8));
        byteBuf.writeBytes(CRLF);
    }

    @Override
    public String toString() {
        return content;
    }
}
