package site.minikv.protocol;

import io.netty.buffer.ByteBuf;
import lombok.EqualsAndHashCode;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * RESP数组类型
 *
 * <p>编码格式为 "*元素数量\r\n" 后接每个元素的编码。
 * 元素在构造时一次性给出，之后不再修改；请求总是一个由批量字符串组成的数组。
 *
 * <p>预定义实例：
 * <ul>
 *     <li>EMPTY - 空数组，对应"*0\r\n"</li>
 * </ul>
 *
 * @author minikv
 * @since 1.0.0
 */
@EqualsAndHashCode(callSuper = false)
public class RespArray extends Resp {
    /** 空数组的RESP编码 */
    private static final byte[] EMPTY_ARRAY_BYTES = "*0\r\n".getBytes(StandardCharsets.US_ASCII);

    /** 预定义的空数组实例 */
    public static final RespArray EMPTY = new RespArray(new Resp[0]);

    /** 数组内容 */
    private final Resp[] content;

    public RespArray(final Resp... content) {
        if (content == null) {
            throw new IllegalArgumentException("RespArray内容不能为null");
        }
        this.content = content;
    }

    /**
     * 工厂方法：空数组返回缓存实例
     *
     * @param content 数组内容
     * @return RespArray 实例
     */
    public static RespArray valueOf(final List<? extends Resp> content) {
        if (content.isEmpty()) {
            return EMPTY;
        }
        return new RespArray(content.toArray(new Resp[0]));
    }

    /**
     * 以字符串构造由批量字符串组成的数组，常用于构造请求
     *
     * @param parts 各元素内容
     * @return RespArray 实例
     */
    public static RespArray ofBulkStrings(final String... parts) {
        final Resp[] array = new Resp[parts.length];
        for (int i = 0; i < parts.length; i++) {
            array[i] = BulkString.fromString(parts[i]);
        }
        return new RespArray(array);
    }

    /**
     * 获取只读的元素视图
     *
     * @return 元素列表
     */
    public List<Resp> getContent() {
        return Collections.unmodifiableList(Arrays.asList(content));
    }

    public int size() {
        return content.length;
    }

    public Resp get(final int index) {
        return content[index];
    }

    @Override
    public void encode(final ByteBuf byteBuf) {
        if (content.length == 0) {
            byteBuf.writeBytes(EMPTY_ARRAY_BYTES);
            return;
        }

        byteBuf.writeByte('*');
        writeIntegerAsBytes(byteBuf, content.length);
        byteBuf.writeBytes(CRLF);
        for (final Resp element : content) {
            element.encode(byteBuf);
        }
    }

    @Override
    public String toString() {
        return Arrays.toString(content);
    }
}
