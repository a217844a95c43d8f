package site.minikv.protocol;

import io.netty.buffer.ByteBuf;
import lombok.EqualsAndHashCode;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * RESP批量字符串类型
 *
 * <p>长度前缀的二进制安全字符串，编码格式为 "$长度\r\n内容\r\n"。
 * 空值不由本类表示，而是使用{@link RespNull}。
 *
 * <p>使用建议：
 * <ul>
 *     <li>外部数据使用{@link #create(byte[])}，会复制输入数组</li>
 *     <li>解码器等内部路径使用{@link #wrapTrusted(byte[])}，不复制</li>
 *     <li>字符串内容使用{@link #fromString(String)}，按UTF-8编码</li>
 * </ul>
 *
 * @author minikv
 * @since 1.0.0
 */
@EqualsAndHashCode(callSuper = false)
public class BulkString extends Resp {
    /** 空字符串的RESP编码 */
    public static final byte[] EMPTY_BULK = "$0\r\n\r\n".getBytes(StandardCharsets.US_ASCII);

    /** 字符串内容的字节表示 */
    private final byte[] content;

    private BulkString(final byte[] content, final boolean copy) {
        if (content == null) {
            throw new IllegalArgumentException("BulkString内容不能为null，空值请使用RespNull");
        }
        this.content = copy ? Arrays.copyOf(content, content.length) : content;
    }

    /**
     * 安全模式：复制输入的字节数组
     *
     * @param content 字节数组内容
     * @return BulkString实例
     */
    public static BulkString create(final byte[] content) {
        return new BulkString(content, true);
    }

    /**
     * 零拷贝工厂方法：调用者必须保证数组之后不再被修改
     *
     * @param trustedBytes 受信任的字节数组
     * @return BulkString实例
     */
    public static BulkString wrapTrusted(final byte[] trustedBytes) {
        return new BulkString(trustedBytes, false);
    }

    /**
     * 从字符串创建BulkString，按UTF-8编码
     *
     * @param str 字符串内容
     * @return BulkString实例
     */
    public static BulkString fromString(final String str) {
        return new BulkString(str.getBytes(StandardCharsets.UTF_8), false);
    }

    /**
     * 获取内容的副本
     *
     * @return 内容字节数组
     */
    public byte[] getContent() {
        return Arrays.copyOf(content, content.length);
    }

    /**
     * 内容的字节长度
     *
     * @return 字节数
     */
    public int length() {
        return content.length;
    }

    /**
     * 按UTF-8解码内容
     *
     * @return 字符串内容
     */
    public String getString() {
        return new String(content, StandardCharsets.UTF_8);
    }

    @Override
    public void encode(final ByteBuf byteBuf) {
        final int length = content.length;
        if (length == 0) {
            byteBuf.writeBytes(EMPTY_BULK);
            return;
        }

        byteBuf.ensureWritable(estimateEncodedSize(length));
        byteBuf.writeByte('$');
        writeIntegerAsBytes(byteBuf, length);
        byteBuf.writeBytes(CRLF);
        byteBuf.writeBytes(content);
        byteBuf.writeBytes(CRLF);
    }

    /**
     * 估算编码后的大小，用于 ByteBuf 预分配
     *
     * @param contentLength 内容长度
     * @return 估算的编码大小
     */
    static int estimateEncodedSize(final int contentLength) {
        // '$' + 长度数字 + '\r\n' + 内容 + '\r\n'
        return 1 + String.valueOf(contentLength).length() + 2 + contentLength + 2;
    }

    @Override
    public String toString() {
        return getString();
    }
}
