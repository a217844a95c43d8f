package site.minikv.store;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * 不可变字节串，存储中的键、字段和值都以它表示。
 *
 * <p>按字节内容比较相等，不做任何字符集转换，因此任意二进制数据写入后
 * 读出的字节完全一致。
 * <ul>
 *   <li>哈希值在构造时预先计算，适合作为HashMap的键
 *   <li>{@link #of(byte[])}执行防御性拷贝，{@link #wrapTrusted(byte[])}直接引用原数组
 *   <li>字符串形式按UTF-8延迟解码，仅用于日志和测试
 * </ul>
 *
 * @author minikv
 * @since 1.0.0
 */
public final class KvBytes {

    /** 字符串与字节互转使用的字符集 */
    public static final Charset CHARSET = StandardCharsets.UTF_8;

    /** 空字节串 */
    public static final KvBytes EMPTY = new KvBytes(new byte[0]);

    private final byte[] bytes;

    private final int hashCode;

    /** 延迟初始化的字符串形式 */
    private volatile String stringValue;

    private KvBytes(final byte[] bytes) {
        this.bytes = bytes;
        this.hashCode = Arrays.hashCode(bytes);
    }

    /**
     * 拷贝字节数组创建实例
     *
     * @param bytes 源字节数组，不能为null
     * @return 实例
     */
    public static KvBytes of(final byte[] bytes) {
        if (bytes == null) {
            throw new IllegalArgumentException("字节数组不能为null");
        }
        return new KvBytes(bytes.clone());
    }

    /**
     * 直接引用字节数组创建实例，调用方保证之后不再修改该数组
     *
     * @param trustedBytes 受信任的字节数组
     * @return 实例
     */
    public static KvBytes wrapTrusted(final byte[] trustedBytes) {
        if (trustedBytes == null) {
            throw new IllegalArgumentException("字节数组不能为null");
        }
        return new KvBytes(trustedBytes);
    }

    public static KvBytes fromString(final String str) {
        if (str == null) {
            throw new IllegalArgumentException("字符串不能为null");
        }
        if (str.isEmpty()) {
            return EMPTY;
        }
        final KvBytes kvBytes = new KvBytes(str.getBytes(CHARSET));
        kvBytes.stringValue = str;
        return kvBytes;
    }

    /**
     * @return 字节内容的副本
     */
    public byte[] getBytes() {
        return bytes.clone();
    }

    /**
     * 获取底层数组的直接引用，调用方不得修改返回的数组。
     *
     * @return 底层字节数组
     */
    public byte[] getBytesUnsafe() {
        return bytes;
    }

    public int length() {
        return bytes.length;
    }

    /**
     * @return 按UTF-8解码的字符串，非法字节会被替换
     */
    public String getString() {
        String result = stringValue;
        if (result == null) {
            result = new String(bytes, CHARSET);
            stringValue = result;
        }
        return result;
    }

    @Override
    public boolean equals(final Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        final KvBytes other = (KvBytes) obj;
        return hashCode == other.hashCode && Arrays.equals(bytes, other.bytes);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    /**
     * 可打印的ASCII字符原样输出，其余字节输出为\xNN
     */
    @Override
    public String toString() {
        final StringBuilder sb = new StringBuilder(bytes.length + 2);
        sb.append('"');
        for (final byte b : bytes) {
            if (b >= 32 && b <= 126 && b != '"' && b != '\\') {
                sb.append((char) b);
            } else {
                sb.append("\\x").append(String.format("%02x", b & 0xFF));
            }
        }
        return sb.append('"').toString();
    }
}
