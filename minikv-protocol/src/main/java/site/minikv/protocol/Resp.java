package site.minikv.protocol;

import io.netty.buffer.ByteBuf;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * RESP协议基础类
 *
 * <p>所有RESP数据类型的基类，负责协议解码，并定义统一的编码接口。
 * 解码基于Netty的{@link ByteBuf}，按递归下降的方式解析一个完整的值。
 *
 * <p>支持的数据类型：
 * <ul>
 *     <li>简单字符串 - 以"+"开头</li>
 *     <li>错误消息 - 以"-"开头</li>
 *     <li>批量字符串 - 以"$"开头，"$-1"表示空值</li>
 *     <li>数组 - 以"*"开头</li>
 * </ul>
 *
 * @author minikv
 * @since 1.0.0
 */
public abstract class Resp {
    /** 行结束符 */
    public static final byte[] CRLF = "\r\n".getBytes(StandardCharsets.US_ASCII);

    /** 数字的字节表示缓存 */
    protected static final byte[][] NUMBERS = new byte[256][];

    /** 最大缓存数字 */
    protected static final int MAX_CACHED_NUMBER = 255;

    static final int PROTO_MAX_BULK_LEN = 512 * 1024 * 1024; // 最大 512MB
    static final int PROTO_MAX_ARRAY_LEN = 1024 * 1024;
    static final int PROTO_MAX_LINE_LEN = 64 * 1024;
    static final int PROTO_MAX_NESTING_DEPTH = 128;

    /** 数组预分配的容量上限，元素超过此数时随解析逐步扩容 */
    private static final int ARRAY_INITIAL_CAPACITY_LIMIT = 1024;

    static {
        for (int i = 0; i <= MAX_CACHED_NUMBER; i++) {
            NUMBERS[i] = String.valueOf(i).getBytes(StandardCharsets.US_ASCII);
        }
    }

    /**
     * 写入非负整数的十进制表示，小数字使用缓存
     *
     * @param buf 目标缓冲区
     * @param value 要写入的整数值
     */
    protected static void writeIntegerAsBytes(ByteBuf buf, int value) {
        if (value >= 0 && value <= MAX_CACHED_NUMBER) {
            buf.writeBytes(NUMBERS[value]);
        } else {
            buf.writeBytes(String.valueOf(value).getBytes(StandardCharsets.US_ASCII));
        }
    }

    /**
     * RESP 协议解码方法
     * 支持的类型：
     * - SimpleString "+OK\r\n"
     * - Errors "-Error message\r\n"
     * - BulkString "$6\r\nfoobar\r\n"，"$-1\r\n" 解码为 {@link RespNull}
     * - RespArray "*2\r\n$3\r\nfoo\r\n$3\r\nbar\r\n"
     *
     * @param buffer 输入缓冲区
     * @return 解码后的 Resp 对象；如果缓冲区中还没有一个完整的值，返回null并恢复读索引
     * @throws RespDecodeException 当数据格式不符合RESP协议规范时
     */
    public static Resp decode(ByteBuf buffer) {
        if (!buffer.isReadable()) {
            return null;
        }

        // 保存初始读索引，数据不完整或出错时回滚
        final int initialIndex = buffer.readerIndex();
        try {
            return readValue(buffer, 0);
        } catch (IllegalStateException e) {
            buffer.readerIndex(initialIndex);
            return null;
        } catch (RuntimeException e) {
            buffer.readerIndex(initialIndex);
            throw e;
        }
    }

    private static Resp readValue(ByteBuf buffer, int depth) {
        if (!buffer.isReadable()) {
            throw new IllegalStateException("数据不完整：缺少类型标识");
        }
        final byte typeIndicator = buffer.readByte();
        switch (typeIndicator) {
            case '+':
                return new SimpleString(readLine(buffer));
            case '-':
                return new Errors(readLine(buffer));
            case '$':
                return readBulkString(buffer);
            case '*':
                return readArray(buffer, depth);
            default:
                throw new RespDecodeException("不是有效的RESP类型标识: '" + (char) typeIndicator
                        + "' (字节值: " + (typeIndicator & 0xFF) + ")");
        }
    }

    private static Resp readBulkString(ByteBuf buffer) {
        final int length = readLength(buffer);
        if (length == -1) {
            return RespNull.INSTANCE;
        }
        if (length < 0) {
            throw new RespDecodeException("批量字符串长度非法: " + length);
        }
        if (length > PROTO_MAX_BULK_LEN) {
            throw new RespDecodeException("协议错误：批量字符串的长度超过最大限制 " + PROTO_MAX_BULK_LEN);
        }
        if (buffer.readableBytes() < length + 2) {
            throw new IllegalStateException("数据不完整：BulkString内容长度不足");
        }

        final byte[] content = new byte[length];
        buffer.readBytes(content);
        if (buffer.readByte() != '\r' || buffer.readByte() != '\n') {
            throw new RespDecodeException("BulkString格式错误：期望\\r\\n结尾");
        }
        return BulkString.wrapTrusted(content);
    }

    private static Resp readArray(ByteBuf buffer, int depth) {
        if (depth >= PROTO_MAX_NESTING_DEPTH) {
            throw new RespDecodeException("协议错误：数组嵌套层数超过最大限制 " + PROTO_MAX_NESTING_DEPTH);
        }
        final int number = readLength(buffer);
        if (number < 0) {
            throw new RespDecodeException("数组长度非法: " + number);
        }
        if (number > PROTO_MAX_ARRAY_LEN) {
            throw new RespDecodeException("协议错误：数组的元素数量超过最大限制 " + PROTO_MAX_ARRAY_LEN);
        }
        if (number == 0) {
            return RespArray.EMPTY;
        }

        // 数据不完整时会整体重试，声明的长度不可信，不按它一次性分配
        final List<Resp> elements = new ArrayList<>(Math.min(number, ARRAY_INITIAL_CAPACITY_LIMIT));
        for (int i = 0; i < number; i++) {
            elements.add(readValue(buffer, depth + 1));
        }
        return new RespArray(elements.toArray(new Resp[0]));
    }

    /**
     * 逐字节查找 CR LF，返回去掉行结束符的内容
     *
     * @param buffer 输入缓冲区
     * @return 行内容
     * @throws IllegalStateException 如果还没有收到完整的一行
     */
    static String readLine(ByteBuf buffer) {
        final int startIndex = buffer.readerIndex();
        final int writerIndex = buffer.writerIndex();
        for (int i = startIndex; i + 1 < writerIndex; i++) {
            if (buffer.getByte(i) == '\r' && buffer.getByte(i + 1) == '\n') {
                final String line = buffer.toString(startIndex, i - startIndex, StandardCharsets.UTF_8);
                buffer.readerIndex(i + 2);
                return line;
            }
        }
        if (writerIndex - startIndex > PROTO_MAX_LINE_LEN) {
            throw new RespDecodeException("协议错误：行长度超过最大限制 " + PROTO_MAX_LINE_LEN);
        }
        throw new IllegalStateException("数据不完整：没有找到换行符");
    }

    /**
     * 读取一行并按有符号十进制整数解析，用于数组和批量字符串的长度
     *
     * @param buffer 输入缓冲区
     * @return 解析出的长度
     */
    static int readLength(ByteBuf buffer) {
        final String line = readLine(buffer);
        final int length = line.length();
        if (length == 0) {
            throw new RespDecodeException("数字解析错误：长度为0");
        }

        final boolean negative = line.charAt(0) == '-';
        final int start = negative ? 1 : 0;
        if (start == length) {
            throw new RespDecodeException("数字解析错误：只有负号");
        }

        long value = 0;
        for (int i = start; i < length; i++) {
            final char c = line.charAt(i);
            if (c < '0' || c > '9') {
                throw new RespDecodeException("数字解析错误: 包含非数字字符 '" + line + "'");
            }
            value = value * 10 + (c - '0');
            if (value > Integer.MAX_VALUE) {
                throw new RespDecodeException("数字解析错误: 超出范围 '" + line + "'");
            }
        }
        return (int) (negative ? -value : value);
    }

    /**
     * 将当前对象编码为RESP格式并写入缓冲区
     *
     * @param byteBuf 输出缓冲区
     */
    public abstract void encode(ByteBuf byteBuf);
}
