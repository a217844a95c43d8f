package site.minikv.protocol;

/**
 * RESP解码异常
 *
 * <p>表示字节流的帧结构已经不可信（长度字段非法、类型标识未知、结尾缺少CRLF等），
 * 与命令层面的错误回复不同，遇到该异常时应终止当前连接。
 */
public class RespDecodeException extends RuntimeException {

    public RespDecodeException(String message) {
        super(message);
    }
}
