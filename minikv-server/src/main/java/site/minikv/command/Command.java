package site.minikv.command;

import site.minikv.protocol.BulkString;
import site.minikv.protocol.Resp;
import site.minikv.protocol.RespNull;
import site.minikv.store.KvBytes;

import java.util.List;

/**
 * 命令接口，定义了所有命令的基本行为。
 *
 * <p>命令实例在启动时由{@link CommandDispatcher}为每个{@link CommandType}创建一次，
 * 之后被所有连接共享，因此实现类必须是无状态且线程安全的，
 * 所有数据都保存在注入的存储对象中。
 *
 * <p>实现要求：
 * <ul>
 *   <li>参数校验失败、选项非法等情况以{@link site.minikv.protocol.Errors}返回，不抛出异常
 *   <li>校验失败时不能修改存储
 * </ul>
 *
 * @author minikv
 * @since 1.0
 */
public interface Command {

    /**
     * 获取命令类型。
     *
     * @return 命令类型枚举值
     */
    CommandType getType();

    /**
     * 执行命令并返回结果。
     *
     * @param args 命令参数，不包含命令名本身
     * @return RESP协议格式的执行结果
     */
    Resp handle(List<BulkString> args);

    /**
     * 把参数转换为存储使用的字节串，字节原样保留。
     *
     * @param arg 命令参数
     * @return 字节串
     */
    static KvBytes toKvBytes(BulkString arg) {
        // getContent() 返回的已是副本
        return KvBytes.wrapTrusted(arg.getContent());
    }

    /**
     * 把存储中的值转换为回复，值不存在时回复空值。
     *
     * @param value 存储中的值，可以为null
     * @return 批量字符串或{@link RespNull}
     */
    static Resp toBulkReply(KvBytes value) {
        return value == null ? RespNull.INSTANCE : BulkString.wrapTrusted(value.getBytesUnsafe());
    }
}
