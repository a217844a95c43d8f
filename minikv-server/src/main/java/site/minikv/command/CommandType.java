package site.minikv.command;

import lombok.Getter;
import site.minikv.command.impl.Echo;
import site.minikv.command.impl.Ping;
import site.minikv.command.impl.hash.Hget;
import site.minikv.command.impl.hash.Hset;
import site.minikv.command.impl.string.Get;
import site.minikv.command.impl.string.Set;
import site.minikv.server.context.KvContext;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * 命令类型枚举，定义了系统支持的所有命令。
 *
 * <p>命令名匹配大小写不敏感：查找前统一转换为大写。
 *
 * @author minikv
 * @since 1.0
 */
@Getter
public enum CommandType {
    // ========== 连接命令 ==========
    /** PING命令：测试服务器连接 */
    PING("PING"),
    /** ECHO命令：原样返回参数 */
    ECHO("ECHO"),

    // ========== 字符串命令 ==========
    /** SET命令：设置键值对，可带PX/EX过期时间 */
    SET("SET"),
    /** GET命令：获取键值 */
    GET("GET"),

    // ========== 哈希命令 ==========
    /** HSET命令：设置哈希字段 */
    HSET("HSET"),
    /** HGET命令：获取哈希字段 */
    HGET("HGET");

    /** 命令名称（大写） */
    private final String commandName;

    /** 命令查找缓存 */
    private static final Map<String, CommandType> COMMAND_CACHE = new HashMap<>();

    static {
        for (final CommandType type : CommandType.values()) {
            COMMAND_CACHE.put(type.commandName, type);
        }
    }

    CommandType(final String commandName) {
        this.commandName = commandName;
    }

    /**
     * 根据命令名称查找命令类型，大小写不敏感。
     *
     * @param commandName 命令名称
     * @return 对应的CommandType，如果不存在则返回null
     */
    public static CommandType findByName(final String commandName) {
        if (commandName == null || commandName.isEmpty()) {
            return null;
        }
        return COMMAND_CACHE.get(commandName.toUpperCase(Locale.ROOT));
    }

    /**
     * 使用上下文创建命令实例。
     *
     * @param context 存储上下文
     * @return 命令实例
     */
    public Command createCommand(final KvContext context) {
        switch (this) {
            case PING:
                return new Ping();
            case ECHO:
                return new Echo();
            case SET:
                return new Set(context);
            case GET:
                return new Get(context);
            case HSET:
                return new Hset(context);
            case HGET:
                return new Hget(context);
            default:
                throw new IllegalArgumentException("不支持的命令类型: " + this);
        }
    }
}
