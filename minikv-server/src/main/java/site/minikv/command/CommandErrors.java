package site.minikv.command;

import site.minikv.protocol.Errors;

import java.util.Locale;

/**
 * 命令层错误回复的统一构造。
 *
 * <p>错误分类：
 * <ul>
 *   <li>参数数量错误 - 消息中带有命令名
 *   <li>语法错误 - 未知选项或选项缺少取值
 *   <li>类型错误 - 选项取值不是合法的正整数
 * </ul>
 */
public final class CommandErrors {

    public static final Errors SYNTAX_ERROR = new Errors("ERR syntax error");

    public static final Errors NOT_INTEGER = new Errors("ERR value is not an integer or out of range");

    public static final Errors INVALID_REQUEST =
            new Errors("ERR Protocol error: expected a non-empty array of bulk strings");

    /** 错误消息中回显的命令名最大长度 */
    static final int MAX_ECHOED_NAME_LENGTH = 128;

    private CommandErrors() {
    }

    public static Errors wrongArity(final CommandType type) {
        return new Errors("ERR wrong number of arguments for '" + lowerName(type) + "' command");
    }

    public static Errors invalidExpireTime(final CommandType type) {
        return new Errors("ERR invalid expire time in '" + lowerName(type) + "' command");
    }

    /**
     * 命令名来自客户端，可能包含换行，写入错误行之前替换为空格并截断，
     * 保证一个请求只产生一行错误回复。
     *
     * @param commandName 客户端发送的命令名
     * @return 错误回复
     */
    public static Errors unknownCommand(final String commandName) {
        return new Errors("ERR unknown command '" + sanitize(commandName) + "'");
    }

    public static Errors internalError(final CommandType type) {
        return new Errors("ERR internal error while executing '" + lowerName(type) + "'");
    }

    static String sanitize(final String text) {
        final String truncated = text.length() > MAX_ECHOED_NAME_LENGTH
                ? text.substring(0, MAX_ECHOED_NAME_LENGTH) : text;
        return truncated.replace('\r', ' ').replace('\n', ' ');
    }

    private static String lowerName(final CommandType type) {
        return type.getCommandName().toLowerCase(Locale.ROOT);
    }
}
