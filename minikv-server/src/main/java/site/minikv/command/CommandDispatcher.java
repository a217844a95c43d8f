package site.minikv.command;

import lombok.extern.slf4j.Slf4j;
import site.minikv.protocol.BulkString;
import site.minikv.protocol.Resp;
import site.minikv.server.context.KvContext;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 命令分发器，负责把命令名映射到命令实例并执行。
 *
 * <p>该类的主要职责：
 * <ul>
 *   <li>启动时为每个命令类型创建一个共享的命令实例
 *   <li>按名称查找命令，未知命令返回null，由调用方决定如何回复
 *   <li>执行命令，任何意外异常都转换为错误回复，不会越过分发器
 * </ul>
 *
 * <p>分发器本身不持有数据，所有状态都在{@link KvContext}的存储中。
 *
 * @author minikv
 * @since 1.0
 */
@Slf4j
public class CommandDispatcher {

    private final Map<CommandType, Command> commands;

    public CommandDispatcher(final KvContext context) {
        final Map<CommandType, Command> created = new EnumMap<>(CommandType.class);
        for (final CommandType type : CommandType.values()) {
            created.put(type, type.createCommand(context));
        }
        this.commands = Collections.unmodifiableMap(created);
        log.info("命令分发器初始化完成，支持命令: {}", commands.keySet());
    }

    /**
     * 按名称查找命令，大小写不敏感。
     *
     * @param commandName 命令名称
     * @return 命令实例，未知命令返回null
     */
    public Command findCommand(final String commandName) {
        final CommandType type = CommandType.findByName(commandName);
        return type == null ? null : commands.get(type);
    }

    /**
     * 执行命令。
     *
     * @param command 通过{@link #findCommand(String)}得到的命令
     * @param args 命令参数，不包含命令名
     * @return 执行结果，失败时为错误回复
     */
    public Resp execute(final Command command, final List<BulkString> args) {
        try {
            return command.handle(args);
        } catch (RuntimeException e) {
            log.error("命令执行失败: {}", command.getType(), e);
            return CommandErrors.internalError(command.getType());
        }
    }
}
