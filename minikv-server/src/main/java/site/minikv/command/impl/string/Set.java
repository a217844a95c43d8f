package site.minikv.command.impl.string;

import lombok.extern.slf4j.Slf4j;
import site.minikv.command.Command;
import site.minikv.command.CommandErrors;
import site.minikv.command.CommandType;
import site.minikv.protocol.BulkString;
import site.minikv.protocol.Resp;
import site.minikv.protocol.SimpleString;
import site.minikv.server.context.KvContext;
import site.minikv.store.KeyValueStore;
import site.minikv.store.KvBytes;

import java.util.List;
import java.util.Locale;

/**
 * SET key value [PX milliseconds | EX seconds]
 *
 * <p>key、value之后的参数按"选项 取值"成对解析：
 * <ul>
 *   <li>选项不是PX/EX，或缺少取值，或出现第二个过期选项 - 语法错误
 *   <li>取值不是整数 - 类型错误
 *   <li>取值不是正数，或换算后溢出 - 过期时间非法
 * </ul>
 * 任何错误都在写入存储之前返回。不带过期选项的SET会清除键原有的过期时间。
 */
@Slf4j
public class Set implements Command {
    private static final long NO_TTL = -1L;

    private final KeyValueStore keyValueStore;

    public Set(KvContext context) {
        this.keyValueStore = context.getKeyValueStore();
    }

    @Override
    public CommandType getType() {
        return CommandType.SET;
    }

    @Override
    public Resp handle(List<BulkString> args) {
        if (args.size() < 2) {
            return CommandErrors.wrongArity(getType());
        }
        final KvBytes key = Command.toKvBytes(args.get(0));
        final KvBytes value = Command.toKvBytes(args.get(1));

        long ttlMillis = NO_TTL;
        for (int i = 2; i < args.size(); i += 2) {
            final String option = args.get(i).getString().toUpperCase(Locale.ROOT);
            final boolean seconds = "EX".equals(option);
            if (!seconds && !"PX".equals(option)) {
                return CommandErrors.SYNTAX_ERROR;
            }
            if (i + 1 >= args.size() || ttlMillis != NO_TTL) {
                return CommandErrors.SYNTAX_ERROR;
            }

            final long amount;
            try {
                amount = Long.parseLong(args.get(i + 1).getString());
            } catch (NumberFormatException e) {
                return CommandErrors.NOT_INTEGER;
            }
            if (amount <= 0) {
                return CommandErrors.invalidExpireTime(getType());
            }
            try {
                ttlMillis = seconds ? Math.multiplyExact(amount, 1000L) : amount;
            } catch (ArithmeticException e) {
                return CommandErrors.invalidExpireTime(getType());
            }
        }

        if (ttlMillis == NO_TTL) {
            keyValueStore.set(key, value);
            return SimpleString.OK;
        }
        try {
            keyValueStore.set(key, value, ttlMillis);
        } catch (IllegalArgumentException e) {
            log.debug("SET {} 过期时间非法: {}", key, e.getMessage());
            return CommandErrors.invalidExpireTime(getType());
        }
        return SimpleString.OK;
    }
}
