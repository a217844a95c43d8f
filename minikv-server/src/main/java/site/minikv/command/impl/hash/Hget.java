package site.minikv.command.impl.hash;

import site.minikv.command.Command;
import site.minikv.command.CommandErrors;
import site.minikv.command.CommandType;
import site.minikv.protocol.BulkString;
import site.minikv.protocol.Resp;
import site.minikv.server.context.KvContext;
import site.minikv.store.HashStore;
import site.minikv.store.KvBytes;

import java.util.List;

public class Hget implements Command {
    private final HashStore hashStore;

    public Hget(KvContext context) {
        this.hashStore = context.getHashStore();
    }

    @Override
    public CommandType getType() {
        return CommandType.HGET;
    }

    @Override
    public Resp handle(List<BulkString> args) {
        if (args.size() != 2) {
            return CommandErrors.wrongArity(getType());
        }
        final KvBytes value = hashStore.hget(Command.toKvBytes(args.get(0)), Command.toKvBytes(args.get(1)));
        return Command.toBulkReply(value);
    }
}
