package site.minikv.command.impl.hash;

import site.minikv.command.Command;
import site.minikv.command.CommandErrors;
import site.minikv.command.CommandType;
import site.minikv.protocol.BulkString;
import site.minikv.protocol.Resp;
import site.minikv.protocol.SimpleString;
import site.minikv.server.context.KvContext;
import site.minikv.store.HashStore;

import java.util.List;

public class Hset implements Command {
    private final HashStore hashStore;

    public Hset(KvContext context) {
        this.hashStore = context.getHashStore();
    }

    @Override
    public CommandType getType() {
        return CommandType.HSET;
    }

    @Override
    public Resp handle(List<BulkString> args) {
        if (args.size() != 3) {
            return CommandErrors.wrongArity(getType());
        }
        hashStore.hset(Command.toKvBytes(args.get(0)),
                Command.toKvBytes(args.get(1)),
                Command.toKvBytes(args.get(2)));
        return SimpleString.OK;
    }
}
