package site.minikv.command.impl.string;

import site.minikv.command.Command;
import site.minikv.command.CommandErrors;
import site.minikv.command.CommandType;
import site.minikv.protocol.BulkString;
import site.minikv.protocol.Resp;
import site.minikv.server.context.KvContext;
import site.minikv.store.KeyValueStore;

import java.util.List;

public class Get implements Command {
    private final KeyValueStore keyValueStore;

    public Get(KvContext context) {
        this.keyValueStore = context.getKeyValueStore();
    }

    @Override
    public CommandType getType() {
        return CommandType.GET;
    }

    @Override
    public Resp handle(List<BulkString> args) {
        if (args.size() != 1) {
            return CommandErrors.wrongArity(getType());
        }
        return Command.toBulkReply(keyValueStore.get(Command.toKvBytes(args.get(0))));
    }
}
