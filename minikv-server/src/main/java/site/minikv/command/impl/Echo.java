package site.minikv.command.impl;

import site.minikv.command.Command;
import site.minikv.command.CommandErrors;
import site.minikv.command.CommandType;
import site.minikv.protocol.BulkString;
import site.minikv.protocol.Resp;

import java.util.List;

public class Echo implements Command {

    @Override
    public CommandType getType() {
        return CommandType.ECHO;
    }

    @Override
    public Resp handle(List<BulkString> args) {
        if (args.size() != 1) {
            return CommandErrors.wrongArity(getType());
        }
        return args.get(0);
    }
}
