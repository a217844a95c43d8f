package site.minikv.command.impl;

import site.minikv.command.Command;
import site.minikv.command.CommandType;
import site.minikv.protocol.BulkString;
import site.minikv.protocol.Resp;
import site.minikv.protocol.SimpleString;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;

/**
 * PING [message]
 *
 * <p>不带参数时回复PONG，否则把第一个参数作为简单字符串回复，多余的参数被忽略。
 * 简单字符串不能包含换行，也只能承载文本：参数中含有CR或LF，
 * 或不是合法的UTF-8时，原样以批量字符串回复。
 */
public class Ping implements Command {

    @Override
    public CommandType getType() {
        return CommandType.PING;
    }

    @Override
    public Resp handle(List<BulkString> args) {
        if (args.isEmpty()) {
            return SimpleString.PONG;
        }
        final BulkString message = args.get(0);
        final String content = message.getString();
        if (content.indexOf('\r') >= 0 || content.indexOf('\n') >= 0
                || !Arrays.equals(content.getBytes(StandardCharsets.UTF_8), message.getContent())) {
            return message;
        }
        return SimpleString.valueOf(content);
    }
}
