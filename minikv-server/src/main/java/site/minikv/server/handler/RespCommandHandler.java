package site.minikv.server.handler;

import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import lombok.extern.slf4j.Slf4j;
import site.minikv.command.Command;
import site.minikv.command.CommandDispatcher;
import site.minikv.command.CommandErrors;
import site.minikv.protocol.BulkString;
import site.minikv.protocol.Resp;
import site.minikv.protocol.RespArray;

import java.util.ArrayList;
import java.util.List;

/**
 * 命令处理器，负责校验客户端请求、分发命令并写回响应。
 *
 * <p>处理流程：
 * <ul>
 *   <li>校验请求是由批量字符串组成的非空数组，否则回复协议错误，连接保持
 *   <li>按命令名查找命令，未知命令回复"unknown command"错误
 *   <li>执行命令并写回结果，每个请求恰好一个回复
 * </ul>
 *
 * <p>解码层面的错误由{@link site.minikv.protocol.handler.RespDecoder}处理并关闭连接，
 * 不会到达这里。
 *
 * @author minikv
 * @since 1.0
 */
@Slf4j
public class RespCommandHandler extends SimpleChannelInboundHandler<Resp> {

    private final CommandDispatcher dispatcher;

    public RespCommandHandler(final CommandDispatcher dispatcher) {
        if (dispatcher == null) {
            throw new IllegalArgumentException("命令分发器不能为null");
        }
        this.dispatcher = dispatcher;
    }

    @Override
    public void channelActive(ChannelHandlerContext ctx) throws Exception {
        log.debug("客户端连接建立: {}", ctx.channel().remoteAddress());
        super.channelActive(ctx);
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, Resp msg) {
        final Resp response = executeCommand(msg);
        if (!ctx.channel().isActive()) {
            log.debug("Channel 已关闭，跳过响应发送");
            return;
        }
        ctx.writeAndFlush(response);
    }

    /**
     * 执行一个已解码的请求并返回响应，不涉及网络写入。
     *
     * @param request 解码后的请求
     * @return 响应
     */
    public Resp executeCommand(final Resp request) {
        final List<BulkString> parts = toBulkStrings(request);
        if (parts == null) {
            log.debug("无效请求: {}", request);
            return CommandErrors.INVALID_REQUEST;
        }

        final String commandName = parts.get(0).getString();
        final Command command = dispatcher.findCommand(commandName);
        if (command == null) {
            log.debug("未知命令: {}", commandName);
            return CommandErrors.unknownCommand(commandName);
        }
        return dispatcher.execute(command, parts.subList(1, parts.size()));
    }

    private static List<BulkString> toBulkStrings(final Resp request) {
        if (!(request instanceof RespArray)) {
            return null;
        }
        final RespArray array = (RespArray) request;
        if (array.size() == 0) {
            return null;
        }
        final List<BulkString> parts = new ArrayList<>(array.size());
        for (final Resp element : array.getContent()) {
            if (!(element instanceof BulkString)) {
                return null;
            }
            parts.add((BulkString) element);
        }
        return parts;
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        log.debug("客户端连接关闭: {}", ctx.channel().remoteAddress());
        super.channelInactive(ctx);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.error("连接异常: {}", cause.getMessage(), cause);
        ctx.close();
    }
}
