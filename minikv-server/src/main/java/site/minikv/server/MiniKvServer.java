package site.minikv.server;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.util.concurrent.DefaultEventExecutorGroup;
import io.netty.util.concurrent.DefaultThreadFactory;
import io.netty.util.concurrent.EventExecutorGroup;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import site.minikv.command.CommandDispatcher;
import site.minikv.protocol.handler.RespDecoder;
import site.minikv.protocol.handler.RespEncoder;
import site.minikv.server.config.KvServerConfig;
import site.minikv.server.context.KvContext;
import site.minikv.server.handler.RespCommandHandler;

import java.net.InetSocketAddress;

/**
 * 基于Netty的服务器实现。
 *
 * <p>线程模型：
 * <ul>
 *   <li>boss线程组接受连接，worker线程组负责I/O和编解码
 *   <li>命令在独立的执行器线程组中执行，每个连接固定在其中一个线程上，
 *       同一连接上的请求按顺序处理，不同连接之间并行
 *   <li>所有共享状态都在{@link KvContext}的存储中，由存储自身加锁
 * </ul>
 *
 * @author minikv
 * @since 1.0
 */
@Slf4j
@Getter
public class MiniKvServer implements KvServer {

    /** 服务器配置 */
    private final KvServerConfig config;

    /** 服务器上下文 */
    private final KvContext context;

    /** 命令分发器，所有连接共享 */
    private final CommandDispatcher dispatcher;

    /** 接收连接的事件循环组 */
    private EventLoopGroup bossGroup;

    /** 处理I/O的事件循环组 */
    private EventLoopGroup workerGroup;

    /** 命令执行线程池 */
    private EventExecutorGroup commandExecutor;

    /** 服务器Channel */
    private Channel serverChannel;

    public MiniKvServer(final KvServerConfig config) {
        this(config, new KvContext());
    }

    public MiniKvServer(final KvServerConfig config, final KvContext context) {
        config.validate();
        this.config = config;
        this.context = context;
        this.dispatcher = new CommandDispatcher(context);
    }

    @Override
    public synchronized void start() {
        if (serverChannel != null) {
            throw new IllegalStateException("服务器已经在运行");
        }
        bossGroup = new NioEventLoopGroup(config.getBossThreadCount(), new DefaultThreadFactory("nio-boss"));
        workerGroup = new NioEventLoopGroup(config.getWorkerThreadCount(), new DefaultThreadFactory("nio-worker"));
        commandExecutor = new DefaultEventExecutorGroup(config.getCommandExecutorThreadCount(),
                new DefaultThreadFactory("minikv-cmd"));

        final ServerBootstrap serverBootstrap = new ServerBootstrap();
        serverBootstrap.group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                .option(ChannelOption.SO_BACKLOG, config.getBacklogSize())
                .childOption(ChannelOption.SO_KEEPALIVE, true)
                .childOption(ChannelOption.TCP_NODELAY, true)
                .childOption(ChannelOption.SO_RCVBUF, config.getReceiveBufferSize())
                .childOption(ChannelOption.SO_SNDBUF, config.getSendBufferSize())
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        final ChannelPipeline pipeline = ch.pipeline();
                        pipeline.addLast(new RespDecoder());
                        pipeline.addLast(new RespEncoder());
                        pipeline.addLast(commandExecutor, new RespCommandHandler(dispatcher));
                    }
                });
        try {
            serverChannel = serverBootstrap.bind(config.getHost(), config.getPort()).sync().channel();
            log.info("mini-kv 服务器已启动: {}:{}", config.getHost(), getPort());
        } catch (InterruptedException e) {
            log.error("服务器启动被中断", e);
            stop();
            Thread.currentThread().interrupt();
        } catch (Exception e) {
            // 绑定失败（如端口被占用）时释放已创建的线程组，避免残留的非守护线程
            log.error("服务器启动失败: {}:{}", config.getHost(), config.getPort(), e);
            stop();
            throw new IllegalStateException("服务器启动失败: " + config.getHost() + ":" + config.getPort(), e);
        }
    }

    @Override
    public synchronized void stop() {
        try {
            if (serverChannel != null) {
                serverChannel.close().sync();
            }
            if (workerGroup != null) {
                workerGroup.shutdownGracefully().sync();
            }
            if (bossGroup != null) {
                bossGroup.shutdownGracefully().sync();
            }
            if (commandExecutor != null) {
                commandExecutor.shutdownGracefully().sync();
            }
            log.info("mini-kv 服务器已停止");
        } catch (InterruptedException e) {
            log.error("服务器停止被中断", e);
            Thread.currentThread().interrupt();
        } finally {
            serverChannel = null;
            workerGroup = null;
            bossGroup = null;
            commandExecutor = null;
        }
    }

    @Override
    public int getPort() {
        if (serverChannel == null) {
            throw new IllegalStateException("服务器未启动");
        }
        return ((InetSocketAddress) serverChannel.localAddress()).getPort();
    }
}
