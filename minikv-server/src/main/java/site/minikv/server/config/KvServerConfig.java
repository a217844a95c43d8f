package site.minikv.server.config;

import lombok.Builder;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * 服务器配置类，统一管理网络和线程参数。
 *
 * <p>配置来源按以下顺序叠加，后者覆盖前者：
 * <ul>
 *   <li>Builder默认值
 *   <li>classpath中的 {@value #DEFAULT_RESOURCE}
 *   <li>同名的JVM系统属性（-Dminikv.port=6380）
 *   <li>启动参数 --host / --port
 * </ul>
 *
 * @author minikv
 * @since 1.0.0
 */
@Slf4j
@Data
@Builder
public class KvServerConfig {

    /** 默认配置文件 */
    public static final String DEFAULT_RESOURCE = "minikv.properties";

    static final String KEY_HOST = "minikv.host";
    static final String KEY_PORT = "minikv.port";
    static final String KEY_BACKLOG = "minikv.backlog-size";
    static final String KEY_RCVBUF = "minikv.receive-buffer-size";
    static final String KEY_SNDBUF = "minikv.send-buffer-size";
    static final String KEY_BOSS_THREADS = "minikv.boss-threads";
    static final String KEY_WORKER_THREADS = "minikv.worker-threads";
    static final String KEY_COMMAND_THREADS = "minikv.command-threads";

    // ========== 网络配置 ==========

    /**
     * 服务器监听地址。
     *
     * <p>127.0.0.1仅本机访问，0.0.0.0允许所有网络访问。
     */
    @Builder.Default
    private String host = "127.0.0.1";

    /** 服务器监听端口，0表示由系统分配 */
    @Builder.Default
    private int port = 6379;

    /** TCP连接队列大小 */
    @Builder.Default
    private int backlogSize = 1024;

    /** 接收缓冲区大小（字节） */
    @Builder.Default
    private int receiveBufferSize = 32 * 1024;

    /** 发送缓冲区大小（字节） */
    @Builder.Default
    private int sendBufferSize = 32 * 1024;

    // ========== 线程配置 ==========

    /** Boss线程组大小（接受连接），通常为1 */
    @Builder.Default
    private int bossThreadCount = 1;

    /** Worker线程组大小（处理I/O） */
    @Builder.Default
    private int workerThreadCount = Runtime.getRuntime().availableProcessors() * 2;

    /**
     * 命令执行线程数。
     *
     * <p>每个连接固定在其中一个线程上执行命令，不同连接的命令可以并行；
     * 存储自身保证线程安全。
     */
    @Builder.Default
    private int commandExecutorThreadCount = Runtime.getRuntime().availableProcessors();

    /**
     * 创建默认配置。
     *
     * @return 默认配置实例
     */
    public static KvServerConfig defaultConfig() {
        return KvServerConfig.builder().build();
    }

    /**
     * 按"默认值 → 配置文件 → 系统属性 → 启动参数"的顺序加载配置。
     *
     * @param args 启动参数，支持 --host &lt;host&gt; 和 --port &lt;port&gt;
     * @return 校验通过的配置
     * @throws IllegalArgumentException 配置项非法或启动参数无法识别时
     */
    public static KvServerConfig load(final String[] args) {
        final Properties properties = new Properties();
        try (InputStream in = KvServerConfig.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in != null) {
                properties.load(in);
                log.info("已加载配置文件: {}", DEFAULT_RESOURCE);
            }
        } catch (IOException e) {
            throw new IllegalArgumentException("读取配置文件失败: " + DEFAULT_RESOURCE, e);
        }
        for (final String name : System.getProperties().stringPropertyNames()) {
            if (name.startsWith("minikv.")) {
                properties.setProperty(name, System.getProperty(name));
            }
        }
        applyArguments(properties, args);

        final KvServerConfig config = fromProperties(properties);
        config.validate();
        return config;
    }

    /**
     * 从属性集合构建配置，缺失的键使用默认值。
     *
     * @param properties 属性集合
     * @return 配置实例（未校验）
     */
    public static KvServerConfig fromProperties(final Properties properties) {
        final KvServerConfig config = defaultConfig();
        config.setHost(properties.getProperty(KEY_HOST, config.getHost()).trim());
        config.setPort(intProperty(properties, KEY_PORT, config.getPort()));
        config.setBacklogSize(intProperty(properties, KEY_BACKLOG, config.getBacklogSize()));
        config.setReceiveBufferSize(intProperty(properties, KEY_RCVBUF, config.getReceiveBufferSize()));
        config.setSendBufferSize(intProperty(properties, KEY_SNDBUF, config.getSendBufferSize()));
        config.setBossThreadCount(intProperty(properties, KEY_BOSS_THREADS, config.getBossThreadCount()));
        config.setWorkerThreadCount(intProperty(properties, KEY_WORKER_THREADS, config.getWorkerThreadCount()));
        config.setCommandExecutorThreadCount(
                intProperty(properties, KEY_COMMAND_THREADS, config.getCommandExecutorThreadCount()));
        return config;
    }

    static void applyArguments(final Properties properties, final String[] args) {
        if (args == null) {
            return;
        }
        for (int i = 0; i < args.length; i++) {
            final String arg = args[i];
            final String key;
            if ("--host".equals(arg)) {
                key = KEY_HOST;
            } else if ("--port".equals(arg)) {
                key = KEY_PORT;
            } else {
                throw new IllegalArgumentException("无法识别的启动参数: " + arg);
            }
            if (i + 1 >= args.length) {
                throw new IllegalArgumentException("启动参数缺少取值: " + arg);
            }
            properties.setProperty(key, args[++i]);
        }
    }

    private static int intProperty(final Properties properties, final String key, final int defaultValue) {
        final String raw = properties.getProperty(key);
        if (raw == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("配置项 " + key + " 不是合法的整数: " + raw, e);
        }
    }

    /**
     * 验证配置参数的合法性
     *
     * @throws IllegalArgumentException 如果配置参数无效
     */
    public void validate() {
        if (host == null || host.trim().isEmpty()) {
            throw new IllegalArgumentException("监听地址不能为空");
        }

        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("端口号必须在0-65535范围内");
        }

        if (bossThreadCount <= 0 || workerThreadCount <= 0 || commandExecutorThreadCount <= 0) {
            throw new IllegalArgumentException("线程数量必须大于0");
        }

        if (backlogSize <= 0 || receiveBufferSize <= 0 || sendBufferSize <= 0) {
            throw new IllegalArgumentException("缓冲区大小必须大于0");
        }
    }
}
