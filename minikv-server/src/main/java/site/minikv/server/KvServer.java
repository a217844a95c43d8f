package site.minikv.server;

import site.minikv.server.context.KvContext;

/**
 * 服务器核心接口，定义了服务器的生命周期管理。
 *
 * <p>实现此接口的类需要确保：
 * <ul>
 *   <li>资源管理：停止时释放线程池和网络连接
 *   <li>数据隔离：每个实例持有自己的{@link KvContext}
 * </ul>
 *
 * @author minikv
 * @since 1.0
 */
public interface KvServer {

    /**
     * 启动服务器并绑定监听地址。
     *
     * @throws IllegalStateException 如果服务器已经在运行，或绑定监听地址失败（此时已创建的线程组会被释放）
     */
    void start();

    /**
     * 停止接受新连接，关闭现有连接并释放线程资源。
     */
    void stop();

    /**
     * 获取实际绑定的端口，配置端口为0时由系统分配。
     *
     * @return 绑定端口
     * @throws IllegalStateException 如果服务器未启动
     */
    int getPort();

    /**
     * @return 服务器上下文，包含本实例的存储
     */
    KvContext getContext();
}
