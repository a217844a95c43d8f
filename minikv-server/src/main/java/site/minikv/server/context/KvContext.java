package site.minikv.server.context;

import lombok.Getter;
import site.minikv.store.HashStore;
import site.minikv.store.KeyValueStore;

/**
 * 服务器上下文，持有一个服务器实例的全部存储。
 *
 * <p>每个服务器实例创建一个上下文并以引用传给命令分发器，
 * 不同实例之间的数据互不可见。
 *
 * @author minikv
 * @since 1.0
 */
@Getter
public class KvContext {

    /** 字符串键值存储 */
    private final KeyValueStore keyValueStore;

    /** 哈希存储 */
    private final HashStore hashStore;

    public KvContext() {
        this(new KeyValueStore(), new HashStore());
    }

    public KvContext(final KeyValueStore keyValueStore, final HashStore hashStore) {
        if (keyValueStore == null || hashStore == null) {
            throw new IllegalArgumentException("存储不能为null");
        }
        this.keyValueStore = keyValueStore;
        this.hashStore = hashStore;
    }
}
