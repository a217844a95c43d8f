package site.minikv.store;

import lombok.extern.slf4j.Slf4j;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * 字符串键值存储，支持按键设置过期时间。
 *
 * <p>过期策略为惰性删除：不做后台扫描，读到已过期的条目时才把它删除。
 *
 * <h2>线程安全设计：</h2>
 * <ul>
 *     <li>值与过期时间合并为一个{@link StringEntry}，由同一把读写锁保护，不存在锁顺序问题</li>
 *     <li>读操作持有读锁，多个读者可以并发</li>
 *     <li>写操作以及惰性删除持有写锁</li>
 *     <li>读锁不能升级为写锁，惰性删除先释放读锁，再在写锁下确认条目未被替换后删除</li>
 * </ul>
 *
 * <p>键和值都是{@link KvBytes}，按字节原样保存，不做字符集转换。
 *
 * <p>每个服务器实例持有自己的存储对象，不使用全局状态。
 *
 * @author minikv
 * @since 1.0.0
 */
@Slf4j
public class KeyValueStore {

    private final Map<KvBytes, StringEntry> entries = new HashMap<>();

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    private final TimeSource timeSource;

    public KeyValueStore() {
        this(TimeSource.SYSTEM);
    }

    public KeyValueStore(TimeSource timeSource) {
        this.timeSource = timeSource;
    }

    /**
     * 设置值并清除原有的过期时间
     *
     * @param key 键
     * @param value 值
     */
    public void set(KvBytes key, KvBytes value) {
        put(key, StringEntry.persistent(value));
    }

    /**
     * 设置值，并在 ttlMillis 毫秒后过期
     *
     * @param key 键
     * @param value 值
     * @param ttlMillis 存活时间（毫秒），必须为正数
     * @throws IllegalArgumentException 如果ttl不是正数或换算出的过期时间溢出
     */
    public void set(KvBytes key, KvBytes value, long ttlMillis) {
        if (ttlMillis <= 0) {
            throw new IllegalArgumentException("过期时间必须为正数: " + ttlMillis);
        }
        final long expireAt;
        try {
            expireAt = Math.addExact(timeSource.currentTimeMillis(), ttlMillis);
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("过期时间溢出: " + ttlMillis, e);
        }
        put(key, StringEntry.expiring(value, expireAt));
    }

    private void put(KvBytes key, StringEntry entry) {
        lock.writeLock().lock();
        try {
            entries.put(key, entry);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * 获取值；已过期的键视为不存在，并在返回前被删除
     *
     * @param key 键
     * @return 值，不存在或已过期时返回null
     */
    public KvBytes get(KvBytes key) {
        final StringEntry entry;
        lock.readLock().lock();
        try {
            entry = entries.get(key);
            if (entry == null) {
                return null;
            }
            if (!entry.isExpired(timeSource.currentTimeMillis())) {
                return entry.getValue();
            }
        } finally {
            lock.readLock().unlock();
        }

        removeExpired(key, entry);
        return null;
    }

    private void removeExpired(KvBytes key, StringEntry expired) {
        lock.writeLock().lock();
        try {
            // 释放读锁到拿到写锁之间，键可能已被重新设置
            if (entries.remove(key, expired)) {
                log.debug("键已过期并被删除: {} (expireAt={})", key, expired.getExpireAt());
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * 键是否仍在存储中，不做过期检查也不会触发删除
     *
     * @param key 键
     * @return 是否存在
     */
    public boolean containsKey(KvBytes key) {
        lock.readLock().lock();
        try {
            return entries.containsKey(key);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * 查看键的绝对过期时间，不做过期检查
     *
     * @param key 键
     * @return 过期时间（Unix毫秒），键不存在或没有过期时间时返回null
     */
    public Long getExpireAt(KvBytes key) {
        lock.readLock().lock();
        try {
            final StringEntry entry = entries.get(key);
            return entry != null && entry.hasExpire() ? entry.getExpireAt() : null;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * @return 存储中的条目数量，包含尚未被惰性删除的过期条目
     */
    public int size() {
        lock.readLock().lock();
        try {
            return entries.size();
        } finally {
            lock.readLock().unlock();
        }
    }
}
