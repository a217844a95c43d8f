package site.minikv.store;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * 哈希存储：hashKey -> (field -> value)。
 *
 * <p>整个存储由一把读写锁保护，对任一哈希的写入会阻塞对其他哈希的读取。
 * 哈希在第一次写入字段时创建，之后不会因为变空而被自动删除。
 * 键、字段和值都按字节原样保存。
 *
 * @author minikv
 * @since 1.0.0
 */
public class HashStore {

    private final Map<KvBytes, Map<KvBytes, KvBytes>> hashes = new HashMap<>();

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    /**
     * 设置哈希字段，哈希不存在时先创建
     *
     * @param hashKey 哈希键
     * @param field 字段
     * @param value 值
     */
    public void hset(KvBytes hashKey, KvBytes field, KvBytes value) {
        lock.writeLock().lock();
        try {
            hashes.computeIfAbsent(hashKey, k -> new HashMap<>()).put(field, value);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * 获取哈希字段
     *
     * @param hashKey 哈希键
     * @param field 字段
     * @return 值，哈希或字段不存在时返回null
     */
    public KvBytes hget(KvBytes hashKey, KvBytes field) {
        lock.readLock().lock();
        try {
            final Map<KvBytes, KvBytes> hash = hashes.get(hashKey);
            return hash == null ? null : hash.get(field);
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean containsHash(KvBytes hashKey) {
        lock.readLock().lock();
        try {
            return hashes.containsKey(hashKey);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * @return 哈希的数量
     */
    public int size() {
        lock.readLock().lock();
        try {
            return hashes.size();
        } finally {
            lock.readLock().unlock();
        }
    }
}
