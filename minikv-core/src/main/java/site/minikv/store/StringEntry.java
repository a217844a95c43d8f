package site.minikv.store;

import lombok.Getter;
import lombok.ToString;

/**
 * 字符串键对应的不可变条目，值与过期时间绑定在一起。
 *
 * <p>覆盖写入时整体替换条目，因此值和过期时间总是一起生效，
 * 不存在"新值配旧TTL"的中间状态。
 *
 * @author minikv
 * @since 1.0.0
 */
@Getter
@ToString
public final class StringEntry {
    /** 表示没有过期时间 */
    public static final long NO_EXPIRE = -1L;

    private final KvBytes value;

    /** 绝对过期时间（Unix毫秒），{@link #NO_EXPIRE}表示永不过期 */
    private final long expireAt;

    private StringEntry(KvBytes value, long expireAt) {
        this.value = value;
        this.expireAt = expireAt;
    }

    public static StringEntry persistent(KvBytes value) {
        return new StringEntry(value, NO_EXPIRE);
    }

    public static StringEntry expiring(KvBytes value, long expireAt) {
        if (expireAt < 0) {
            throw new IllegalArgumentException("过期时间不能为负: " + expireAt);
        }
        return new StringEntry(value, expireAt);
    }

    public boolean hasExpire() {
        return expireAt != NO_EXPIRE;
    }

    /**
     * 过期时间小于等于当前时间即视为已过期
     *
     * @param now 当前时间（Unix毫秒）
     * @return 是否已过期
     */
    public boolean isExpired(long now) {
        return hasExpire() && expireAt <= now;
    }
}
