package site.minikv.store;

/**
 * 毫秒时间来源，过期判断统一经由此接口取当前时间，测试中可替换为可控时钟。
 */
@FunctionalInterface
public interface TimeSource {

    /** 系统时钟 */
    TimeSource SYSTEM = System::currentTimeMillis;

    /**
     * @return 当前时间（Unix毫秒）
     */
    long currentTimeMillis();
}
