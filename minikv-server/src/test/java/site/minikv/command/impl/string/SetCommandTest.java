package site.minikv.command.impl.string;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import site.minikv.protocol.BulkString;
import site.minikv.protocol.Errors;
import site.minikv.protocol.Resp;
import site.minikv.protocol.RespNull;
import site.minikv.protocol.SimpleString;
import site.minikv.server.context.KvContext;
import site.minikv.store.HashStore;
import site.minikv.store.KeyValueStore;
import site.minikv.store.KvBytes;
import site.minikv.store.TimeSource;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;

class SetCommandTest {

    private static final long START = 1_000_000L;

    private final AtomicLong now = new AtomicLong(START);

    private KeyValueStore store;
    private Set set;
    private Get get;

    @BeforeEach
    void setUp() {
        TimeSource clock = now::get;
        store = new KeyValueStore(clock);
        KvContext context = new KvContext(store, new HashStore());
        set = new Set(context);
        get = new Get(context);
    }

    private static KvBytes bytes(String s) {
        return KvBytes.fromString(s);
    }

    private static List<BulkString> args(String... parts) {
        List<BulkString> list = new ArrayList<>();
        for (String part : parts) {
            list.add(BulkString.fromString(part));
        }
        return list;
    }

    private static String errorOf(Resp response) {
        assertThat(response).isInstanceOf(Errors.class);
        return ((Errors) response).getContent();
    }

    @Test
    void testSetWithoutOptions() {
        assertThat(set.handle(args("k", "v"))).isEqualTo(SimpleString.OK);
        assertThat(store.get(bytes("k"))).isEqualTo(bytes("v"));
        assertThat(store.getExpireAt(bytes("k"))).isNull();
    }

    @Test
    void testPxExpiresKey() {
        assertThat(set.handle(args("k", "v", "PX", "100"))).isEqualTo(SimpleString.OK);
        assertThat(store.getExpireAt(bytes("k"))).isEqualTo(START + 100);

        now.addAndGet(99);
        assertThat(get.handle(args("k"))).isEqualTo(BulkString.fromString("v"));

        now.addAndGet(1);
        assertThat(get.handle(args("k"))).isSameAs(RespNull.INSTANCE);
        assertThat(store.containsKey(bytes("k"))).isFalse();
    }

    @Test
    void testExUsesSeconds() {
        set.handle(args("k", "v", "ex", "10"));
        assertThat(store.getExpireAt(bytes("k"))).isEqualTo(START + 10_000);
    }

    @Test
    void testFarFutureExpiryKeepsKey() {
        set.handle(args("k", "v", "EX", "100000"));
        now.addAndGet(60_000);
        assertThat(get.handle(args("k"))).isEqualTo(BulkString.fromString("v"));
        assertThat(store.getExpireAt(bytes("k"))).isEqualTo(START + 100_000_000L);
    }

    @Test
    void testOverwriteClearsTtl() {
        set.handle(args("k", "v1", "PX", "50"));
        set.handle(args("k", "v2"));

        assertThat(store.getExpireAt(bytes("k"))).isNull();
        now.addAndGet(1_000);
        assertThat(store.get(bytes("k"))).isEqualTo(bytes("v2"));
    }

    @Test
    void testUnknownOptionIsSyntaxError() {
        assertThat(errorOf(set.handle(args("k", "v", "NX", "1")))).isEqualTo("ERR syntax error");
        assertThat(store.containsKey(bytes("k"))).isFalse();
    }

    @Test
    void testDanglingOptionIsSyntaxError() {
        assertThat(errorOf(set.handle(args("k", "v", "PX")))).isEqualTo("ERR syntax error");
        assertThat(errorOf(set.handle(args("k", "v", "PX", "10", "EX")))).isEqualTo("ERR syntax error");
        assertThat(store.containsKey(bytes("k"))).isFalse();
    }

    @Test
    void testSecondExpiryOptionIsSyntaxError() {
        assertThat(errorOf(set.handle(args("k", "v", "PX", "10", "EX", "1")))).isEqualTo("ERR syntax error");
        assertThat(store.containsKey(bytes("k"))).isFalse();
    }

    @Test
    void testNonIntegerExpiry() {
        assertThat(errorOf(set.handle(args("k", "v", "PX", "abc"))))
                .isEqualTo("ERR value is not an integer or out of range");
        assertThat(errorOf(set.handle(args("k", "v", "EX", "1.5"))))
                .isEqualTo("ERR value is not an integer or out of range");
        assertThat(store.containsKey(bytes("k"))).isFalse();
    }

    @Test
    void testNonPositiveExpiry() {
        assertThat(errorOf(set.handle(args("k", "v", "PX", "0"))))
                .isEqualTo("ERR invalid expire time in 'set' command");
        assertThat(errorOf(set.handle(args("k", "v", "EX", "-5"))))
                .isEqualTo("ERR invalid expire time in 'set' command");
        assertThat(store.containsKey(bytes("k"))).isFalse();
    }

    @Test
    void testOverflowingExpiry() {
        assertThat(errorOf(set.handle(args("k", "v", "EX", String.valueOf(Long.MAX_VALUE / 10)))))
                .isEqualTo("ERR invalid expire time in 'set' command");
        assertThat(errorOf(set.handle(args("k", "v", "PX", String.valueOf(Long.MAX_VALUE)))))
                .isEqualTo("ERR invalid expire time in 'set' command");
        assertThat(store.containsKey(bytes("k"))).isFalse();
    }

    @Test
    void testErrorDoesNotTouchExistingValue() {
        set.handle(args("k", "old"));
        set.handle(args("k", "new", "PX", "bad"));
        assertThat(store.get(bytes("k"))).isEqualTo(bytes("old"));
    }

    @Test
    void testBinaryValueSurvivesSetAndGet() {
        byte[] binary = {(byte) 0xff, (byte) 0xfe};
        List<BulkString> setArgs = new ArrayList<>();
        setArgs.add(BulkString.fromString("k"));
        setArgs.add(BulkString.create(binary));

        assertThat(set.handle(setArgs)).isEqualTo(SimpleString.OK);

        Resp reply = get.handle(args("k"));
        assertThat(reply).isInstanceOf(BulkString.class);
        assertThat(((BulkString) reply).getContent()).containsExactly(binary);
    }
}
