package site.minikv.store;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class HashStoreTest {

    private static KvBytes bytes(String s) {
        return KvBytes.fromString(s);
    }

    private HashStore store;

    @BeforeEach
    void setUp() {
        store = new HashStore();
    }

    @Test
    void testHsetThenHget() {
        store.hset(bytes("h"), bytes("f"), bytes("v"));
        assertThat(store.hget(bytes("h"), bytes("f"))).isEqualTo(bytes("v"));
    }

    @Test
    void testMissingFieldOrHash() {
        store.hset(bytes("h"), bytes("f"), bytes("v"));
        assertThat(store.hget(bytes("h"), bytes("other"))).isNull();
        assertThat(store.hget(bytes("otherhash"), bytes("f"))).isNull();
        assertThat(store.containsHash(bytes("otherhash"))).isFalse();
    }

    @Test
    void testHashCreatedOnFirstWrite() {
        assertThat(store.size()).isZero();
        store.hset(bytes("h"), bytes("f1"), bytes("v1"));
        store.hset(bytes("h"), bytes("f2"), bytes("v2"));
        assertThat(store.containsHash(bytes("h"))).isTrue();
        assertThat(store.size()).isEqualTo(1);
        assertThat(store.hget(bytes("h"), bytes("f1"))).isEqualTo(bytes("v1"));
        assertThat(store.hget(bytes("h"), bytes("f2"))).isEqualTo(bytes("v2"));
    }

    @Test
    void testOverwriteField() {
        store.hset(bytes("h"), bytes("f"), bytes("v1"));
        store.hset(bytes("h"), bytes("f"), bytes("v2"));
        assertThat(store.hget(bytes("h"), bytes("f"))).isEqualTo(bytes("v2"));
    }

    @Test
    void testBinaryFieldAndValue() {
        KvBytes field = KvBytes.of(new byte[]{(byte) 0xc3, (byte) 0x28});
        KvBytes value = KvBytes.of(new byte[]{(byte) 0xff, (byte) 0xfe, 0x00});
        store.hset(bytes("h"), field, value);

        assertThat(store.hget(bytes("h"), KvBytes.of(new byte[]{(byte) 0xc3, (byte) 0x28})).getBytes())
                .containsExactly((byte) 0xff, (byte) 0xfe, (byte) 0x00);
        assertThat(store.hget(bytes("h"), KvBytes.of(new byte[]{(byte) 0xc3, (byte) 0x29}))).isNull();
    }
}
