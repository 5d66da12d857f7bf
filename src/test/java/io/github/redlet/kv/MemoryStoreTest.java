package io.github.redlet.kv;

import java.time.Duration;
import java.util.List;
import java.util.SortedMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import com.google.common.collect.ImmutableList;
import io.github.redlet.resp.RespBulkString;
import io.github.redlet.resp.RespData;
import io.github.redlet.resp.RespDouble;
import io.github.redlet.resp.RespSimpleString;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.RepeatedTest;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author zy
 */
class MemoryStoreTest {
    private MemoryStore store;

    @BeforeEach
    void beforeEach() {
        store = new MemoryStore();
    }

    private static RespBulkString bs(String s) {
        return RespBulkString.withUTF8(s);
    }

    @Test
    void getAndSet() {
        assertNull(store.get("foo"));
        store.set("foo", bs("bar"));
        assertEquals(bs("bar"), store.get("foo"));
        store.set("foo", bs("baz"));
        assertEquals(bs("baz"), store.get("foo"));
    }

    @Test
    void keySpacesAreIndependent() throws StoreException {
        store.set("k", bs("v"));
        assertNull(store.hget("k", "f"));
        assertTrue(store.smembers("k").isEmpty());
        assertFalse(store.sismember("k", bs("v")));
    }

    @Test
    void hash() {
        assertNull(store.hget("h", "f1"));
        store.hset("h", "f1", bs("v1"));
        store.hset("h", "f1", bs("v2"));
        assertEquals(bs("v2"), store.hget("h", "f1"));
        assertNull(store.hget("h", "other"));
    }

    @Test
    void hgetAllIsSortedSnapshot() {
        assertTrue(store.hgetAll("h").isEmpty());

        store.hset("h", "zeta", bs("1"));
        store.hset("h", "alpha", bs("2"));
        store.hset("h", "mid", bs("3"));

        SortedMap<String, RespData> all = store.hgetAll("h");
        assertEquals(ImmutableList.of("alpha", "mid", "zeta"), ImmutableList.copyOf(all.keySet()));

        store.hset("h", "beta", bs("4"));
        assertEquals(3, all.size());
    }

    @Test
    void hgetAllOrdersFieldsByUtf8Bytes() {
        // U+FFFD编码为ef bf bd，U+1F600编码为f0 9f 98 80，UTF-16顺序正好相反
        String replacement = "\uFFFD";
        String emoji = new String(Character.toChars(0x1F600));
        store.hset("h", emoji, bs("2"));
        store.hset("h", replacement, bs("1"));
        store.hset("h", "a", bs("0"));

        assertEquals(ImmutableList.of("a", replacement, emoji), ImmutableList.copyOf(store.hgetAll("h").keySet()));
    }

    @Test
    void setKeysDoNotBlockEachOther() throws Exception {
        CountDownLatch locked = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        Thread holder = new Thread(() -> {
            try {
                store.sadd("a", ImmutableList.of(new BlockingData(locked, release)));
            } catch (StoreException e) {
                fail(e);
            }
        });
        holder.start();
        assertTrue(locked.await(5, TimeUnit.SECONDS));

        try {
            assertTimeoutPreemptively(Duration.ofSeconds(5), () -> {
                assertEquals(1, store.sadd("b", ImmutableList.of(bs("one"))));
                assertTrue(store.sismember("b", bs("one")));
                assertEquals(ImmutableList.of(bs("one")), store.smembers("b"));
            });
        } finally {
            release.countDown();
            holder.join(5000);
        }
        assertEquals(1, store.smembers("a").size());
    }

    @Test
    void saddCountsOnlyNewMembers() throws StoreException {
        assertEquals(1, store.sadd("s", ImmutableList.of(bs("one"))));
        assertEquals(0, store.sadd("s", ImmutableList.of(bs("one"))));
        assertEquals(2, store.sadd("s", ImmutableList.of(bs("two"), bs("three"))));
        assertEquals(ImmutableList.of(bs("one"), bs("two"), bs("three")), store.smembers("s"));
    }

    @Test
    void duplicatesInOneSaddCountOnce() throws StoreException {
        assertEquals(1, store.sadd("s", ImmutableList.of(bs("a"), bs("a"), bs("a"))));
        assertEquals(1, store.smembers("s").size());
    }

    @Test
    void memberIdentityIsEncoding() throws StoreException {
        assertEquals(2, store.sadd("s", ImmutableList.of(bs("two"), RespSimpleString.withUTF8("two"))));
        assertTrue(store.sismember("s", RespSimpleString.withUTF8("two")));
        assertFalse(store.sismember("s", RespBulkString.withUTF8("three")));

        assertEquals(1, store.sadd("d", ImmutableList.of(RespDouble.with(Double.NaN), RespDouble.with(Double.NaN))));
        assertTrue(store.sismember("d", RespDouble.with(Double.NaN)));
        assertEquals(1, store.sadd("d", ImmutableList.of(RespDouble.with(-0.0))));
        assertEquals(1, store.sadd("d", ImmutableList.of(RespDouble.with(0.0))));
    }

    @Test
    void smembersIsSnapshot() throws StoreException {
        store.sadd("s", ImmutableList.of(bs("a")));
        List<RespData> members = store.smembers("s");
        store.sadd("s", ImmutableList.of(bs("b")));
        assertEquals(1, members.size());
        assertThrows(UnsupportedOperationException.class, () -> members.add(bs("c")));
    }

    @RepeatedTest(5)
    void parallelSadd() throws StoreException {
        List<Integer> added = IntStream.range(0, 1000).parallel()
                .mapToObj(i -> {
                    try {
                        return store.sadd("s", ImmutableList.of(bs(String.valueOf(i % 100)), bs("shared")));
                    } catch (StoreException e) {
                        return fail(e);
                    }
                })
                .collect(Collectors.toList());

        assertEquals(101, added.stream().mapToInt(Integer::intValue).sum());
        assertEquals(101, store.smembers("s").size());
        assertTrue(store.sismember("s", bs("shared")));
    }

    @RepeatedTest(5)
    void parallelHset() {
        IntStream.range(0, 1000).parallel()
                .forEach(i -> store.hset("h" + (i % 10), String.valueOf(i), bs(String.valueOf(i))));

        int total = 0;
        for (int i = 0; i < 10; i++) {
            total += store.hgetAll("h" + i).size();
        }
        assertEquals(1000, total);
        assertEquals(bs("999"), store.hget("h9", "999"));
    }
}
