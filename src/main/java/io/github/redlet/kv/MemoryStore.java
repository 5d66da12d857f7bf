package io.github.redlet.kv;

import java.nio.charset.StandardCharsets;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;
import com.google.common.primitives.UnsignedBytes;
import io.github.redlet.resp.RespData;
import lombok.NonNull;

/**
 * 基于{@link ConcurrentHashMap}的内存存储。
 * 不同key之间互不阻塞，set类型的同一个key由{@link MemberList}的锁串行化。
 *
 * @author zy
 */
public class MemoryStore implements Store {
    // field按UTF-8字节排序，与String.compareTo的UTF-16顺序在代理对上不同
    static final Comparator<String> FIELD_ORDER =
            Comparator.comparing((String f) -> f.getBytes(StandardCharsets.UTF_8), UnsignedBytes.lexicographicalComparator());

    private final ConcurrentMap<String, RespData>                        values = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, ConcurrentMap<String, RespData>> hashes = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, MemberList>                      sets   = new ConcurrentHashMap<>();

    @Override
    public RespData get(@NonNull String key) {
        return values.get(key);
    }

    @Override
    public void set(@NonNull String key, @NonNull RespData value) {
        values.put(key, value);
    }

    @Override
    public RespData hget(@NonNull String key, @NonNull String field) {
        Map<String, RespData> hash = hashes.get(key);
        return hash == null ? null : hash.get(field);
    }

    @Override
    public void hset(@NonNull String key, @NonNull String field, @NonNull RespData value) {
        hashes.computeIfAbsent(key, k -> new ConcurrentHashMap<>()).put(field, value);
    }

    @Override
    public SortedMap<String, RespData> hgetAll(@NonNull String key) {
        Map<String, RespData> hash = hashes.get(key);
        return hash == null ? ImmutableSortedMap.<String, RespData>orderedBy(FIELD_ORDER).build()
                : ImmutableSortedMap.copyOf(hash, FIELD_ORDER);
    }

    @Override
    public int sadd(@NonNull String key, @NonNull List<RespData> members) throws StoreException {
        return sets.computeIfAbsent(key, k -> new MemberList()).addAll(members);
    }

    @Override
    public boolean sismember(@NonNull String key, @NonNull RespData member) throws StoreException {
        MemberList list = sets.get(key);
        return list != null && list.contains(member);
    }

    @Override
    public List<RespData> smembers(@NonNull String key) throws StoreException {
        MemberList list = sets.get(key);
        return list == null ? ImmutableList.of() : list.snapshot();
    }
}
