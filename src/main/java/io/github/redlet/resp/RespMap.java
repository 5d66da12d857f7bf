package io.github.redlet.resp;

import java.nio.charset.StandardCharsets;
import java.util.Map;

import com.google.common.collect.ImmutableMap;
import com.google.common.primitives.Bytes;
import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * RESP3 map。key是simple string，按插入顺序编码，key不能重复。
 */
@EqualsAndHashCode
@ToString
public class RespMap implements RespData {
    private static final RespMap EMPTY = new RespMap(ImmutableMap.of());

    private final ImmutableMap<String, RespData> entries;

    public static RespMap empty() {
        return EMPTY;
    }

    /**
     * @param entries 有序的键值对
     * @return map帧
     * @throws IllegalArgumentException key包含\r或\n
     */
    public static RespMap with(Map<String, ? extends RespData> entries) {
        entries.keySet().forEach(RespSimpleString::withUTF8);
        return new RespMap(ImmutableMap.copyOf(entries));
    }

    public static Builder builder() {
        return new Builder();
    }

    private RespMap(ImmutableMap<String, RespData> entries) {
        this.entries = entries;
    }

    public int size() {
        return entries.size();
    }

    public RespData get(String key) {
        return entries.get(key);
    }

    public Map<String, RespData> getEntries() {
        return entries;
    }

    @Override
    public RespType getType() {
        return RespType.MAP;
    }

    @Override
    public byte[] toBytes() {
        byte[][] parts = new byte[entries.size() * 2 + 1][];
        parts[0] = (RespType.MAP.getFirstChar() + Integer.toString(entries.size()) + "\r\n")
                .getBytes(StandardCharsets.US_ASCII);
        int i = 1;
        for (Map.Entry<String, RespData> entry : entries.entrySet()) {
            parts[i++] = RespSimpleString.withUTF8(entry.getKey()).toBytes();
            parts[i++] = entry.getValue().toBytes();
        }
        return Bytes.concat(parts);
    }

    /**
     * 逐个添加键值对，重复的key在build时报错。
     */
    public static class Builder {
        private final ImmutableMap.Builder<String, RespData> builder = ImmutableMap.builder();

        private Builder() {
        }

        public Builder put(String key, RespData value) {
            RespSimpleString.withUTF8(key);
            builder.put(key, value);
            return this;
        }

        /**
         * @return map帧
         * @throws IllegalArgumentException 存在重复的key
         */
        public RespMap build() {
            return new RespMap(builder.buildOrThrow());
        }
    }
}
