package io.github.redlet.resp;

import java.nio.charset.StandardCharsets;
import java.util.List;

import com.google.common.collect.ImmutableList;
import com.google.common.primitives.Bytes;
import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * 有序的帧数组。datas为null表示null array（*-1），空数组编码为*0。
 */
@EqualsAndHashCode
@ToString
public class RespArray implements RespData {
    private static final RespArray NULL  = new RespArray(null);
    private static final RespArray EMPTY = new RespArray(ImmutableList.of());

    private final ImmutableList<RespData> datas;

    public static RespArray empty() {
        return EMPTY;
    }

    public static RespArray nullArray() {
        return NULL;
    }

    public static RespArray with(List<? extends RespData> datas) {
        return new RespArray(ImmutableList.copyOf(datas));
    }

    public static RespArray with(RespData... datas) {
        return new RespArray(ImmutableList.copyOf(datas));
    }

    private RespArray(ImmutableList<RespData> datas) {
        this.datas = datas;
    }

    public boolean isNull() {
        return datas == null;
    }

    public int size() {
        return datas == null ? 0 : datas.size();
    }

    public <T extends RespData> T get(int i) {
        return (T) datas.get(i);
    }

    /**
     * @return 所有元素，null array返回空列表
     */
    public List<RespData> getDatas() {
        return datas == null ? ImmutableList.of() : datas;
    }

    @Override
    public RespType getType() {
        return RespType.ARRAY;
    }

    @Override
    public byte[] toBytes() {
        return aggregate(RespType.ARRAY, datas == null ? -1 : datas.size(), getDatas());
    }

    static byte[] aggregate(RespType type, int size, List<RespData> children) {
        byte[][] parts = new byte[children.size() + 1][];
        parts[0] = (type.getFirstChar() + Integer.toString(size) + "\r\n").getBytes(StandardCharsets.US_ASCII);
        for (int i = 0; i < children.size(); i++) {
            parts[i + 1] = children.get(i).toBytes();
        }
        return Bytes.concat(parts);
    }
}
