package io.github.redlet.resp;

import java.util.List;

import com.google.common.collect.ImmutableList;
import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * RESP3 set。线上格式只是有序的元素序列，唯一性由使用它的命令保证。
 */
@EqualsAndHashCode
@ToString
public class RespSet implements RespData {
    private final ImmutableList<RespData> datas;

    public static RespSet with(List<? extends RespData> datas) {
        return new RespSet(ImmutableList.copyOf(datas));
    }

    public static RespSet with(RespData... datas) {
        return new RespSet(ImmutableList.copyOf(datas));
    }

    private RespSet(ImmutableList<RespData> datas) {
        this.datas = datas;
    }

    public int size() {
        return datas.size();
    }

    public <T extends RespData> T get(int i) {
        return (T) datas.get(i);
    }

    public List<RespData> getDatas() {
        return datas;
    }

    @Override
    public RespType getType() {
        return RespType.SET;
    }

    @Override
    public byte[] toBytes() {
        return RespArray.aggregate(RespType.SET, datas.size(), datas);
    }
}
