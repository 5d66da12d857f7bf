package io.github.redlet.resp;

import java.nio.ByteBuffer;

/**
 * 所有RESP帧的公共接口。实现类都是不可变的值对象。
 *
 * @author zy
 */
public interface RespData {

    RespType getType();

    byte[] toBytes();

    default ByteBuffer toByteBuffer() {
        return ByteBuffer.wrap(toBytes());
    }
}
