package io.github.redlet.resp;

import java.nio.ByteBuffer;
import java.util.List;

import com.google.common.base.Preconditions;

/**
 * 把字节流切分成帧。每个连接一个实例，非线程安全。
 * <p>
 * 读到的数据通过decode方法追加到缓冲区，{@link #get()}每次取出一个完整的帧，
 * 不完整的部分留在缓冲区等待后续数据。未解码的数据超过上限时视为协议错误。
 *
 * @author zy
 */
public class RespFramer {
    // 与redis的proto-max-bulk-len默认值相同
    static final int DEFAULT_MAX_PENDING_BYTES = 512 * 1024 * 1024;

    private final RespDecoder decoder = RespDecoder.create();
    private final ByteBuf     byteBuf = ByteBuf.allocate(512);
    private final int         maxPendingBytes;

    public static RespFramer create() {
        return new RespFramer(DEFAULT_MAX_PENDING_BYTES);
    }

    RespFramer(int maxPendingBytes) {
        Preconditions.checkArgument(maxPendingBytes > 0);
        this.maxPendingBytes = maxPendingBytes;
    }

    /**
     * @throws MalformedRespException 未解码的数据超过上限
     */
    public RespFramer decode(ByteBuffer buf) {
        checkPending(buf.remaining());
        byteBuf.discardReadBytes().writeBytes(buf);
        return this;
    }

    /**
     * @throws MalformedRespException 未解码的数据超过上限
     */
    public RespFramer decode(byte[] bytes) {
        checkPending(bytes.length);
        byteBuf.discardReadBytes().writeBytes(bytes);
        return this;
    }

    /**
     * 取出下一个完整的帧
     *
     * @param <T> 帧类型
     * @return 帧，缓冲区中的数据还不够一个完整的帧时返回null
     * @throws RespException 数据格式错误，之后的数据无法再对齐，连接应当关闭
     */
    public <T extends RespData> T get() {
        return (T) decoder.decode(byteBuf);
    }

    /**
     * @return 缓冲区中还未解码的字节数
     */
    public int pendingBytes() {
        return byteBuf.readableBytes();
    }

    public ByteBuffer encode(RespData data) {
        return data.toByteBuffer();
    }

    /**
     * 把多个帧按顺序编码到一个缓冲区，用于一次写出流水线请求的所有响应
     */
    public ByteBuffer encode(List<? extends RespData> datas) {
        byte[][] parts = new byte[datas.size()][];
        int total = 0;
        for (int i = 0; i < datas.size(); i++) {
            parts[i] = datas.get(i).toBytes();
            total += parts[i].length;
        }
        ByteBuffer bb = ByteBuffer.allocate(total);
        for (byte[] part : parts) {
            bb.put(part);
        }
        bb.flip();
        return bb;
    }

    private void checkPending(int incoming) {
        if ((long) byteBuf.readableBytes() + incoming > maxPendingBytes) {
            throw new MalformedRespException("pending resp data exceeds " + maxPendingBytes + " bytes");
        }
    }
}
