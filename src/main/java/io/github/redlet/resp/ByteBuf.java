package io.github.redlet.resp;

import java.nio.ByteBuffer;
import java.util.Arrays;

import com.google.common.base.Preconditions;
import lombok.Getter;

/**
 * 读写位置独立的字节缓冲区，不用考虑{@link ByteBuffer}的flip和rewind。
 * 解码器只通过绝对索引探测数据，确认帧完整后才移动读位置。
 * 非线程安全，每个连接独占一个。
 *
 * @author zy
 */
public class ByteBuf {
    // 部分JVM不能分配接近Integer.MAX_VALUE的数组
    static final int MAX_CAPACITY = Integer.MAX_VALUE - 8;

    // 底层字节数组
    private byte[] buf;
    // 当前读位置
    @Getter
    private int    readerIndex;
    // 当前写位置
    @Getter
    private int    writerIndex;

    private ByteBuf(int capacity) {
        buf = new byte[capacity];
    }

    public static ByteBuf allocate(int capacity) {
        Preconditions.checkArgument(capacity >= 0);
        return new ByteBuf(capacity);
    }

    public static ByteBuf wrap(byte[] bytes) {
        return allocate(bytes.length).writeBytes(bytes);
    }

    /**
     * @return 当前还可以写入的大小
     */
    public int writableBytes() {
        return buf.length - writerIndex;
    }

    public ByteBuf writeBytes(ByteBuffer bb) {
        int n = bb.remaining();
        ensureWritable(n);
        bb.get(buf, writerIndex, n);
        writerIndex += n;
        return this;
    }

    public ByteBuf writeBytes(byte[] bytes) {
        ensureWritable(bytes.length);
        System.arraycopy(bytes, 0, buf, writerIndex, bytes.length);
        writerIndex += bytes.length;
        return this;
    }

    public ByteBuf writeByte(byte b) {
        ensureWritable(1);
        buf[writerIndex++] = b;
        return this;
    }

    /**
     * 是否有数据未消费，可读取
     * @return true 有，false 没有
     */
    public boolean isReadable() {
        return readerIndex < writerIndex;
    }

    /**
     * @return 可读取数据的大小
     */
    public int readableBytes() {
        return writerIndex - readerIndex;
    }

    /**
     * 读一个字节
     * @return 字节
     * @throws IllegalStateException 没有可读数据
     */
    public byte readByte() {
        Preconditions.checkState(readerIndex < writerIndex);
        return buf[readerIndex++];
    }

    /**
     * 读数据
     * @param bytes 读到的数据的存放数组
     * @return 本对象
     * @throws IndexOutOfBoundsException 没有足够数据填充数组
     */
    public ByteBuf readBytes(byte[] bytes) {
        if (bytes.length > readableBytes()) {
            throw new IndexOutOfBoundsException();
        }
        System.arraycopy(buf, readerIndex, bytes, 0, bytes.length);
        readerIndex += bytes.length;
        return this;
    }

    /**
     * 跳过n个字节
     * @throws IndexOutOfBoundsException 可读数据不足n个字节
     */
    public ByteBuf skipBytes(int n) {
        if (n < 0 || n > readableBytes()) {
            throw new IndexOutOfBoundsException();
        }
        readerIndex += n;
        return this;
    }

    /**
     * 使用绝对索引读取字节，不移动读位置
     * @param index 索引，必须在[readerIndex, writerIndex)内
     * @return 字节值
     * @throws IndexOutOfBoundsException 索引越界
     */
    public byte getByte(int index) {
        if (index < readerIndex || index >= writerIndex) {
            throw new IndexOutOfBoundsException("index: " + index);
        }
        return buf[index];
    }

    /**
     * 拷贝[from, to)之间的数据，不移动读位置
     */
    public byte[] getBytes(int from, int to) {
        if (from < readerIndex || to > writerIndex || from > to) {
            throw new IndexOutOfBoundsException("from: " + from + ", to: " + to);
        }
        return Arrays.copyOfRange(buf, from, to);
    }

    /**
     * 查找某字节值的索引
     * @param fromIndex 从该索引开始
     * @param toIndex 到该索引结束（不包含）
     * @param value 查找的字节值
     * @return 该值的第一个索引值，没有找到返回-1
     */
    public int indexOf(int fromIndex, int toIndex, byte value) {
        for (int i = Math.max(fromIndex, readerIndex); i < Math.min(toIndex, writerIndex); i++) {
            if (buf[i] == value) {
                return i;
            }
        }
        return -1;
    }

    /**
     * 丢弃已读数据，把未读数据移动到数组开头
     * @return 本对象
     */
    public ByteBuf discardReadBytes() {
        if (readerIndex == 0) {
            return this;
        }
        int readable = readableBytes();
        System.arraycopy(buf, readerIndex, buf, 0, readable);
        readerIndex = 0;
        writerIndex = readable;
        return this;
    }

    /**
     * 缓存最大容量
     * @return 容量
     */
    public int capacity() {
        return buf.length;
    }

    private void ensureWritable(int remaining) {
        if (writableBytes() < remaining) {
            buf = Arrays.copyOf(buf, newCapacity(buf.length, writerIndex, remaining));
        }
    }

    /**
     * 扩容后的大小，至少能放下新数据，一般翻倍，不超过{@link #MAX_CAPACITY}
     *
     * @throws IllegalStateException 需要的容量超过{@link #MAX_CAPACITY}
     */
    static int newCapacity(int capacity, int writerIndex, int remaining) {
        long required = (long) writerIndex + remaining;
        Preconditions.checkState(required <= MAX_CAPACITY, "byte buf capacity exceeded: %s", required);
        return (int) Math.min(MAX_CAPACITY, Math.max(required, (long) capacity * 2));
    }
}
