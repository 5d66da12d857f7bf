package io.github.redlet.resp;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

import com.google.common.base.Preconditions;
import com.google.common.base.Utf8;

/**
 * RESP协议解码器，使用自定义的{@link ByteBuf}处理数据。
 * <p>
 * 解码分两步：{@link #expectLength(ByteBuf)}只探测，不移动读位置，计算从读位置开始的完整帧有多少字节；
 * {@link #decode(ByteBuf)}在数据足够时正好消费这么多字节，并生成帧。
 * 数据不完整不是错误，分别用{@link #NOT_COMPLETE}和null表示，调用方应保留缓冲区，等更多数据到达后重试。
 * 其它错误都是永久性的，抛出{@link RespException}。
 * <p>
 * 本类无状态，可以被多个线程共享。
 *
 * @author zy
 */
public class RespDecoder {
    public static final int NOT_COMPLETE = -1;

    // 防止恶意的深层嵌套耗尽线程栈
    static final int MAX_DEPTH = 512;

    private static final Pattern INTEGER = Pattern.compile("[+-]?[0-9]+");

    private static final RespDecoder INSTANCE = new RespDecoder();

    public static RespDecoder create() {
        return INSTANCE;
    }

    private RespDecoder() {
    }

    /**
     * 计算从读位置开始的完整帧的字节数，不消费数据。
     *
     * @param buf 数据
     * @return 帧的字节数，如果数据还不够计算长度，返回{@link #NOT_COMPLETE}
     * @throws RespException 数据格式错误
     */
    public int expectLength(ByteBuf buf) {
        long len = expectLength(buf, buf.getReaderIndex(), 0);
        return len == NOT_COMPLETE ? NOT_COMPLETE : (int) len;
    }

    /**
     * 解码一个完整的帧，正好消费{@link #expectLength(ByteBuf)}个字节。
     *
     * @param buf 数据
     * @return 帧，数据不完整时返回null，此时buf不会被修改
     * @throws RespException 数据格式错误
     */
    public RespData decode(ByteBuf buf) {
        int len = expectLength(buf);
        if (len == NOT_COMPLETE || len > buf.readableBytes()) {
            return null;
        }
        int start = buf.getReaderIndex();
        RespData data = read(buf);
        Preconditions.checkState(buf.getReaderIndex() - start == len);
        return data;
    }

    private long expectLength(ByteBuf buf, int index, int depth) {
        if (index >= buf.getWriterIndex()) {
            return NOT_COMPLETE;
        }
        if (depth > MAX_DEPTH) {
            throw new MalformedRespException("resp nesting deeper than " + MAX_DEPTH);
        }
        RespType type = RespType.of(buf.getByte(index));
        int lf = lineEnd(buf, index + 1);
        if (lf == -1) {
            return NOT_COMPLETE;
        }
        long headerLen = lf + 1 - index;

        switch (type) {
            case SIMPLE_STRING:
            case ERROR:
            case INTEGER:
            case NULL:
            case BOOLEAN:
            case DOUBLE:
                return headerLen;
            case BULK_STRING: {
                int n = parseLength(type, buf.getBytes(index + 1, lf - 1));
                return n == -1 ? headerLen : checkLength(type, headerLen + n + 2);
            }
            case ARRAY:
            case SET:
            case MAP: {
                int n = parseLength(type, buf.getBytes(index + 1, lf - 1));
                long children = type == RespType.MAP ? 2L * n : n;
                long pos = lf + 1;
                for (long i = 0; i < children; i++) {
                    if (pos >= buf.getWriterIndex()) {
                        return NOT_COMPLETE;
                    }
                    long child = expectLength(buf, (int) pos, depth + 1);
                    if (child == NOT_COMPLETE) {
                        return NOT_COMPLETE;
                    }
                    pos += child;
                }
                return checkLength(type, pos - index);
            }
            default:
                throw new UnknownRespTypeException(type.getFirstByte());
        }
    }

    private RespData read(ByteBuf buf) {
        RespType type = RespType.of(buf.readByte());
        byte[] line = readLine(buf);
        switch (type) {
            case SIMPLE_STRING:
                return RespSimpleString.withUTF8(text(type, line));
            case ERROR:
                return RespError.withUTF8(text(type, line));
            case INTEGER: {
                String s = ascii(line);
                if (!INTEGER.matcher(s).matches()) {
                    throw new MalformedRespException("invalid resp integer: " + s);
                }
                try {
                    return RespInteger.with(Long.parseLong(s));
                } catch (NumberFormatException e) {
                    throw new MalformedRespException("resp integer overflow: " + s, e);
                }
            }
            case BULK_STRING: {
                int n = parseLength(type, line);
                if (n == -1) {
                    return RespBulkString.nullBulkString();
                }
                byte[] content = new byte[n];
                buf.readBytes(content);
                if (buf.readByte() != '\r' || buf.readByte() != '\n') {
                    throw new MalformedRespException("resp bulk string not terminated by \\r\\n");
                }
                return RespBulkString.with(content);
            }
            case ARRAY: {
                int n = parseLength(type, line);
                if (n == -1) {
                    return RespArray.nullArray();
                }
                return n == 0 ? RespArray.empty() : RespArray.with(readChildren(buf, n));
            }
            case NULL:
                if (line.length != 0) {
                    throw new MalformedRespException("resp null must have empty payload");
                }
                return RespNull.instance();
            case BOOLEAN: {
                String s = ascii(line);
                if ("t".equals(s)) {
                    return RespBoolean.TRUE;
                }
                if ("f".equals(s)) {
                    return RespBoolean.FALSE;
                }
                throw new MalformedRespException("invalid resp boolean: " + s);
            }
            case DOUBLE:
                try {
                    return RespDouble.parse(ascii(line));
                } catch (NumberFormatException e) {
                    throw new MalformedRespException(e.getMessage(), e);
                }
            case MAP: {
                int n = parseLength(type, line);
                Map<String, RespData> entries = new LinkedHashMap<>();
                for (int i = 0; i < n; i++) {
                    RespData key = read(buf);
                    if (key.getType() != RespType.SIMPLE_STRING) {
                        throw new MalformedRespException("resp map key must be a simple string, but got " + key.getType());
                    }
                    String k = ((RespSimpleString) key).getContent();
                    if (entries.containsKey(k)) {
                        throw new MalformedRespException("duplicate resp map key: " + k);
                    }
                    entries.put(k, read(buf));
                }
                return RespMap.with(entries);
            }
            case SET:
                return RespSet.with(readChildren(buf, parseLength(type, line)));
            default:
                throw new UnknownRespTypeException(type.getFirstByte());
        }
    }

    private List<RespData> readChildren(ByteBuf buf, int n) {
        List<RespData> children = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            children.add(read(buf));
        }
        return children;
    }

    /**
     * @return 行尾\n的索引，行还没结束返回-1
     */
    private int lineEnd(ByteBuf buf, int from) {
        int lf = buf.indexOf(from, buf.getWriterIndex(), (byte) '\n');
        if (lf == -1) {
            return -1;
        }
        if (lf == from || buf.getByte(lf - 1) != '\r') {
            throw new MalformedRespException("not found \\r before \\n in line");
        }
        return lf;
    }

    /**
     * 读取一行，消费末尾的\r\n，返回的数据不包含\r\n
     */
    private byte[] readLine(ByteBuf buf) {
        int lf = lineEnd(buf, buf.getReaderIndex());
        Preconditions.checkState(lf != -1);
        byte[] line = buf.getBytes(buf.getReaderIndex(), lf - 1);
        buf.skipBytes(line.length + 2);
        return line;
    }

    private int parseLength(RespType type, byte[] line) {
        String s = ascii(line);
        if (!INTEGER.matcher(s).matches()) {
            throw new MalformedRespException("invalid " + type + " length: " + s);
        }
        long n;
        try {
            n = Long.parseLong(s);
        } catch (NumberFormatException e) {
            throw new InvalidRespLengthException(type, s);
        }
        if (n == -1 && (type == RespType.BULK_STRING || type == RespType.ARRAY)) {
            return -1;
        }
        if (n < 0 || n > Integer.MAX_VALUE) {
            throw new InvalidRespLengthException(type, s);
        }
        return (int) n;
    }

    private long checkLength(RespType type, long total) {
        if (total > Integer.MAX_VALUE) {
            throw new InvalidRespLengthException(type, Long.toString(total));
        }
        return total;
    }

    private String text(RespType type, byte[] line) {
        if (!Utf8.isWellFormed(line)) {
            throw new MalformedRespException("invalid utf-8 in " + type);
        }
        for (byte b : line) {
            if (b == '\r') {
                throw new MalformedRespException("\\r inside " + type);
            }
        }
        return new String(line, StandardCharsets.UTF_8);
    }

    private String ascii(byte[] line) {
        return new String(line, StandardCharsets.US_ASCII);
    }
}
