package io.github.redlet.resp;

import java.nio.charset.StandardCharsets;

import com.google.common.base.Utf8;
import com.google.common.primitives.Bytes;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * 带长度前缀的二进制安全字符串。content为null表示null bulk string（$-1），与{@link RespNull}不同。
 */
@EqualsAndHashCode
@ToString
public class RespBulkString implements RespData {
    private static final RespBulkString NULL = new RespBulkString(null);

    @Getter
    private final int    length;
    private final byte[] content;

    public static RespBulkString with(byte[] content) {
        return new RespBulkString(content.clone());
    }

    public static RespBulkString withUTF8(String content) {
        return new RespBulkString(content.getBytes(StandardCharsets.UTF_8));
    }

    public static RespBulkString nullBulkString() {
        return NULL;
    }

    private RespBulkString(byte[] content) {
        this.content = content;
        this.length = content == null ? -1 : content.length;
    }

    public boolean isNull() {
        return content == null;
    }

    /**
     * @return 内容的拷贝，null bulk string返回null
     */
    public byte[] getContent() {
        return content == null ? null : content.clone();
    }

    /**
     * @return 内容是否为合法的UTF-8编码
     */
    public boolean isUTF8() {
        return content != null && Utf8.isWellFormed(content);
    }

    public String asUTF8() {
        return content == null ? null : new String(content, StandardCharsets.UTF_8);
    }

    @Override
    public RespType getType() {
        return RespType.BULK_STRING;
    }

    @Override
    public byte[] toBytes() {
        byte[] head = (RespType.BULK_STRING.getFirstChar() + Integer.toString(length) + "\r\n")
                .getBytes(StandardCharsets.US_ASCII);
        if (content == null) {
            return head;
        }
        return Bytes.concat(head, content, "\r\n".getBytes(StandardCharsets.US_ASCII));
    }
}
