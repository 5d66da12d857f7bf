package io.github.redlet.resp;

import java.nio.charset.StandardCharsets;

import com.google.common.base.Preconditions;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * 单行文本帧（simple string和error）的基类，内容不能包含\r和\n。
 */
@EqualsAndHashCode
@ToString
abstract class RespString implements RespData {
    @Getter
    private final String content;

    RespString(String content) {
        Preconditions.checkNotNull(content);
        Preconditions.checkArgument(content.indexOf('\r') < 0, "resp simple string不能包含\\r");
        Preconditions.checkArgument(content.indexOf('\n') < 0, "resp simple string不能包含\\n");
        this.content = content;
    }

    @Override
    public byte[] toBytes() {
        return (getType().getFirstChar() + content + "\r\n").getBytes(StandardCharsets.UTF_8);
    }
}
