package io.github.redlet.kv;

import io.github.redlet.command.Command;
import io.github.redlet.command.CommandException;
import io.github.redlet.command.CommandParser;
import io.github.redlet.command.CommandType;
import io.github.redlet.resp.RespData;
import io.github.redlet.resp.RespError;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 解析请求并在{@link Store}上执行。命令错误和存储错误都转换成错误响应，不会抛出异常，连接可以继续处理后续请求。
 *
 * @author zy
 */
public class KeyValueEngine {
    private static final Logger logger = LoggerFactory.getLogger(KeyValueEngine.class);

    static final String INTERNAL_ERROR = "ERR internal server error";

    @Getter(AccessLevel.PACKAGE)
    private final Store         store;
    private final CommandParser parser = CommandParser.create();

    @Builder
    KeyValueEngine(@NonNull Store store) {
        this.store = store;
    }

    /**
     * @param request 请求帧
     * @return 响应帧
     */
    public RespData execute(RespData request) {
        try {
            Command command = parser.parse(request);
            if (command.getType() == CommandType.UNRECOGNIZED) {
                logger.debug("unrecognized command, reply OK: {}", command);
            } else {
                logger.debug("execute {}", command);
            }
            return command.execute(store);
        } catch (CommandException e) {
            logger.debug("invalid command: {}", e.getMessage());
            return error(e.getMessage());
        } catch (StoreException e) {
            logger.error("store failed.", e);
            return RespError.withUTF8(INTERNAL_ERROR);
        }
    }

    private RespError error(String message) {
        return RespError.withUTF8("ERR " + message.replace('\r', ' ').replace('\n', ' '));
    }
}
