package io.github.redlet.command;

import java.util.ArrayList;
import java.util.List;

import io.github.redlet.resp.RespArray;
import io.github.redlet.resp.RespBulkString;
import io.github.redlet.resp.RespData;
import io.github.redlet.resp.RespType;

/**
 * 把请求帧解析成{@link Command}。
 * <p>
 * 请求必须是非空数组，第一个元素是命令名（bulk string）。命令名不认识时返回{@link UnrecognizedCommand}，不算错误。
 * 之后检查参数个数，key、field和ECHO的消息必须是UTF-8编码的bulk string，value可以是任意帧。
 * <p>
 * 无状态，线程安全。
 *
 * @author zy
 */
public class CommandParser {
    private static final CommandParser INSTANCE = new CommandParser();

    public static CommandParser create() {
        return INSTANCE;
    }

    private CommandParser() {
    }

    /**
     * @param frame 请求帧
     * @return 命令
     * @throws InvalidCommandException   请求不是命令的结构
     * @throws InvalidArgumentException  参数个数或类型错误
     * @throws InvalidEncodingException  key、field或ECHO消息不是合法的UTF-8
     */
    public Command parse(RespData frame) throws CommandException {
        if (frame.getType() != RespType.ARRAY) {
            throw new InvalidCommandException("request must be an array, but got " + frame.getType());
        }
        RespArray request = (RespArray) frame;
        if (request.size() == 0) {
            throw new InvalidCommandException("empty command");
        }
        RespData first = request.get(0);
        if (first.getType() != RespType.BULK_STRING || ((RespBulkString) first).isNull()) {
            throw new InvalidCommandException("command name must be a bulk string, but got " + first.getType());
        }

        String name = ((RespBulkString) first).asUTF8();
        CommandType type = CommandType.of(name);
        if (type == CommandType.UNRECOGNIZED) {
            return new UnrecognizedCommand(name);
        }

        List<RespData> args = request.getDatas().subList(1, request.size());
        if (!type.getArity().accepts(args.size())) {
            throw new InvalidArgumentException(type.getName() + " command must have " + type.getArity());
        }

        switch (type) {
            case ECHO:
                return new EchoCommand(RespBulkString.withUTF8(text(type, args, 0)));
            case GET:
                return new GetCommand(text(type, args, 0));
            case SET:
                return new SetCommand(text(type, args, 0), args.get(1));
            case HGET:
                return new HGetCommand(text(type, args, 0), text(type, args, 1));
            case HSET:
                return new HSetCommand(text(type, args, 0), text(type, args, 1), args.get(2));
            case HGETALL:
                return new HGetAllCommand(text(type, args, 0));
            case HMGET: {
                List<String> fields = new ArrayList<>(args.size() - 1);
                for (int i = 1; i < args.size(); i++) {
                    fields.add(text(type, args, i));
                }
                return new HMGetCommand(text(type, args, 0), fields);
            }
            case SADD:
                return new SAddCommand(text(type, args, 0), args.subList(1, args.size()));
            case SISMEMBER:
                return new SIsMemberCommand(text(type, args, 0), args.get(1));
            case SMEMBERS:
                return new SMembersCommand(text(type, args, 0));
            default:
                throw new IllegalStateException("unhandled command type: " + type);
        }
    }

    private RespBulkString bulkString(CommandType type, List<RespData> args, int i) throws InvalidArgumentException {
        RespData arg = args.get(i);
        if (arg.getType() != RespType.BULK_STRING || ((RespBulkString) arg).isNull()) {
            throw new InvalidArgumentException(
                    type.getName() + " argument " + (i + 1) + " must be a bulk string, but got " + arg.getType());
        }
        return (RespBulkString) arg;
    }

    private String text(CommandType type, List<RespData> args, int i) throws CommandException {
        RespBulkString arg = bulkString(type, args, i);
        if (!arg.isUTF8()) {
            throw new InvalidEncodingException(type.getName() + " argument " + (i + 1) + " is not valid utf-8");
        }
        return arg.asUTF8();
    }
}
