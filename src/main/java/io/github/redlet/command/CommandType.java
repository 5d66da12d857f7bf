package io.github.redlet.command;

import java.util.Locale;

import com.google.common.collect.ImmutableMap;

/**
 * 支持的命令。命令名大小写不敏感。
 *
 * @author zy
 */
public enum CommandType {
    ECHO(Arity.exactly(1)),
    GET(Arity.exactly(1)),
    SET(Arity.exactly(2)),
    HGET(Arity.exactly(2)),
    HSET(Arity.exactly(3)),
    HGETALL(Arity.exactly(1)),
    HMGET(Arity.atLeast(2)),
    SADD(Arity.atLeast(2)),
    SISMEMBER(Arity.exactly(2)),
    SMEMBERS(Arity.exactly(1)),
    // 不认识的命令名，不检查参数
    UNRECOGNIZED(Arity.atLeast(0));

    private static final ImmutableMap<String, CommandType> BY_NAME;

    static {
        ImmutableMap.Builder<String, CommandType> builder = ImmutableMap.builder();
        for (CommandType type : values()) {
            if (type != UNRECOGNIZED) {
                builder.put(type.getName(), type);
            }
        }
        BY_NAME = builder.build();
    }

    private final Arity arity;

    CommandType(Arity arity) {
        this.arity = arity;
    }

    /**
     * @return 小写的命令名
     */
    public String getName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public Arity getArity() {
        return arity;
    }

    /**
     * @param name 命令名，大小写不敏感
     * @return 对应的命令类型，不认识的返回{@link #UNRECOGNIZED}
     */
    public static CommandType of(String name) {
        CommandType type = BY_NAME.get(name.toLowerCase(Locale.ROOT));
        return type == null ? UNRECOGNIZED : type;
    }
}
