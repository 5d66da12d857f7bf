package io.github.redlet.command;

import com.google.common.base.Preconditions;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * 命令名之后的参数个数要求，要么正好n个，要么至少n个。
 *
 * @author zy
 */
@EqualsAndHashCode
public final class Arity {
    @Getter
    private final int     count;
    private final boolean exact;

    public static Arity exactly(int count) {
        return new Arity(count, true);
    }

    public static Arity atLeast(int count) {
        return new Arity(count, false);
    }

    private Arity(int count, boolean exact) {
        Preconditions.checkArgument(count >= 0);
        this.count = count;
        this.exact = exact;
    }

    public boolean isExact() {
        return exact;
    }

    public boolean accepts(int argc) {
        return exact ? argc == count : argc >= count;
    }

    /**
     * @return 如"exactly 2 arguments"、"at least 1 argument"
     */
    @Override
    public String toString() {
        return (exact ? "exactly " : "at least ") + count + (count == 1 ? " argument" : " arguments");
    }
}
