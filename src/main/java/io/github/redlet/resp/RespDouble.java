package io.github.redlet.resp;

import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.regex.Pattern;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * RESP3 double。相等性与{@link Double#compare(double, double)}一致，NaN等于NaN，0.0不等于-0.0，
 * 与编码后的字节是否相同保持一致。
 */
@EqualsAndHashCode
@ToString
public class RespDouble implements RespData {
    private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?");

    @Getter
    private final double value;

    public static RespDouble with(double value) {
        return new RespDouble(value);
    }

    /**
     * 解析线上格式的浮点数文本
     *
     * @param s 文本，如1.5、-2e10、inf、-inf、nan
     * @return double帧
     * @throws NumberFormatException 非法的浮点数文本
     */
    public static RespDouble parse(String s) {
        switch (s.toLowerCase(Locale.ROOT)) {
            case "inf":
            case "+inf":
                return new RespDouble(Double.POSITIVE_INFINITY);
            case "-inf":
                return new RespDouble(Double.NEGATIVE_INFINITY);
            case "nan":
                return new RespDouble(Double.NaN);
            default:
                if (!DECIMAL.matcher(s).matches()) {
                    throw new NumberFormatException("not a resp double: " + s);
                }
                return new RespDouble(Double.parseDouble(s));
        }
    }

    private RespDouble(double value) {
        this.value = value;
    }

    @Override
    public RespType getType() {
        return RespType.DOUBLE;
    }

    @Override
    public byte[] toBytes() {
        return (RespType.DOUBLE.getFirstChar() + format(value) + "\r\n").getBytes(StandardCharsets.US_ASCII);
    }

    static String format(double d) {
        if (Double.isNaN(d)) {
            return "nan";
        }
        if (Double.isInfinite(d)) {
            return d > 0 ? "inf" : "-inf";
        }
        return Double.toString(d).replace('E', 'e');
    }
}
