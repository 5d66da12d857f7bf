package io.github.redlet.resp;

/**
 * RESP帧类型，每种类型由帧的第一个字节标识。
 *
 * @author zy
 */
public enum RespType {
    SIMPLE_STRING('+'),
    ERROR('-'),
    INTEGER(':'),
    BULK_STRING('$'),
    ARRAY('*'),
    NULL('_'),
    BOOLEAN('#'),
    DOUBLE(','),
    MAP('%'),
    SET('~');

    private final char firstChar;

    RespType(char firstChar) {
        this.firstChar = firstChar;
    }

    public char getFirstChar() {
        return firstChar;
    }

    public byte getFirstByte() {
        return (byte) firstChar;
    }

    /**
     * 根据帧的第一个字节查找类型
     *
     * @param b 第一个字节
     * @return 帧类型
     * @throws UnknownRespTypeException 无法识别的字节
     */
    public static RespType of(byte b) {
        switch ((char) b) {
            case '+':
                return SIMPLE_STRING;
            case '-':
                return ERROR;
            case ':':
                return INTEGER;
            case '$':
                return BULK_STRING;
            case '*':
                return ARRAY;
            case '_':
                return NULL;
            case '#':
                return BOOLEAN;
            case ',':
                return DOUBLE;
            case '%':
                return MAP;
            case '~':
                return SET;
            default:
                throw new UnknownRespTypeException(b);
        }
    }
}
