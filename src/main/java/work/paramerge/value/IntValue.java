package work.paramerge.value;

/**
 * Integral number. Values that fit 32 bits surface as {@link Integer}, wider ones as {@link Long}.
 */
public record IntValue(long value) implements ParameterValue {
    public static IntValue of(long value) {
        return new IntValue(value);
    }

    public boolean isInt32() {
        return value >= Integer.MIN_VALUE && value <= Integer.MAX_VALUE;
    }

    @Override
    public Object toPlainObject() {
        if (isInt32()) {
            return (int) value;
        }
        return value;
    }

    @Override
    public String toString() {
        return Long.toString(value);
    }
}
