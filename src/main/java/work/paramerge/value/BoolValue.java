package work.paramerge.value;

public record BoolValue(boolean value) implements ParameterValue {
    public static final BoolValue TRUE = new BoolValue(true);
    public static final BoolValue FALSE = new BoolValue(false);

    public static BoolValue of(boolean value) {
        return value ? TRUE : FALSE;
    }

    @Override
    public Object toPlainObject() {
        return value;
    }

    @Override
    public String toString() {
        return Boolean.toString(value);
    }
}
