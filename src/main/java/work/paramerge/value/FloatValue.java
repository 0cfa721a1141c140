package work.paramerge.value;

public record FloatValue(double value) implements ParameterValue {
    public static FloatValue of(double value) {
        return new FloatValue(value);
    }

    @Override
    public Object toPlainObject() {
        return value;
    }

    @Override
    public String toString() {
        return Double.toString(value);
    }
}
