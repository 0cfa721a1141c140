package work.paramerge.value;

import java.util.Objects;

public record StringValue(String value) implements ParameterValue {
    public StringValue {
        Objects.requireNonNull(value, "value");
    }

    public static StringValue of(String value) {
        return new StringValue(value);
    }

    @Override
    public Object toPlainObject() {
        return value;
    }

    @Override
    public String toString() {
        return value;
    }
}
