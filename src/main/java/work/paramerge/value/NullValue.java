package work.paramerge.value;

/**
 * Explicit {@code null} leaf. Replaces and is replaced like any other scalar.
 */
public enum NullValue implements ParameterValue {
    INSTANCE;

    @Override
    public Object toPlainObject() {
        return null;
    }

    @Override
    public String toString() {
        return "null";
    }
}
