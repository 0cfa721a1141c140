package work.paramerge.value;

/**
 * In-memory representation of a parsed parameter document node.
 *
 * <p>Values are immutable. {@link MappingValue} and {@link SequenceValue} own their children and the tree never
 * contains cycles.
 */
public sealed interface ParameterValue
    permits NullValue, BoolValue, IntValue, FloatValue, StringValue, SequenceValue, MappingValue {

    /**
     * Converts the value to plain Java objects ({@code null}, {@link Boolean}, {@link Integer} or {@link Long},
     * {@link Double}, {@link String}, {@link java.util.List} and {@link java.util.LinkedHashMap}).
     */
    Object toPlainObject();

    default boolean isMapping() {
        return this instanceof MappingValue;
    }
}
