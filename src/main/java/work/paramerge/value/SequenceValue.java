package work.paramerge.value;

import java.util.ArrayList;
import java.util.List;

/**
 * Ordered list of values. Always a leaf for merging: a later sequence replaces an earlier one wholesale.
 */
public record SequenceValue(List<ParameterValue> items) implements ParameterValue {
    public SequenceValue {
        items = List.copyOf(items);
    }

    public static SequenceValue of(ParameterValue... items) {
        return new SequenceValue(List.of(items));
    }

    public int size() {
        return items.size();
    }

    @Override
    public Object toPlainObject() {
        List<Object> list = new ArrayList<>(items.size());
        for (ParameterValue item : items) {
            list.add(item.toPlainObject());
        }
        return list;
    }

    @Override
    public String toString() {
        return items.toString();
    }
}
