package prop.formula;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

public final class Assignment {
    private final Map<String, Boolean> values;

    public Assignment(Map<String, Boolean> values) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public static Assignment of(Object... namesAndValues) {
        if (namesAndValues.length % 2 != 0) {
            throw new IllegalArgumentException("Expected name/value pairs");
        }
        Map<String, Boolean> map = new LinkedHashMap<>();
        for (int i = 0; i < namesAndValues.length; i += 2) {
            map.put((String) namesAndValues[i], (Boolean) namesAndValues[i + 1]);
        }
        return new Assignment(map);
    }

    public boolean valueOf(String variable) {
        Boolean value = values.get(variable);
        if (value == null) {
            throw new UnboundVariableException(variable);
        }
        return value;
    }

    public boolean isBound(String variable) {
        return values.containsKey(variable);
    }

    public Map<String, Boolean> asMap() {
        return values;
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof Assignment other && values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(values);
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
