package info.isaksson.erland.reacttoangular.rules;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Setter name to state name, e.g. {@code setCount -> count}. Lives in one {@link TranspileContext}.
 */
public final class AliasMap {

    private final Map<String, String> setterToState = new LinkedHashMap<>();

    void put(String setter, String state) {
        String previous = setterToState.putIfAbsent(setter, state);
        if (previous != null && !previous.equals(state)) {
            throw new IllegalStateException("setter '" + setter + "' already aliases '" + previous + "'");
        }
    }

    public boolean isSetter(String name) {
        return name != null && setterToState.containsKey(name);
    }

    /** State updated by {@code setter}, or null. */
    public String stateFor(String setter) {
        return setter == null ? null : setterToState.get(setter);
    }

    /** Setter aliasing {@code state}, or null. */
    public String setterFor(String state) {
        for (Map.Entry<String, String> e : setterToState.entrySet()) {
            if (e.getValue().equals(state)) return e.getKey();
        }
        return null;
    }

    public Set<String> setters() {
        return setterToState.keySet();
    }

    public int size() {
        return setterToState.size();
    }
}
