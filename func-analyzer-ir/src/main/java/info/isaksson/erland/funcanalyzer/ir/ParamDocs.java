package info.isaksson.erland.funcanalyzer.ir;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Parameter name to description mapping recovered from one docstring.
 *
 * <p>Immutable once built. Keys keep the order in which they were first seen; descriptions are
 * trimmed and never empty.</p>
 */
public final class ParamDocs {

    private static final ParamDocs EMPTY = new ParamDocs(Map.of());

    private final Map<String, String> descriptions;

    private ParamDocs(Map<String, String> descriptions) {
        this.descriptions = descriptions;
    }

    public static ParamDocs empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<String> description(String name) {
        return Optional.ofNullable(descriptions.get(name));
    }

    public boolean contains(String name) {
        return descriptions.containsKey(name);
    }

    public Set<String> names() {
        return descriptions.keySet();
    }

    public int size() {
        return descriptions.size();
    }

    public boolean isEmpty() {
        return descriptions.isEmpty();
    }

    /** Unmodifiable view in first-seen order. */
    public Map<String, String> asMap() {
        return descriptions;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ParamDocs)) return false;
        return descriptions.equals(((ParamDocs) o).descriptions);
    }

    @Override public int hashCode() {
        return Objects.hash(descriptions);
    }

    @Override public String toString() {
        return descriptions.toString();
    }

    /**
     * Accumulates entries where the first description seen for a name wins.
     * Blank names or descriptions are ignored.
     */
    public static final class Builder {
        private final Map<String, String> entries = new LinkedHashMap<>();

        private Builder() {}

        /** @return true if the entry was added */
        public boolean putIfAbsent(String name, String description) {
            if (name == null || name.isBlank() || description == null) return false;
            String d = description.strip();
            if (d.isEmpty()) return false;
            return entries.putIfAbsent(name.strip(), d) == null;
        }

        public boolean contains(String name) {
            return entries.containsKey(name);
        }

        public ParamDocs build() {
            if (entries.isEmpty()) return EMPTY;
            return new ParamDocs(Collections.unmodifiableMap(new LinkedHashMap<>(entries)));
        }
    }
}
