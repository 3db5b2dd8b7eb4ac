package autoexplore.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Objects;

/**
 * Deduplication key for an {@link Element}, e.g. {@code text:Settings} or
 * {@code id:com.example:id/login}.
 *
 * <p>Two identities with the same value denote the same action target no
 * matter which screen they were observed on. Serialized as a bare string.
 */
public final class ElementIdentity {

    public static final String TEXT_PREFIX          = "text:";
    public static final String ACCESSIBILITY_PREFIX = "acc:";
    public static final String ID_PREFIX            = "id:";
    public static final String BOUNDS_PREFIX        = "bounds:";

    private final String value;

    private ElementIdentity(String value) {
        this.value = Objects.requireNonNull(value, "value");
    }

    @JsonCreator
    public static ElementIdentity of(String value) {
        return new ElementIdentity(value);
    }

    @JsonValue
    public String value() {
        return value;
    }

    /**
     * File-name friendly form: {@code ':'} replaced by {@code '_'}, other unsafe
     * characters dropped, truncated to {@code maxLength}.
     */
    public String toSafeName(int maxLength) {
        String safe = value.replace(':', '_').replaceAll("[^a-zA-Z0-9_\\-.]", "_");
        return safe.length() > maxLength ? safe.substring(0, maxLength) : safe;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ElementIdentity)) return false;
        return value.equals(((ElementIdentity) o).value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }
}
