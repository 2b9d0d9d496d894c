package com.lexis.activation.runtime.normalization;

import com.lexis.activation.api.model.VariableType;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Objects;

/**
 * A value coerced to its declared type.
 *
 * <p>The payload is a {@link Boolean}, a trimmed lower-case {@link String}, a
 * {@link BigDecimal}, a {@link LocalDate} or an unmodifiable {@code List<String>} of
 * normalized strings, depending on {@link #type()}.
 */
public record NormalizedValue(VariableType type, Object value) {

    public NormalizedValue {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(value, "value");
    }

    public boolean asBoolean() {
        return (Boolean) value;
    }

    public BigDecimal asNumber() {
        return (BigDecimal) value;
    }

    public LocalDate asDate() {
        return (LocalDate) value;
    }

    @SuppressWarnings("unchecked")
    public List<String> asList() {
        return (List<String>) value;
    }

    /**
     * Lower-case text form used by the string operators.
     */
    public String text() {
        return switch (type) {
            case STRING -> (String) value;
            case NUMBER -> asNumber().stripTrailingZeros().toPlainString();
            case LIST_OF_STRING -> String.join(", ", asList());
            default -> value.toString();
        };
    }

    /**
     * Type-aware equality: numbers compare by value so {@code 1.0} equals {@code 1}, lists
     * compare as sets.
     */
    public boolean sameAs(NormalizedValue other) {
        if (other == null || type != other.type) {
            return false;
        }
        return switch (type) {
            case NUMBER -> asNumber().compareTo(other.asNumber()) == 0;
            case LIST_OF_STRING -> asList().size() == other.asList().size()
                    && asList().containsAll(other.asList())
                    && other.asList().containsAll(asList());
            default -> value.equals(other.value);
        };
    }
}
