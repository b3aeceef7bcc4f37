package com.nayem.sagaflow.saga;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Base64;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable typed value stored in a {@link SagaContext}.
 * <p>
 * Only the kinds listed in {@link Kind} are accepted so a context always survives
 * a trip through JSON or a table column.
 * </p>
 */
public final class ContextValue {

    /** Map key used when a blob is flattened for serialization. */
    public static final String BLOB_MARKER = "@blob";

    public enum Kind {
        STRING,
        INT,
        FLOAT,
        BOOL,
        STRING_LIST,
        BLOB
    }

    private final Kind kind;
    private final Object value;

    private ContextValue(Kind kind, Object value) {
        this.kind = kind;
        this.value = value;
    }

    public static ContextValue ofString(String value) {
        return new ContextValue(Kind.STRING, Objects.requireNonNull(value, "value"));
    }

    public static ContextValue ofInt(long value) {
        return new ContextValue(Kind.INT, value);
    }

    public static ContextValue ofFloat(double value) {
        return new ContextValue(Kind.FLOAT, value);
    }

    public static ContextValue ofBool(boolean value) {
        return new ContextValue(Kind.BOOL, value);
    }

    public static ContextValue ofStringList(List<String> value) {
        return new ContextValue(Kind.STRING_LIST, List.copyOf(value));
    }

    public static ContextValue ofBlob(byte[] value) {
        return new ContextValue(Kind.BLOB, value.clone());
    }

    /**
     * Converts a plain Java value into a context value.
     *
     * @throws IllegalArgumentException for null or unsupported types
     */
    public static ContextValue of(Object raw) {
        if (raw == null) {
            throw new IllegalArgumentException("context values must not be null");
        }
        if (raw instanceof ContextValue) {
            return (ContextValue) raw;
        }
        if (raw instanceof String) {
            return ofString((String) raw);
        }
        if (raw instanceof Integer || raw instanceof Long || raw instanceof Short || raw instanceof Byte) {
            return ofInt(((Number) raw).longValue());
        }
        if (raw instanceof Double || raw instanceof Float) {
            return ofFloat(((Number) raw).doubleValue());
        }
        if (raw instanceof Boolean) {
            return ofBool((Boolean) raw);
        }
        if (raw instanceof byte[]) {
            return ofBlob((byte[]) raw);
        }
        if (raw instanceof Collection) {
            List<String> strings = new ArrayList<>();
            for (Object item : (Collection<?>) raw) {
                if (!(item instanceof String)) {
                    throw new IllegalArgumentException("only string lists are supported, found element "
                            + (item == null ? "null" : item.getClass().getName()));
                }
                strings.add((String) item);
            }
            return ofStringList(strings);
        }
        if (raw instanceof Map) {
            Map<?, ?> map = (Map<?, ?>) raw;
            Object encoded = map.get(BLOB_MARKER);
            if (map.size() == 1 && encoded instanceof String) {
                return ofBlob(Base64.getDecoder().decode((String) encoded));
            }
        }
        throw new IllegalArgumentException("unsupported context value type: " + raw.getClass().getName());
    }

    public Kind kind() {
        return kind;
    }

    /**
     * @return the plain Java value (String, Long, Double, Boolean, List or a copy of the byte array)
     */
    public Object raw() {
        if (kind == Kind.BLOB) {
            return ((byte[]) value).clone();
        }
        return value;
    }

    /**
     * Form used by {@link SagaContext#toMap()}; blobs become a single-key map holding base64.
     */
    public Object toSerializable() {
        if (kind == Kind.BLOB) {
            return Map.of(BLOB_MARKER, Base64.getEncoder().encodeToString((byte[]) value));
        }
        return value;
    }

    public String asString(String defaultValue) {
        return kind == Kind.STRING ? (String) value : defaultValue;
    }

    public long asLong(long defaultValue) {
        if (kind == Kind.INT) {
            return (Long) value;
        }
        if (kind == Kind.FLOAT) {
            return (long) ((Double) value).doubleValue();
        }
        return defaultValue;
    }

    public double asDouble(double defaultValue) {
        if (kind == Kind.FLOAT) {
            return (Double) value;
        }
        if (kind == Kind.INT) {
            return ((Long) value).doubleValue();
        }
        return defaultValue;
    }

    public boolean asBool(boolean defaultValue) {
        return kind == Kind.BOOL ? (Boolean) value : defaultValue;
    }

    @SuppressWarnings("unchecked")
    public List<String> asStringList(List<String> defaultValue) {
        return kind == Kind.STRING_LIST ? (List<String>) value : defaultValue;
    }

    public byte[] asBlob(byte[] defaultValue) {
        return kind == Kind.BLOB ? ((byte[]) value).clone() : defaultValue;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ContextValue)) {
            return false;
        }
        ContextValue other = (ContextValue) o;
        if (kind != other.kind) {
            return false;
        }
        if (kind == Kind.BLOB) {
            return Arrays.equals((byte[]) value, (byte[]) other.value);
        }
        return value.equals(other.value);
    }

    @Override
    public int hashCode() {
        return kind == Kind.BLOB ? Arrays.hashCode((byte[]) value) : Objects.hash(kind, value);
    }

    @Override
    public String toString() {
        return kind == Kind.BLOB ? "blob[" + ((byte[]) value).length + "]" : String.valueOf(value);
    }
}
