package com.nayem.sagaflow.saga;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Thread-safe data bag handed to every step of a saga.
 * <p>
 * Getters coerce between compatible kinds and fall back to the supplied default on
 * a mismatch, so {@code getInt} accepts integer and floating point values alike.
 * </p>
 *
 * <pre>{@code
 * SagaContext context = new SagaContext();
 * context.set("order_id", "order-42");
 * context.set("amount", 99.5);
 * double amount = context.getDouble("amount", 0);
 * }</pre>
 */
public class SagaContext {

    public static final String CORRELATION_ID_KEY = "correlation_id";

    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, ContextValue> data = new LinkedHashMap<>();
    private final Map<String, ContextValue> custom = new HashMap<>();
    private String correlationId;
    private Duration timeout = Duration.ZERO;
    private RetryPolicy retryPolicy;
    private Instant createdAt;
    private Instant updatedAt;

    public SagaContext() {
        this.createdAt = Instant.now();
        this.updatedAt = createdAt;
    }

    public static SagaContext fromMap(Map<String, ?> values) {
        SagaContext context = new SagaContext();
        context.loadMap(values);
        return context;
    }

    /**
     * Rebuilds a persisted context, keeping its original timestamps.
     */
    public static SagaContext restore(Map<String, ?> values, Instant createdAt, Instant updatedAt) {
        SagaContext context = fromMap(values);
        context.lock.writeLock().lock();
        try {
            if (createdAt != null) {
                context.createdAt = createdAt;
            }
            context.updatedAt = updatedAt != null ? updatedAt : context.createdAt;
        } finally {
            context.lock.writeLock().unlock();
        }
        return context;
    }

    public void set(String key, Object value) {
        ContextValue converted = ContextValue.of(value);
        lock.writeLock().lock();
        try {
            data.put(key, converted);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * @return the plain value for {@code key}, or {@code null} when absent
     */
    public Object get(String key) {
        ContextValue value = getValue(key);
        return value == null ? null : value.raw();
    }

    public ContextValue getValue(String key) {
        lock.readLock().lock();
        try {
            return data.get(key);
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean containsKey(String key) {
        lock.readLock().lock();
        try {
            return data.containsKey(key);
        } finally {
            lock.readLock().unlock();
        }
    }

    public void remove(String key) {
        lock.writeLock().lock();
        try {
            data.remove(key);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public Set<String> keys() {
        lock.readLock().lock();
        try {
            return new TreeSet<>(data.keySet());
        } finally {
            lock.readLock().unlock();
        }
    }

    public String getString(String key, String defaultValue) {
        ContextValue value = getValue(key);
        return value == null ? defaultValue : value.asString(defaultValue);
    }

    public String getString(String key) {
        return getString(key, "");
    }

    public int getInt(String key, int defaultValue) {
        ContextValue value = getValue(key);
        return value == null ? defaultValue : (int) value.asLong(defaultValue);
    }

    public long getLong(String key, long defaultValue) {
        ContextValue value = getValue(key);
        return value == null ? defaultValue : value.asLong(defaultValue);
    }

    public double getDouble(String key, double defaultValue) {
        ContextValue value = getValue(key);
        return value == null ? defaultValue : value.asDouble(defaultValue);
    }

    public boolean getBool(String key, boolean defaultValue) {
        ContextValue value = getValue(key);
        return value == null ? defaultValue : value.asBool(defaultValue);
    }

    public List<String> getStringList(String key) {
        ContextValue value = getValue(key);
        return value == null ? List.of() : value.asStringList(List.of());
    }

    public byte[] getBlob(String key) {
        ContextValue value = getValue(key);
        return value == null ? null : value.asBlob(null);
    }

    public String getCorrelationId() {
        lock.readLock().lock();
        try {
            return correlationId;
        } finally {
            lock.readLock().unlock();
        }
    }

    public void setCorrelationId(String correlationId) {
        lock.writeLock().lock();
        try {
            this.correlationId = correlationId;
            this.updatedAt = Instant.now();
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * @return a copy of the metadata; changing it never affects this context
     */
    public SagaMetadata metadata() {
        lock.readLock().lock();
        try {
            return new SagaMetadata(timeout, retryPolicy, correlationId, createdAt, updatedAt, custom);
        } finally {
            lock.readLock().unlock();
        }
    }

    public void setTimeout(Duration timeout) {
        lock.writeLock().lock();
        try {
            this.timeout = timeout == null ? Duration.ZERO : timeout;
            this.updatedAt = Instant.now();
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void setRetryPolicy(RetryPolicy retryPolicy) {
        lock.writeLock().lock();
        try {
            this.retryPolicy = retryPolicy;
            this.updatedAt = Instant.now();
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void setCustomValue(String key, Object value) {
        ContextValue converted = ContextValue.of(value);
        lock.writeLock().lock();
        try {
            custom.put(key, converted);
            this.updatedAt = Instant.now();
        } finally {
            lock.writeLock().unlock();
        }
    }

    void touch(Instant at) {
        lock.writeLock().lock();
        try {
            this.updatedAt = at;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Flattens the data and the correlation id into JSON-friendly values.
     */
    public Map<String, Object> toMap() {
        lock.readLock().lock();
        try {
            Map<String, Object> result = new LinkedHashMap<>();
            data.forEach((key, value) -> result.put(key, value.toSerializable()));
            if (correlationId != null && !correlationId.isEmpty()) {
                result.put(CORRELATION_ID_KEY, correlationId);
            }
            return result;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Replaces the data with {@code values}; {@code correlation_id} moves to the correlation id.
     * Null entries are skipped.
     */
    public void loadMap(Map<String, ?> values) {
        Map<String, ContextValue> converted = new LinkedHashMap<>();
        String newCorrelationId = null;
        for (Map.Entry<String, ?> entry : values.entrySet()) {
            if (CORRELATION_ID_KEY.equals(entry.getKey())) {
                if (entry.getValue() instanceof String) {
                    newCorrelationId = (String) entry.getValue();
                }
                continue;
            }
            if (entry.getValue() != null) {
                converted.put(entry.getKey(), ContextValue.of(entry.getValue()));
            }
        }
        lock.writeLock().lock();
        try {
            data.clear();
            data.putAll(converted);
            if (newCorrelationId != null) {
                correlationId = newCorrelationId;
            }
            updatedAt = Instant.now();
        } finally {
            lock.writeLock().unlock();
        }
    }
}
