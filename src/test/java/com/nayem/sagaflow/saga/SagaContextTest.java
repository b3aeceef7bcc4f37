package com.nayem.sagaflow.saga;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class SagaContextTest {

    @Test
    void testTypedGettersCoerceNumbers() {
        SagaContext context = new SagaContext();
        context.set("count", 3);
        context.set("amount", 99.5);

        assertEquals(3, context.getInt("count", 0));
        assertEquals(3.0, context.getDouble("count", 0));
        assertEquals(99, context.getInt("amount", 0));
        assertEquals(99.5, context.getDouble("amount", 0));
    }

    @Test
    void testMismatchedKindFallsBackToDefault() {
        SagaContext context = new SagaContext();
        context.set("name", "order-1");
        context.set("flag", true);

        assertEquals(-1, context.getInt("name", -1));
        assertEquals("fallback", context.getString("flag", "fallback"));
        assertFalse(context.getBool("name", false));
        assertEquals("", context.getString("missing"));
        assertNull(context.get("missing"));
    }

    @Test
    void testUnsupportedValuesRejected() {
        SagaContext context = new SagaContext();

        assertThrows(IllegalArgumentException.class, () -> context.set("when", Instant.now()));
        assertThrows(IllegalArgumentException.class, () -> context.set("nothing", null));
        assertThrows(IllegalArgumentException.class, () -> context.set("mixed", List.of("a", 1)));
    }

    @Test
    void testToMapAndFromMapPreserveValues() {
        SagaContext context = new SagaContext();
        context.set("order_id", "o-1");
        context.set("quantity", 2);
        context.set("price", 10.25);
        context.set("express", true);
        context.set("items", List.of("sku-1", "sku-2"));
        context.set("signature", new byte[]{1, 2, 3});
        context.setCorrelationId("corr-1");

        Map<String, Object> flattened = context.toMap();
        SagaContext restored = SagaContext.fromMap(flattened);

        assertEquals("corr-1", flattened.get(SagaContext.CORRELATION_ID_KEY));
        assertEquals("corr-1", restored.getCorrelationId());
        assertEquals("o-1", restored.getString("order_id"));
        assertEquals(2, restored.getInt("quantity", 0));
        assertEquals(10.25, restored.getDouble("price", 0));
        assertTrue(restored.getBool("express", false));
        assertEquals(List.of("sku-1", "sku-2"), restored.getStringList("items"));
        assertArrayEquals(new byte[]{1, 2, 3}, restored.getBlob("signature"));
        assertFalse(restored.containsKey(SagaContext.CORRELATION_ID_KEY));
    }

    @Test
    void testLoadMapSkipsNullEntries() {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("kept", "yes");
        values.put("dropped", null);

        SagaContext context = SagaContext.fromMap(values);

        assertEquals(Set.of("kept"), context.keys());
    }

    @Test
    void testRestoreKeepsTimestamps() {
        Instant created = Instant.parse("2024-01-01T10:00:00Z");
        Instant updated = Instant.parse("2024-01-01T10:05:00Z");

        SagaContext context = SagaContext.restore(Map.of("a", "b"), created, updated);

        assertEquals(created, context.metadata().createdAt());
        assertEquals(updated, context.metadata().updatedAt());
    }

    @Test
    void testMetadataIsACopy() {
        SagaContext context = new SagaContext();
        context.setTimeout(Duration.ofSeconds(5));
        context.setRetryPolicy(RetryPolicy.simple(2));
        context.setCustomValue("tenant", "acme");

        SagaMetadata metadata = context.metadata();
        context.setCustomValue("tenant", "other");

        assertEquals(Duration.ofSeconds(5), metadata.timeout());
        assertEquals(2, metadata.retryPolicy().maxAttempts());
        assertEquals("acme", metadata.custom().get("tenant").asString(""));
    }

    @Test
    void testConcurrentWritersDoNotLoseKeys() throws Exception {
        SagaContext context = new SagaContext();
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch done = new CountDownLatch(8);
        for (int t = 0; t < 8; t++) {
            int thread = t;
            pool.execute(() -> {
                for (int i = 0; i < 100; i++) {
                    context.set("k-" + thread + "-" + i, i);
                    context.getInt("k-" + thread + "-" + i, -1);
                }
                done.countDown();
            });
        }

        assertTrue(done.await(5, TimeUnit.SECONDS));
        pool.shutdown();
        assertEquals(800, context.keys().size());
    }
}
