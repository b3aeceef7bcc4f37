package com.nayem.sagaflow.saga;

import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class SagaRegistryTest {

    private final SagaDefinition order = SagaBuilder.newSaga("order")
            .step(FunctionalSagaStep.builder().name("a").execute(ctx -> { }).build())
            .build();

    @Test
    void testRegisterAndResolve() {
        SagaRegistry registry = new SagaRegistry();
        registry.register(order);
        registry.register("order-v2", order);

        assertSame(order, registry.get("order"));
        assertSame(order, registry.get("order-v2"));
        assertEquals(Set.of("order", "order-v2"), registry.names());
        assertTrue(registry.find("order").isPresent());
    }

    @Test
    void testUnknownDefinition() {
        SagaRegistry registry = new SagaRegistry();

        SagaDefinitionNotFoundException error = assertThrows(SagaDefinitionNotFoundException.class,
                () -> registry.get("missing"));
        assertTrue(error.getMessage().contains("missing"));
        assertTrue(registry.find("missing").isEmpty());
        assertThrows(SagaDefinitionNotFoundException.class, () -> registry.get(null));
    }

    @Test
    void testBlankNameRejected() {
        assertThrows(IllegalArgumentException.class, () -> new SagaRegistry().register(" ", order));
    }
}
