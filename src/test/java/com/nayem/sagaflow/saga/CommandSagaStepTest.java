package com.nayem.sagaflow.saga;

import com.nayem.sagaflow.command.Command;
import com.nayem.sagaflow.command.CommandBus;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class CommandSagaStepTest {

    @Test
    void testSendsForwardCommandBuiltFromContext() throws Exception {
        CommandBus bus = mock(CommandBus.class);
        CommandSagaStep step = new CommandSagaStep("reserve", bus,
                ctx -> new InventoryCommand("ReserveStock", ctx.getString("order_id"), ctx.getCorrelationId()),
                ctx -> new InventoryCommand("ReleaseStock", ctx.getString("order_id"), ctx.getCorrelationId()));
        SagaContext context = new SagaContext();
        context.set("order_id", "o-9");
        context.setCorrelationId("corr-9");

        step.execute(context);

        ArgumentCaptor<Command> sent = ArgumentCaptor.forClass(Command.class);
        verify(bus).send(sent.capture());
        assertEquals("ReserveStock", sent.getValue().getCommandName());
        assertEquals("corr-9", sent.getValue().getCorrelationId());
        assertEquals("o-9", ((InventoryCommand) sent.getValue()).orderId());
    }

    @Test
    void testCompensationSendsCompensatingCommand() throws Exception {
        CommandBus bus = mock(CommandBus.class);
        CommandSagaStep step = new CommandSagaStep("reserve", bus,
                ctx -> new InventoryCommand("ReserveStock", "o-1", null),
                ctx -> new InventoryCommand("ReleaseStock", "o-1", null));

        step.compensate(new SagaContext());

        ArgumentCaptor<Command> sent = ArgumentCaptor.forClass(Command.class);
        verify(bus).send(sent.capture());
        assertEquals("ReleaseStock", sent.getValue().getCommandName());
    }

    @Test
    void testMissingCompensationSendsNothing() throws Exception {
        CommandBus bus = mock(CommandBus.class);
        CommandSagaStep step = new CommandSagaStep("notify", bus,
                ctx -> new InventoryCommand("Notify", "o-1", null), null);

        step.compensate(new SagaContext());

        verify(bus, never()).send(any());
    }

    @Test
    void testBusFailureFailsStep() throws Exception {
        CommandBus bus = mock(CommandBus.class);
        doThrow(new IllegalStateException("broker down")).when(bus).send(any());
        SagaDefinition definition = SagaBuilder.newSaga("order")
                .step(new CommandSagaStep("reserve", bus, ctx -> new InventoryCommand("ReserveStock", "o-1", null),
                        null, StepOptions.defaults().withRetryPolicy(RetryPolicy.simple(1))))
                .build();
        SagaInstance saga = definition.createInstance(new SagaContext());

        SagaStepException error = assertThrows(SagaStepException.class, saga::execute);

        assertEquals("broker down", error.getCause().getMessage());
        assertEquals(List.of(StepStatus.FAILED),
                saga.getHistory().stream().map(SagaHistory::status).toList());
    }

    @Test
    void testConstructorValidation() {
        CommandBus bus = mock(CommandBus.class);
        assertThrows(IllegalStateException.class, () -> new CommandSagaStep("reserve", null,
                ctx -> new InventoryCommand("ReserveStock", "o-1", null), null));
        assertThrows(IllegalStateException.class, () -> new CommandSagaStep("reserve", bus, null, null));
    }

    record InventoryCommand(String name, String orderId, String correlationId) implements Command {

        @Override
        public String getCommandName() {
            return name;
        }

        @Override
        public String getCorrelationId() {
            return correlationId;
        }
    }
}
