package com.nayem.sagaflow.saga;

import com.nayem.sagaflow.command.Command;
import com.nayem.sagaflow.command.CommandBus;

import java.time.Duration;
import java.util.function.Function;

/**
 * Step that sends a command through a {@link CommandBus}, and a compensating command on rollback.
 * <p>
 * Commands are built from the context so they can carry the saga correlation id.
 * </p>
 */
public class CommandSagaStep implements SagaStep {

    private final String name;
    private final CommandBus commandBus;
    private final Function<SagaContext, ? extends Command> forward;
    private final Function<SagaContext, ? extends Command> compensation;
    private final StepOptions options;

    public CommandSagaStep(String name, CommandBus commandBus,
            Function<SagaContext, ? extends Command> forward,
            Function<SagaContext, ? extends Command> compensation) {
        this(name, commandBus, forward, compensation, StepOptions.defaults());
    }

    public CommandSagaStep(String name, CommandBus commandBus,
            Function<SagaContext, ? extends Command> forward,
            Function<SagaContext, ? extends Command> compensation,
            StepOptions options) {
        if (name == null || name.isBlank()) {
            throw new IllegalStateException("step name is required");
        }
        if (commandBus == null || forward == null) {
            throw new IllegalStateException("command bus and forward command are required for step " + name);
        }
        this.name = name;
        this.commandBus = commandBus;
        this.forward = forward;
        this.compensation = compensation;
        this.options = options == null ? StepOptions.defaults() : options;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public void execute(SagaContext context) throws Exception {
        commandBus.send(forward.apply(context));
    }

    @Override
    public void compensate(SagaContext context) throws Exception {
        if (compensation == null) {
            return;
        }
        Command command = compensation.apply(context);
        if (command != null) {
            commandBus.send(command);
        }
    }

    @Override
    public boolean canExecute(SagaContext context) {
        return options.allows(context);
    }

    @Override
    public Duration getTimeout() {
        return options.timeout();
    }

    @Override
    public RetryPolicy getRetryPolicy() {
        return options.retryPolicy();
    }
}
