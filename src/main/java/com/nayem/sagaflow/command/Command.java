package com.nayem.sagaflow.command;

/**
 * A request sent to another service through the {@link CommandBus}.
 */
public interface Command {

    String getCommandName();

    /**
     * @return correlation id of the saga that issued the command, may be {@code null}
     */
    default String getCorrelationId() {
        return null;
    }
}
