package com.nayem.sagaflow.command;

public interface CommandBus {

    void send(Command command) throws Exception;
}
