package com.logistics.order.handler;

import com.logistics.shared.commands.OrderCommand;

/**
 * Handles one kind of order command: load, rebuild, mutate, append.
 * Handlers have no side effect other than the event store append.
 */
public interface CommandHandler<C extends OrderCommand> {

    Class<C> commandType();

    void handle(C command);
}
