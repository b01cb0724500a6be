package com.logistics.order.handler;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Component;

import com.logistics.shared.commands.OrderCommand;

import lombok.extern.slf4j.Slf4j;

/**
 * Routes a command to the handler registered for its class.
 */
@Slf4j
@Component
public class CommandDispatcher {

    private final Map<Class<?>, CommandHandler<?>> handlers = new HashMap<>();

    public CommandDispatcher(List<CommandHandler<?>> handlers) {
        for (CommandHandler<?> handler : handlers) {
            CommandHandler<?> previous = this.handlers.put(handler.commandType(), handler);
            if (previous != null) {
                throw new IllegalStateException("Two handlers registered for " + handler.commandType().getSimpleName()
                        + ": " + previous.getClass().getSimpleName() + ", " + handler.getClass().getSimpleName());
            }
        }
        log.info("Command handlers registered: {}", this.handlers.keySet().stream().map(Class::getSimpleName).sorted().toList());
    }

    @SuppressWarnings("unchecked")
    public <C extends OrderCommand> void dispatch(C command) {
        CommandHandler<C> handler = (CommandHandler<C>) handlers.get(command.getClass());
        if (handler == null) {
            throw new IllegalStateException("No handler registered for " + command.getClass().getSimpleName());
        }
        handler.handle(command);
    }
}
