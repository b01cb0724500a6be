package com.logistics.shared.commands;

import java.util.Arrays;
import java.util.Optional;

import com.logistics.shared.commands.Commands.ChangeAddressCommand;
import com.logistics.shared.commands.Commands.FailDeliveryCommand;
import com.logistics.shared.commands.Commands.MarkOrderDeliveredCommand;
import com.logistics.shared.commands.Commands.PackOrderCommand;
import com.logistics.shared.commands.Commands.PlaceOrderCommand;
import com.logistics.shared.commands.Commands.ShipOrderCommand;

/**
 * Wire names of the command envelope's {@code commandType} field and the
 * payload shape each one carries.
 */
public enum CommandType {

    PLACE_ORDER("PlaceOrder", PlaceOrderCommand.class),
    PACK_ORDER("PackOrder", PackOrderCommand.class),
    SHIP_ORDER("ShipOrder", ShipOrderCommand.class),
    CHANGE_ADDRESS("ChangeAddress", ChangeAddressCommand.class),
    FAIL_DELIVERY("FailDelivery", FailDeliveryCommand.class),
    MARK_DELIVERED("MarkDelivered", MarkOrderDeliveredCommand.class);

    private final String wireName;
    private final Class<? extends OrderCommand> commandClass;

    CommandType(String wireName, Class<? extends OrderCommand> commandClass) {
        this.wireName = wireName;
        this.commandClass = commandClass;
    }

    public String wireName() {
        return wireName;
    }

    public Class<? extends OrderCommand> commandClass() {
        return commandClass;
    }

    /** Exact, case-sensitive match on the wire name. */
    public static Optional<CommandType> fromWireName(String wireName) {
        return Arrays.stream(values())
                .filter(type -> type.wireName.equals(wireName))
                .findFirst();
    }

    public static CommandType of(OrderCommand command) {
        return Arrays.stream(values())
                .filter(type -> type.commandClass.isInstance(command))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException(
                        "No command type for " + command.getClass().getSimpleName()));
    }
}
