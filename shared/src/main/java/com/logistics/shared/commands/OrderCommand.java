package com.logistics.shared.commands;

import java.util.UUID;

import com.logistics.shared.commands.Commands.ChangeAddressCommand;
import com.logistics.shared.commands.Commands.FailDeliveryCommand;
import com.logistics.shared.commands.Commands.MarkOrderDeliveredCommand;
import com.logistics.shared.commands.Commands.PackOrderCommand;
import com.logistics.shared.commands.Commands.PlaceOrderCommand;
import com.logistics.shared.commands.Commands.ShipOrderCommand;

/**
 * A request to change one order. Every command targets exactly one aggregate.
 */
public sealed interface OrderCommand
        permits PlaceOrderCommand, PackOrderCommand, ShipOrderCommand,
                ChangeAddressCommand, FailDeliveryCommand, MarkOrderDeliveredCommand {

    UUID orderId();
}
