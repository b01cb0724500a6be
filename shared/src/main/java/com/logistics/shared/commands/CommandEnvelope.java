package com.logistics.shared.commands;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Transport wrapper for a command: a type tag plus an opaque payload that is
 * decoded according to {@link CommandType#commandClass()}.
 *
 * <pre>
 * { "commandType": "PackOrder", "payload": { "orderId": "...", "warehouseId": "WH1", "weight": 2.5 } }
 * </pre>
 */
public record CommandEnvelope(String commandType, JsonNode payload) {
}
