package com.logistics.query.api;

import java.util.UUID;

/** Body of a 202: the command was handed to the command topic, not yet applied. */
public record CommandAcceptedResponse(UUID orderId, String commandType) {
}
