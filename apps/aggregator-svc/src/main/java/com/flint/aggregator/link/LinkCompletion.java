package com.flint.aggregator.link;

import java.util.Optional;
import java.util.UUID;

public record LinkCompletion(UUID sessionId, LinkTransport transport, LinkTrigger trigger, Optional<String> deepLinkUrl) {
}
