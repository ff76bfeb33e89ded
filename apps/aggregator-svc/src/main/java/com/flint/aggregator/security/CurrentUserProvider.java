package com.flint.aggregator.security;

import java.util.Optional;
import java.util.UUID;
import org.springframework.stereotype.Component;

@Component
public class CurrentUserProvider {

    public UUID requireCurrentUserId() {
        return currentUserId().orElseThrow(() -> new MissingUserException(
                "Request has no " + RequestContextFilter.USER_HEADER + " identity"));
    }

    public Optional<UUID> currentUserId() {
        return RequestContextHolder.userId();
    }

    public static class MissingUserException extends RuntimeException {
        public MissingUserException(String message) {
            super(message);
        }
    }
}
