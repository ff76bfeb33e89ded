package com.flint.aggregator.controller.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * {@code credential} is what the provider handed back on its callback: an access token, or
 * {@code userId:userSecret} for the brokerage, or a wallet address.
 */
public record LinkCompleteRequestDto(@NotBlank String credential) {
}
