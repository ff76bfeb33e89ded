package com.flint.aggregator.controller;

import com.flint.aggregator.controller.dto.AccountResponseDto;
import com.flint.aggregator.controller.dto.ConnectionFailureDto;
import com.flint.aggregator.controller.dto.LinkCompleteRequestDto;
import com.flint.aggregator.controller.dto.LinkStartResponseDto;
import com.flint.aggregator.controller.dto.RefreshResponseDto;
import com.flint.aggregator.link.LinkCallbackUrls;
import com.flint.aggregator.link.LinkTransport;
import com.flint.aggregator.model.AccountProvider;
import com.flint.aggregator.provider.LinkStart;
import com.flint.aggregator.provider.ProviderClientRegistry;
import com.flint.aggregator.security.CurrentUserProvider;
import com.flint.aggregator.service.AccountAggregationService;
import com.flint.aggregator.service.AggregationResult;
import jakarta.validation.Valid;
import java.util.Locale;
import java.util.UUID;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Server half of account linking: hands out the provider's hosted page and stores the credential
 * the provider returns. The client decides success by looking at the refreshed accounts.
 */
@RestController
@RequestMapping("/link")
public class LinkController {

    private final ProviderClientRegistry clients;
    private final LinkCallbackUrls callbackUrls;
    private final AccountAggregationService aggregationService;
    private final CurrentUserProvider currentUserProvider;

    public LinkController(
            ProviderClientRegistry clients,
            LinkCallbackUrls callbackUrls,
            AccountAggregationService aggregationService,
            CurrentUserProvider currentUserProvider
    ) {
        this.clients = clients;
        this.callbackUrls = callbackUrls;
        this.aggregationService = aggregationService;
        this.currentUserProvider = currentUserProvider;
    }

    @PostMapping("/{provider}/start")
    public LinkStartResponseDto start(
            @PathVariable String provider,
            @RequestParam(defaultValue = "popup") String transport
    ) {
        UUID userId = currentUserProvider.requireCurrentUserId();
        AccountProvider accountProvider = AccountProvider.fromKey(provider);
        LinkTransport linkTransport = parseTransport(transport);
        String callbackUrl = callbackUrls.callbackUrl(accountProvider, linkTransport);
        LinkStart start = clients.require(accountProvider).startLinkFlow(userId.toString(), callbackUrl);
        return new LinkStartResponseDto(
                accountProvider.key(),
                linkTransport.name().toLowerCase(Locale.ROOT),
                start.url(),
                start.callbackUrl(),
                AccountsController.traceId()
        );
    }

    @PostMapping("/{provider}/complete")
    public RefreshResponseDto complete(@PathVariable String provider, @RequestBody @Valid LinkCompleteRequestDto request) {
        UUID userId = currentUserProvider.requireCurrentUserId();
        AggregationResult result = aggregationService.linkConnection(userId, AccountProvider.fromKey(provider), request.credential());
        return new RefreshResponseDto(
                result.accounts().stream().map(AccountResponseDto::from).toList(),
                result.failures().stream().map(ConnectionFailureDto::from).toList(),
                AccountsController.traceId()
        );
    }

    private static LinkTransport parseTransport(String transport) {
        String normalized = transport.trim().toUpperCase(Locale.ROOT);
        if ("MOBILE".equals(normalized)) {
            return LinkTransport.MOBILE_DEEPLINK;
        }
        try {
            return LinkTransport.valueOf(normalized);
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unknown transport: " + transport);
        }
    }
}
