package com.flint.aggregator.controller;

import com.flint.aggregator.controller.dto.QuoteResponseDto;
import com.flint.aggregator.controller.dto.QuotesResponseDto;
import com.flint.aggregator.pricing.PriceAggregator;
import java.util.List;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/quotes")
public class QuotesController {

    static final int MAX_SYMBOLS = 50;

    private final PriceAggregator priceAggregator;

    public QuotesController(PriceAggregator priceAggregator) {
        this.priceAggregator = priceAggregator;
    }

    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    public QuotesResponseDto quotes(@RequestParam List<String> symbols) {
        List<String> requested = symbols.stream().filter(s -> s != null && !s.isBlank()).toList();
        if (requested.isEmpty()) {
            throw new IllegalArgumentException("symbols must not be empty");
        }
        if (requested.size() > MAX_SYMBOLS) {
            throw new IllegalArgumentException("at most " + MAX_SYMBOLS + " symbols per request");
        }
        List<QuoteResponseDto> quotes = priceAggregator.getPrices(requested).values().stream()
                .map(QuoteResponseDto::from)
                .toList();
        return new QuotesResponseDto(quotes, AccountsController.traceId());
    }
}
