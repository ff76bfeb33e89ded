package com.flint.aggregator.pricing;

import com.flint.aggregator.config.FlintProperties;
import com.flint.aggregator.model.PriceQuote;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Near-real-time quotes from an ordered list of {@link QuoteSource}s.
 *
 * <p>On a cache miss every source is asked concurrently; once all of them have settled the answer of
 * the highest-priority source that answered wins. If none answered the caller gets a zero quote that
 * keeps the last known {@code lastUpdated}, never an exception. Successful answers are cached per
 * symbol for {@code cacheTtl}; concurrent misses for one symbol share a single fan-out.
 *
 * <p>Subscriptions are reference counted per symbol and share one polling loop, started by the first
 * subscriber and cancelled when the last one leaves. Each tick re-fetches the subscribed symbols
 * regardless of cache age. A tick does not block the polling thread; it dispatches once every source
 * has settled, and ticks that fire while the previous one is still waiting are skipped. A source that
 * hangs until its request timeout therefore stretches the effective refresh interval to that timeout.
 *
 * <p>Cache entries are only written from the completion of the fan-out for that symbol, as a single
 * map put, so the last completed fetch wins.
 */
@Component
public class PriceAggregator {

    private static final Logger log = LoggerFactory.getLogger(PriceAggregator.class);

    private final List<QuoteSource> sources;
    private final Clock clock;
    private final ScheduledExecutorService scheduler;
    private final Duration cacheTtl;
    private final Duration pollInterval;

    private final Map<String, CachedQuote> cache = new ConcurrentHashMap<>();
    private final Map<String, CompletableFuture<PriceQuote>> inFlight = new ConcurrentHashMap<>();
    private final AtomicBoolean tickRunning = new AtomicBoolean();

    // guarded by this
    private final Map<String, Integer> subscribedSymbols = new HashMap<>();
    private final Set<Subscriber> subscribers = new LinkedHashSet<>();
    private ScheduledFuture<?> pollingTask;

    @Autowired
    public PriceAggregator(
            List<QuoteSource> sources,
            FlintProperties properties,
            Clock clock,
            @Qualifier("pricingScheduler") ScheduledExecutorService scheduler
    ) {
        this(sources, clock, scheduler, properties.pricing().cacheTtl(), properties.pricing().pollInterval());
    }

    PriceAggregator(
            List<QuoteSource> sources,
            Clock clock,
            ScheduledExecutorService scheduler,
            Duration cacheTtl,
            Duration pollInterval
    ) {
        if (sources.isEmpty()) {
            throw new IllegalArgumentException("at least one quote source is required");
        }
        this.sources = sources.stream().sorted(Comparator.comparingInt(QuoteSource::priority)).toList();
        this.clock = clock;
        this.scheduler = scheduler;
        this.cacheTtl = cacheTtl;
        this.pollInterval = pollInterval;
    }

    public PriceQuote getPrice(String symbol) {
        return getPriceAsync(symbol).join();
    }

    public CompletableFuture<PriceQuote> getPriceAsync(String symbol) {
        String key = key(symbol);
        CachedQuote cached = cache.get(key);
        if (cached != null && isFresh(cached)) {
            log.debug("Quote cache hit for {} (source {})", key, cached.quote().source());
            return CompletableFuture.completedFuture(cached.quote());
        }
        return fetch(key);
    }

    /**
     * Quotes keyed by upper-case symbol, in request order. Symbols no source knows still get a zero quote.
     */
    public Map<String, PriceQuote> getPrices(Collection<String> symbols) {
        Map<String, CompletableFuture<PriceQuote>> pending = new LinkedHashMap<>();
        for (String symbol : symbols) {
            pending.computeIfAbsent(key(symbol), this::getPriceAsync);
        }
        return joinAll(pending);
    }

    public synchronized PriceSubscription subscribe(Collection<String> symbols, Consumer<Map<String, PriceQuote>> callback) {
        Set<String> keys = new LinkedHashSet<>();
        symbols.forEach(symbol -> keys.add(key(symbol)));
        if (keys.isEmpty()) {
            throw new IllegalArgumentException("at least one symbol is required");
        }
        Subscriber subscriber = new Subscriber(keys, callback);
        subscribers.add(subscriber);
        keys.forEach(key -> subscribedSymbols.merge(key, 1, Integer::sum));
        if (pollingTask == null) {
            long periodMillis = pollInterval.toMillis();
            pollingTask = scheduler.scheduleAtFixedRate(this::refreshSubscribed, periodMillis, periodMillis, TimeUnit.MILLISECONDS);
            log.debug("Quote polling started every {} ms", periodMillis);
        }
        return () -> unsubscribe(subscriber);
    }

    public synchronized boolean isPolling() {
        return pollingTask != null;
    }

    public synchronized int subscriberCount(String symbol) {
        return subscribedSymbols.getOrDefault(key(symbol), 0);
    }

    public void clearCache() {
        cache.clear();
    }

    private synchronized void unsubscribe(Subscriber subscriber) {
        if (!subscribers.remove(subscriber)) {
            return;
        }
        for (String key : subscriber.symbols) {
            subscribedSymbols.computeIfPresent(key, (symbol, count) -> count > 1 ? count - 1 : null);
        }
        if (subscribedSymbols.isEmpty() && pollingTask != null) {
            pollingTask.cancel(false);
            pollingTask = null;
            log.debug("Quote polling stopped, no subscribers left");
        }
    }

    private synchronized boolean isSubscribed(Subscriber subscriber) {
        return subscribers.contains(subscriber);
    }

    void refreshSubscribed() {
        Set<String> symbols;
        List<Subscriber> targets;
        synchronized (this) {
            if (subscribedSymbols.isEmpty()) {
                return;
            }
            symbols = new LinkedHashSet<>(subscribedSymbols.keySet());
            targets = new ArrayList<>(subscribers);
        }
        if (!tickRunning.compareAndSet(false, true)) {
            log.debug("Quote refresh tick skipped, previous tick still waiting on its sources");
            return;
        }
        try {
            Map<String, CompletableFuture<PriceQuote>> pending = new LinkedHashMap<>();
            symbols.forEach(symbol -> pending.put(symbol, fetch(symbol)));
            CompletableFuture.allOf(pending.values().toArray(new CompletableFuture<?>[0]))
                    .whenComplete((ignored, error) -> {
                        try {
                            dispatch(targets, joinAll(pending));
                        } catch (RuntimeException e) {
                            log.warn("Quote refresh tick failed: {}", e.toString());
                        } finally {
                            tickRunning.set(false);
                        }
                    });
        } catch (RuntimeException e) {
            // an exception escaping here would cancel the periodic task
            tickRunning.set(false);
            log.warn("Quote refresh tick failed: {}", e.toString());
        }
    }

    private void dispatch(List<Subscriber> targets, Map<String, PriceQuote> quotes) {
        for (Subscriber target : targets) {
            if (!isSubscribed(target)) {
                continue;
            }
            Map<String, PriceQuote> view = new LinkedHashMap<>();
            target.symbols.forEach(symbol -> view.put(symbol, quotes.get(symbol)));
            try {
                target.callback.accept(view);
            } catch (RuntimeException e) {
                log.warn("Quote subscriber callback failed: {}", e.toString());
            }
        }
    }

    private CompletableFuture<PriceQuote> fetch(String key) {
        CompletableFuture<PriceQuote> created = new CompletableFuture<>();
        CompletableFuture<PriceQuote> existing = inFlight.putIfAbsent(key, created);
        if (existing != null) {
            return existing;
        }
        fanOut(key).subscribe(
                quote -> settle(key, created, quote),
                error -> {
                    log.error("Quote fan-out for {} failed unexpectedly", key, error);
                    settle(key, created, unavailable(key));
                });
        return created;
    }

    private Mono<PriceQuote> fanOut(String key) {
        return Flux.fromIterable(sources)
                .flatMapSequential(source -> ask(source, key))
                .collectList()
                .map(answers -> answers.stream()
                        .flatMap(Optional::stream)
                        .findFirst()
                        .orElseGet(() -> {
                            log.warn("No quote source answered for {}", key);
                            return unavailable(key);
                        }));
    }

    private Mono<Optional<PriceQuote>> ask(QuoteSource source, String key) {
        return Mono.defer(() -> source.fetch(key))
                .map(Optional::of)
                .defaultIfEmpty(Optional.empty())
                .onErrorResume(e -> {
                    log.warn("Quote source {} did not answer for {}: {}", source.name(), key, e.toString());
                    return Mono.just(Optional.empty());
                });
    }

    private void settle(String key, CompletableFuture<PriceQuote> future, PriceQuote quote) {
        if (quote.hasData()) {
            cache.put(key, new CachedQuote(quote, clock.instant()));
        }
        inFlight.remove(key, future);
        future.complete(quote);
    }

    private PriceQuote unavailable(String key) {
        CachedQuote previous = cache.get(key);
        Instant lastUpdated = previous != null ? previous.quote().lastUpdated() : null;
        return PriceQuote.unavailable(key, lastUpdated);
    }

    private boolean isFresh(CachedQuote cached) {
        return Duration.between(cached.fetchedAt(), clock.instant()).compareTo(cacheTtl) < 0;
    }

    private static Map<String, PriceQuote> joinAll(Map<String, CompletableFuture<PriceQuote>> pending) {
        Map<String, PriceQuote> result = new LinkedHashMap<>();
        pending.forEach((symbol, future) -> result.put(symbol, future.join()));
        return result;
    }

    static String key(String symbol) {
        if (symbol == null || symbol.isBlank()) {
            throw new IllegalArgumentException("symbol must not be blank");
        }
        return symbol.trim().toUpperCase(Locale.ROOT);
    }

    private record CachedQuote(PriceQuote quote, Instant fetchedAt) {
    }

    private static final class Subscriber {
        private final Set<String> symbols;
        private final Consumer<Map<String, PriceQuote>> callback;

        private Subscriber(Set<String> symbols, Consumer<Map<String, PriceQuote>> callback) {
            this.symbols = symbols;
            this.callback = callback;
        }
    }
}
