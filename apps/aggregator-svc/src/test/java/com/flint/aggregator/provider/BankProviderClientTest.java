package com.flint.aggregator.provider;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.flint.aggregator.config.FlintProperties;
import com.flint.aggregator.connection.ConnectionErrorClassifier;
import com.flint.aggregator.connection.ConnectionVerdict;
import com.flint.aggregator.connection.ProviderRetryPolicy;
import com.flint.aggregator.normalize.RawAccount;
import com.flint.aggregator.normalize.RawBalance;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * JSON mapping and failure handling of the bank client against an embedded HttpServer.
 */
class BankProviderClientTest {

    static HttpServer server;
    static int port;
    static final AtomicInteger expiredCalls = new AtomicInteger();
    static volatile String lastAuthorization;

    @BeforeAll
    static void start() throws IOException {
        server = HttpServer.create(new InetSocketAddress(0), 0);
        port = server.getAddress().getPort();
        server.createContext("/accounts", exchange -> {
            String path = exchange.getRequestURI().getPath();
            lastAuthorization = exchange.getRequestHeaders().getFirst("Authorization");
            if (path.equals("/accounts")) {
                respond(exchange, 200, """
                        [{"id":"acc_1","name":"Checking","type":"depository","subtype":"checking","status":"open",
                          "currency":"USD","last_four":"1234","institution":{"id":"chase","name":"Chase"}},
                         {"id":"acc_2","name":"Card","type":"credit","subtype":"credit_card","status":"open",
                          "currency":"USD","last_four":"9876","institution":{"id":"chase","name":"Chase"}}]
                        """);
            } else if (path.equals("/accounts/acc_2/balances")) {
                respond(exchange, 200, "{\"account_id\":\"acc_2\",\"ledger\":\"2711.01\",\"available\":\"5288.99\"}");
            } else if (path.equals("/accounts/expired/balances")) {
                expiredCalls.incrementAndGet();
                respond(exchange, 401, "{\"error\":{\"code\":\"enrollment.disconnected\",\"message\":\"expired\"}}");
            } else {
                respond(exchange, 404, "{}");
            }
        });
        server.setExecutor(Executors.newSingleThreadExecutor());
        server.start();
    }

    @AfterAll
    static void stop() {
        server.stop(0);
    }

    @BeforeEach
    void reset() {
        expiredCalls.set(0);
    }

    private static void respond(HttpExchange exchange, int status, String json) throws IOException {
        byte[] body = json.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, body.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(body);
        }
    }

    private BankProviderClient newClient(ConnectionErrorClassifier classifier) {
        var props = new FlintProperties(
                new FlintProperties.Provider("http://localhost:" + port, "https://connect.example.com/",
                        "app_123", null, Duration.ofSeconds(2), true),
                new FlintProperties.Provider("http://localhost:" + port, null, "client", null, null, true),
                null, null, null, null, null,
                new FlintProperties.Retry(3, Duration.ofMillis(1), Duration.ofMillis(5), 0d)
        );
        return new BankProviderClient(props, new ProviderRetryPolicy(props, classifier));
    }

    @Test
    void listAccounts_mapsJson() {
        List<RawAccount> accounts = newClient(new ConnectionErrorClassifier()).listAccounts("token_abc");

        assertEquals(2, accounts.size());
        assertEquals("acc_1", accounts.get(0).id());
        assertEquals("Chase", accounts.get(0).institution());
        assertEquals("1234", accounts.get(0).lastFour());
        assertEquals("credit_card", accounts.get(1).subtype());
        assertTrue(lastAuthorization.startsWith("Basic "));
    }

    @Test
    void getBalance_keepsRawStrings() {
        RawBalance balance = newClient(new ConnectionErrorClassifier()).getBalance("token_abc", "acc_2");

        assertEquals("2711.01", balance.ledger());
        assertEquals("5288.99", balance.available());
        assertNull(balance.cash());
    }

    @Test
    void unauthorizedIsNotRetriedAndClassifiesAsAuthExpired() {
        ConnectionErrorClassifier classifier = new ConnectionErrorClassifier();
        BankProviderClient client = newClient(classifier);

        RuntimeException error = assertThrows(RuntimeException.class, () -> client.getBalance("token_abc", "expired"));

        ConnectionVerdict verdict = classifier.classify(error);
        assertTrue(verdict.shouldMarkDisconnected());
        assertEquals(1, expiredCalls.get());
    }

    @Test
    void startLinkFlow_buildsConnectUrl() {
        LinkStart start = newClient(new ConnectionErrorClassifier())
                .startLinkFlow("user-1", "flint://teller/callback");

        assertTrue(start.url().startsWith("https://connect.example.com/?application_id=app_123"));
        assertTrue(start.url().contains("user_id=user-1"));
        assertTrue(start.url().contains("redirect_uri=flint"));
        assertEquals("flint://teller/callback", start.callbackUrl());
    }
}
