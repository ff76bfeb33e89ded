package com.flint.aggregator.link;

import com.flint.aggregator.config.FlintProperties;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives a provider's hosted account-linking page and reports when the user is back.
 *
 * <p>Popup flows poll the window handle until it is closed. Mobile flows listen for the in-app
 * browser being dismissed and for a deep link into the app's scheme; whichever comes first ends the
 * flow and both listeners go away with it. Starting a mobile flow supersedes any mobile flow still
 * open. Every flow fails with {@link LinkFlowException.Reason#TIMEOUT} once its ceiling passes.
 *
 * <p>Completion only means the user left the provider page. Callers re-query accounts to learn
 * whether linking worked.
 *
 * <p>The hosts are supplied by the embedding shell; a missing host makes that transport fail with
 * {@link LinkFlowException.Reason#TRANSPORT_ERROR}. This service has no such hosts, so it never
 * creates a bridge itself. The shell (desktop web wrapper or mobile app) builds one bridge at start-up
 * from its own window, browser and deep-link adapters, a scheduler it owns and shuts down, and
 * {@code FlintProperties.link()}. It keeps that bridge for its whole lifetime, calls
 * {@link #closeBrowser()} when the user leaves the linking screen, and takes the start URL from
 * {@code POST /link/{provider}/start}.
 */
public class LinkBridge {

    private static final Logger log = LoggerFactory.getLogger(LinkBridge.class);

    static final String POPUP_BLOCKED_MESSAGE = "Popup blocked. Please allow popups for this site.";

    private final PopupWindowHost popupHost;
    private final InAppBrowser browser;
    private final DeepLinkSource deepLinks;
    private final ScheduledExecutorService scheduler;
    private final Clock clock;
    private final Duration defaultTimeout;
    private final Duration popupPollInterval;
    private final String appScheme;

    private final Map<UUID, LinkSession> sessions = new ConcurrentHashMap<>();

    public LinkBridge(
            PopupWindowHost popupHost,
            InAppBrowser browser,
            DeepLinkSource deepLinks,
            ScheduledExecutorService scheduler,
            Clock clock,
            FlintProperties.Link settings
    ) {
        this.popupHost = popupHost;
        this.browser = browser;
        this.deepLinks = deepLinks;
        this.scheduler = scheduler;
        this.clock = clock;
        this.defaultTimeout = settings.timeout();
        this.popupPollInterval = settings.popupPollInterval();
        this.appScheme = settings.callbackScheme() + "://";
    }

    public CompletableFuture<LinkCompletion> openLinkFlow(LinkFlowOptions options) {
        Duration timeout = options.timeout() != null ? options.timeout() : defaultTimeout;
        Instant now = clock.instant();
        LinkSession session = new LinkSession(
                UUID.randomUUID(), options.transport(), now, now.plus(timeout), options.onComplete(), options.onError());
        sessions.put(session.id(), session);
        session.completion().whenComplete((result, error) -> sessions.remove(session.id(), session));

        try {
            if (options.transport() == LinkTransport.MOBILE_DEEPLINK) {
                openMobile(session, options, timeout);
            } else {
                openPopup(session, options, timeout);
            }
        } catch (LinkFlowException e) {
            fail(session, LinkState.FAILED, e);
        } catch (RuntimeException e) {
            fail(session, LinkState.FAILED,
                    new LinkFlowException(LinkFlowException.Reason.TRANSPORT_ERROR, "Could not open the account link page", e));
        }
        return session.completion();
    }

    /**
     * Closes the in-app browser and cancels every mobile flow still waiting.
     */
    public void closeBrowser() {
        sessions.values().stream()
                .filter(session -> session.transport() == LinkTransport.MOBILE_DEEPLINK)
                .forEach(session -> fail(session, LinkState.CANCELLED,
                        new LinkFlowException(LinkFlowException.Reason.CANCELLED, "Link flow was cancelled")));
        if (browser != null) {
            try {
                browser.close();
            } catch (RuntimeException e) {
                log.debug("In-app browser already closed or not open: {}", e.toString());
            }
        }
    }

    public int activeSessions() {
        return sessions.size();
    }

    public Optional<LinkSession> session(UUID sessionId) {
        return Optional.ofNullable(sessions.get(sessionId));
    }

    private void openPopup(LinkSession session, LinkFlowOptions options, Duration timeout) {
        if (popupHost == null) {
            throw new LinkFlowException(LinkFlowException.Reason.TRANSPORT_ERROR, "Popup windows are not available");
        }
        PopupWindow popup = popupHost.open(options.url(), options.windowName(), options.windowFeatures());
        if (popup == null || popup.isClosed()) {
            throw new LinkFlowException(LinkFlowException.Reason.TRANSPORT_ERROR, POPUP_BLOCKED_MESSAGE);
        }
        session.markOpened();
        long pollMillis = popupPollInterval.toMillis();
        session.track(scheduler.scheduleAtFixedRate(() -> pollPopup(session, popup), pollMillis, pollMillis, TimeUnit.MILLISECONDS));
        session.track(scheduler.schedule(() -> {
            if (fail(session, LinkState.TIMED_OUT, timedOut(timeout))) {
                closeQuietly(popup);
            }
        }, timeout.toMillis(), TimeUnit.MILLISECONDS));
        log.debug("Link popup {} opened", session.id());
    }

    private void pollPopup(LinkSession session, PopupWindow popup) {
        try {
            if (popup.isClosed()) {
                complete(session, LinkTrigger.POPUP_CLOSED, null);
            }
        } catch (RuntimeException e) {
            fail(session, LinkState.FAILED,
                    new LinkFlowException(LinkFlowException.Reason.TRANSPORT_ERROR, "Lost track of the link popup", e));
        }
    }

    private void openMobile(LinkSession session, LinkFlowOptions options, Duration timeout) {
        if (browser == null || deepLinks == null) {
            throw new LinkFlowException(LinkFlowException.Reason.TRANSPORT_ERROR, "In-app browser is not available");
        }
        sessions.values().stream()
                .filter(other -> other != session && other.transport() == LinkTransport.MOBILE_DEEPLINK)
                .forEach(other -> fail(other, LinkState.CANCELLED,
                        new LinkFlowException(LinkFlowException.Reason.SUPERSEDED, "A newer link flow was started")));

        session.markOpened();
        session.register(browser.addFinishedListener(() -> complete(session, LinkTrigger.BROWSER_DISMISSED, null)));
        session.register(deepLinks.addListener(url -> {
            if (url != null && url.startsWith(appScheme)) {
                complete(session, LinkTrigger.DEEP_LINK, url);
            }
        }));
        session.track(scheduler.schedule(() -> {
            if (fail(session, LinkState.TIMED_OUT, timedOut(timeout))) {
                closeBrowserView();
            }
        }, timeout.toMillis(), TimeUnit.MILLISECONDS));
        browser.open(options.url());
        log.debug("Link browser {} opened", session.id());
    }

    private void complete(LinkSession session, LinkTrigger trigger, String deepLinkUrl) {
        if (!session.transition(LinkState.COMPLETED)) {
            return;
        }
        session.release();
        if (trigger == LinkTrigger.DEEP_LINK) {
            // listeners are already gone, so this close is not reported as a second completion
            closeBrowserView();
        }
        log.info("Link flow {} ended by {}", session.id(), trigger);
        session.succeed(new LinkCompletion(session.id(), session.transport(), trigger, Optional.ofNullable(deepLinkUrl)));
    }

    private boolean fail(LinkSession session, LinkState terminal, LinkFlowException error) {
        if (!session.transition(terminal)) {
            return false;
        }
        session.release();
        log.info("Link flow {} ended with {}: {}", session.id(), error.reason(), error.getMessage());
        session.fail(error);
        return true;
    }

    private void closeBrowserView() {
        try {
            browser.close();
        } catch (RuntimeException e) {
            log.debug("In-app browser already closed: {}", e.toString());
        }
    }

    private static void closeQuietly(PopupWindow popup) {
        try {
            popup.close();
        } catch (RuntimeException e) {
            log.debug("Link popup already closed: {}", e.toString());
        }
    }

    private static LinkFlowException timedOut(Duration timeout) {
        return new LinkFlowException(LinkFlowException.Reason.TIMEOUT,
                "Account linking did not finish within " + timeout.toMinutes() + " minutes");
    }
}
