package com.flint.aggregator.link;

import com.flint.aggregator.config.FlintProperties;
import com.flint.aggregator.model.AccountProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Where a provider sends the user back after linking: the app's custom scheme on mobile, a page on
 * the web origin otherwise.
 */
@Component
public class LinkCallbackUrls {

    private final String scheme;
    private final String webOrigin;

    @Autowired
    public LinkCallbackUrls(FlintProperties properties) {
        this(properties.link());
    }

    LinkCallbackUrls(FlintProperties.Link settings) {
        this.scheme = settings.callbackScheme();
        this.webOrigin = stripTrailingSlash(settings.webOrigin());
    }

    public String callbackUrl(AccountProvider provider, LinkTransport transport) {
        if (transport == LinkTransport.MOBILE_DEEPLINK) {
            return scheme + "://" + switch (provider) {
                case BANK -> "teller/callback";
                case BROKERAGE -> "snaptrade/callback";
                case WALLET -> "wallet/callback";
            };
        }
        return webOrigin + switch (provider) {
            case BANK -> "/teller-callback";
            case BROKERAGE -> "/snaptrade-callback.html";
            case WALLET -> "/wallet-callback";
        };
    }

    public boolean isAppCallback(String url) {
        return url != null && url.startsWith(scheme + "://");
    }

    private static String stripTrailingSlash(String origin) {
        return origin.endsWith("/") ? origin.substring(0, origin.length() - 1) : origin;
    }
}
