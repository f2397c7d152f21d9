package com.deepansh.policyradar.fetch;

import com.deepansh.policyradar.config.RadarProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.net.Inet4Address;
import java.net.Inet6Address;
import java.net.InetAddress;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.UnknownHostException;
import java.util.List;
import java.util.Locale;

/**
 * Decides whether the fetcher may contact a URL.
 *
 * - Only http and https; a bare host gets https://.
 * - Host must match the allowlist. ".gov" matches any host ending in .gov; "example.org"
 *   matches that host and its subdomains. An empty allowlist allows every host.
 * - Every address the host resolves to must be public unless local fetch is enabled.
 */
@Component
@Slf4j
public class UrlSafetyPolicy {

    public static final String HOST_NOT_ALLOWED = "URL host is not allowed.";
    public static final String PRIVATE_ADDRESS = "URL resolves to a private or local address.";

    private final List<String> allowedDomains;
    private final boolean allowLocal;
    private final HostResolver resolver;

    public UrlSafetyPolicy(RadarProperties properties) {
        this(properties.getFetch().getAllowedDomainList(), properties.getFetch().isAllowLocalFetch(),
                InetAddress::getAllByName);
    }

    UrlSafetyPolicy(List<String> allowedDomains, boolean allowLocal, HostResolver resolver) {
        this.allowedDomains = allowedDomains.stream().map(d -> d.toLowerCase(Locale.ROOT)).toList();
        this.allowLocal = allowLocal;
        this.resolver = resolver;
    }

    /**
     * @return the normalized URI
     * @throws UnsafeUrlException if the URL is malformed or not allowed
     */
    public URI check(String rawUrl) {
        URI uri = normalize(rawUrl);
        String host = uri.getHost().toLowerCase(Locale.ROOT);

        if (!hostAllowed(host)) {
            log.info("Fetch blocked by allowlist [host={}]", host);
            throw new UnsafeUrlException(HOST_NOT_ALLOWED);
        }
        if (!allowLocal) {
            InetAddress[] addresses;
            try {
                addresses = resolver.resolve(host);
            } catch (UnknownHostException e) {
                throw new UnsafeUrlException("Could not resolve URL host.");
            }
            for (InetAddress address : addresses) {
                if (isPrivate(address)) {
                    log.warn("Fetch blocked, {} resolves to non-public address {}", host, address.getHostAddress());
                    throw new UnsafeUrlException(PRIVATE_ADDRESS);
                }
            }
        }
        return uri;
    }

    static URI normalize(String rawUrl) {
        if (rawUrl == null || rawUrl.isBlank()) {
            throw new UnsafeUrlException("URL is required.");
        }
        String candidate = rawUrl.trim();
        if (!candidate.contains("://")) {
            candidate = "https://" + candidate;
        }
        URI uri;
        try {
            uri = new URI(candidate);
        } catch (URISyntaxException e) {
            throw new UnsafeUrlException("Invalid URL.");
        }
        String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
        if (!scheme.equals("http") && !scheme.equals("https")) {
            throw new UnsafeUrlException("Only http and https URLs are allowed.");
        }
        if (uri.getHost() == null || uri.getHost().isBlank()) {
            throw new UnsafeUrlException("Invalid URL.");
        }
        return uri;
    }

    boolean hostAllowed(String host) {
        if (allowedDomains.isEmpty()) return true;
        for (String rule : allowedDomains) {
            if (rule.startsWith(".")) {
                if (host.endsWith(rule)) return true;
            } else if (host.equals(rule) || host.endsWith("." + rule)) {
                return true;
            }
        }
        return false;
    }

    static boolean isPrivate(InetAddress address) {
        if (address.isAnyLocalAddress() || address.isLoopbackAddress() || address.isLinkLocalAddress()
                || address.isSiteLocalAddress() || address.isMulticastAddress()) {
            return true;
        }
        byte[] b = address.getAddress();
        if (address instanceof Inet4Address) {
            int first = b[0] & 0xFF;
            int second = b[1] & 0xFF;
            return first == 0                                   // "this" network
                    || (first == 100 && second >= 64 && second <= 127) // carrier-grade NAT
                    || (first == 192 && second == 0 && (b[2] & 0xFF) == 0)
                    || (first == 198 && (second == 18 || second == 19))
                    || first >= 240;                            // reserved and broadcast
        }
        if (address instanceof Inet6Address) {
            return (b[0] & 0xFE) == 0xFC;                       // unique local fc00::/7
        }
        return false;
    }

    @FunctionalInterface
    interface HostResolver {
        InetAddress[] resolve(String host) throws UnknownHostException;
    }
}
