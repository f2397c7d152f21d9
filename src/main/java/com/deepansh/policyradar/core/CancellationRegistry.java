package com.deepansh.policyradar.core;

import com.deepansh.policyradar.config.RadarProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Process-wide map of in-flight chat turns by request id.
 *
 * A cancel that arrives before its request registers is remembered and applied at
 * registration. Both maps are bounded and evict their eldest entry first.
 */
@Component
@Slf4j
public class CancellationRegistry {

    private final Map<String, CancellationToken> active;
    private final Set<String> pending;

    public CancellationRegistry(RadarProperties properties) {
        this(properties.getCancellation().getMaxEntries());
    }

    CancellationRegistry(int maxEntries) {
        this.active = bounded(maxEntries);
        this.pending = Collections.newSetFromMap(bounded(maxEntries));
    }

    public synchronized CancellationToken register(String requestId) {
        if (requestId == null || requestId.isBlank()) return CancellationToken.untracked();

        CancellationToken token = new CancellationToken(requestId);
        if (pending.remove(requestId)) {
            log.info("Applying early cancel [requestId={}]", requestId);
            token.cancel();
        }
        active.put(requestId, token);
        return token;
    }

    /**
     * @return true when a live request was signalled, false when the cancel was only remembered
     */
    public synchronized boolean cancel(String requestId) {
        if (requestId == null || requestId.isBlank()) return false;

        CancellationToken token = active.get(requestId);
        if (token != null) {
            token.cancel();
            log.info("Cancelled chat [requestId={}]", requestId);
            return true;
        }
        pending.add(requestId);
        log.info("Cancel recorded before registration [requestId={}]", requestId);
        return false;
    }

    public synchronized void clear(String requestId) {
        if (requestId == null) return;
        active.remove(requestId);
    }

    synchronized int activeCount() {
        return active.size();
    }

    synchronized int pendingCount() {
        return pending.size();
    }

    private static <V> Map<String, V> bounded(int maxEntries) {
        return new LinkedHashMap<>() {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, V> eldest) {
                return size() > maxEntries;
            }
        };
    }
}
