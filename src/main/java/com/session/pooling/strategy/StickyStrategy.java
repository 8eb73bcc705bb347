package com.session.pooling.strategy;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import com.session.pooling.core.model.PoolStrategy;
import com.session.pooling.session.PooledSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Keeps each affinity key on the same session.
 *
 * <p>Affinity mappings live in a Caffeine cache that expires entries after the pool's
 * {@code max_idle_time} without use. When the mapped session is gone or busy, or no key is
 * given, selection falls back to round-robin and the key is remapped to the fallback choice.</p>
 */
public class StickyStrategy implements SelectionStrategy {
    private static final Logger log = LoggerFactory.getLogger(StickyStrategy.class);
    private static final long MAX_AFFINITY_ENTRIES = 10_000;

    private final Cache<String, String> affinity;
    private final RoundRobinStrategy fallback = new RoundRobinStrategy();

    public StickyStrategy(Duration mappingTtl) {
        this(mappingTtl, Ticker.systemTicker());
    }

    public StickyStrategy(Duration mappingTtl, Ticker ticker) {
        this.affinity = Caffeine.newBuilder()
                .maximumSize(MAX_AFFINITY_ENTRIES)
                .expireAfterAccess(mappingTtl)
                .ticker(ticker)
                .build();
    }

    @Override
    public PoolStrategy type() {
        return PoolStrategy.STICKY;
    }

    @Override
    public PooledSession select(List<PooledSession> available, String affinityKey) {
        if (affinityKey != null) {
            String sessionId = affinity.getIfPresent(affinityKey);
            if (sessionId != null) {
                for (PooledSession session : available) {
                    if (session.id().equals(sessionId)) {
                        return session;
                    }
                }
                log.debug("Affinity key {} maps to unavailable session {}, falling back", affinityKey, sessionId);
            }
        }
        PooledSession chosen = fallback.select(available, affinityKey);
        if (chosen != null && affinityKey != null) {
            affinity.put(affinityKey, chosen.id());
        }
        return chosen;
    }

    /**
     * Returns the session id currently mapped to an affinity key.
     */
    public Optional<String> mappedSession(String affinityKey) {
        return Optional.ofNullable(affinity.getIfPresent(affinityKey));
    }

    @Override
    public void onRemoved(PooledSession session) {
        affinity.asMap().values().removeIf(id -> id.equals(session.id()));
    }

    @Override
    public void reset() {
        affinity.invalidateAll();
        fallback.reset();
    }
}
