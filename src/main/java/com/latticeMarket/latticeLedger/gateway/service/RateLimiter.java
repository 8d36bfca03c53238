package com.latticeMarket.latticeLedger.gateway.service;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.latticeMarket.latticeLedger.gateway.util.AccountIdMasker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * In-memory sliding-window rate limiter for ledger writes, per account.
 *
 * Windows live in a Caffeine cache and are evicted once an account has been
 * idle for a full window.
 */
@Slf4j
@Service
public class RateLimiter {

    private static final Duration WINDOW_SIZE = Duration.ofMinutes(1);

    private final int maxRequestsPerWindow;
    private final Clock clock;

    private final Cache<String, RequestWindow> accountWindows;

    @Autowired
    public RateLimiter(@Value("${gateway.rate-limit.requests-per-minute:60}") int maxRequestsPerWindow) {
        this(maxRequestsPerWindow, Clock.systemUTC());
    }

    RateLimiter(int maxRequestsPerWindow, Clock clock) {
        this.maxRequestsPerWindow = maxRequestsPerWindow;
        this.clock = clock;
        this.accountWindows = Caffeine.newBuilder()
                .expireAfterAccess(WINDOW_SIZE)
                .maximumSize(100_000)
                .build();
    }

    /**
     * Checks if the request should be allowed based on rate limiting.
     *
     * @param accountId The account ID to check rate limit for
     * @return true if request is allowed, false if rate limit exceeded
     */
    public boolean isAllowed(String accountId) {
        RequestWindow window = accountWindows.get(accountId, k -> new RequestWindow());
        Instant now = clock.instant();

        if (!window.tryAdd(now, maxRequestsPerWindow)) {
            log.warn("Rate limit exceeded for accountId: {}", AccountIdMasker.mask(accountId));
            return false;
        }
        return true;
    }

    /**
     * Request timestamps of one account inside the current window.
     */
    private static class RequestWindow {
        private final Deque<Instant> requests = new ArrayDeque<>();

        synchronized boolean tryAdd(Instant now, int limit) {
            Instant cutoff = now.minus(WINDOW_SIZE);
            while (!requests.isEmpty() && requests.peekFirst().isBefore(cutoff)) {
                requests.pollFirst();
            }
            if (requests.size() >= limit) {
                return false;
            }
            requests.addLast(now);
            return true;
        }
    }
}
