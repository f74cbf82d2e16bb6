/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.reveille.controller.auth;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Random 256-bit tokens kept in memory until they expire. Tokens do not survive a restart,
 * so agents simply log in again on their next reconnect.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-19
 */
public class InMemoryTokenService implements TokenService {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryTokenService.class);
    private static final int TOKEN_BYTES = 32;

    private final Clock clock;
    private final Duration ttl;
    private final SecureRandom random = new SecureRandom();
    private final Map<String, IssuedToken> tokens = new ConcurrentHashMap<>();

    public InMemoryTokenService(Clock clock, Duration ttl) {
        this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
        this.ttl = Objects.requireNonNull(ttl, "TTL cannot be null");
        if (ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("Token TTL must be positive: " + ttl);
        }
    }

    @Override
    public String issue(Principal principal) {
        Objects.requireNonNull(principal, "Principal cannot be null");
        byte[] bytes = new byte[TOKEN_BYTES];
        random.nextBytes(bytes);
        String token = Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);

        purgeExpired();
        tokens.put(token, new IssuedToken(principal, clock.instant().plus(ttl)));
        logger.debug("Issued token for user '{}'", principal.username());
        return token;
    }

    @Override
    public Optional<Principal> resolve(String token) {
        if (token == null || token.isEmpty()) {
            return Optional.empty();
        }
        IssuedToken issued = tokens.get(token);
        if (issued == null) {
            return Optional.empty();
        }
        if (!clock.instant().isBefore(issued.expiresAt())) {
            tokens.remove(token);
            logger.debug("Token for user '{}' expired at {}", issued.principal().username(), issued.expiresAt());
            return Optional.empty();
        }
        return Optional.of(issued.principal());
    }

    @Override
    public Duration ttl() {
        return ttl;
    }

    int size() {
        return tokens.size();
    }

    private void purgeExpired() {
        Instant now = clock.instant();
        tokens.values().removeIf(issued -> !now.isBefore(issued.expiresAt()));
    }

    private record IssuedToken(Principal principal, Instant expiresAt) {
    }
}
