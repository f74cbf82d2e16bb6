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

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-local user directory seeded at startup. Passwords are held as given and compared
 * in constant time.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-19
 */
public class InMemoryUserDirectory implements UserDirectory {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryUserDirectory.class);

    private final Map<String, Account> accountsByName = new ConcurrentHashMap<>();
    private final Map<Long, Principal> principalsById = new ConcurrentHashMap<>();
    private final AtomicLong idSequence = new AtomicLong();

    /**
     * Adds an account, or returns the existing principal if the username is taken.
     */
    public Principal addUser(String username, String password) {
        Objects.requireNonNull(username, "Username cannot be null");
        Objects.requireNonNull(password, "Password cannot be null");

        Account account = accountsByName.computeIfAbsent(username, name -> {
            Principal principal = new Principal(idSequence.incrementAndGet(), name);
            principalsById.put(principal.id(), principal);
            logger.info("Created user '{}' with id {}", name, principal.id());
            return new Account(principal, password.getBytes(StandardCharsets.UTF_8));
        });
        return account.principal();
    }

    @Override
    public Optional<Principal> authenticate(String username, String password) {
        if (username == null || password == null) {
            return Optional.empty();
        }
        Account account = accountsByName.get(username);
        if (account == null) {
            logger.debug("Login attempt for unknown user '{}'", username);
            return Optional.empty();
        }
        if (!MessageDigest.isEqual(account.password(), password.getBytes(StandardCharsets.UTF_8))) {
            logger.debug("Password mismatch for user '{}'", username);
            return Optional.empty();
        }
        return Optional.of(account.principal());
    }

    @Override
    public Optional<Principal> findById(long id) {
        return Optional.ofNullable(principalsById.get(id));
    }

    private record Account(Principal principal, byte[] password) {
    }
}
