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

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for InMemoryUserDirectory.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-19
 */
@DisplayName("InMemoryUserDirectory Tests")
class InMemoryUserDirectoryTest {

    private final InMemoryUserDirectory users = new InMemoryUserDirectory();

    @Test
    @DisplayName("Should authenticate with the right password only")
    void shouldAuthenticate() {
        Principal admin = users.addUser("admin", "s3cret");

        assertEquals(admin, users.authenticate("admin", "s3cret").orElseThrow());
        assertTrue(users.authenticate("admin", "S3cret").isEmpty());
        assertTrue(users.authenticate("nobody", "s3cret").isEmpty());
        assertTrue(users.authenticate("admin", null).isEmpty());
    }

    @Test
    @DisplayName("Should keep the first account when a username is added twice")
    void shouldKeepExistingAccount() {
        Principal first = users.addUser("admin", "one");
        Principal second = users.addUser("admin", "two");

        assertEquals(first, second);
        assertTrue(users.authenticate("admin", "one").isPresent());
        assertTrue(users.authenticate("admin", "two").isEmpty());
    }

    @Test
    @DisplayName("Should assign distinct ids and find principals by id")
    void shouldFindById() {
        Principal admin = users.addUser("admin", "a");
        Principal guest = users.addUser("guest", "g");

        assertNotEquals(admin.id(), guest.id());
        assertEquals(guest, users.findById(guest.id()).orElseThrow());
        assertTrue(users.findById(999).isEmpty());
    }
}
