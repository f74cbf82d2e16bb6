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

import java.time.Duration;
import java.util.Optional;

/**
 * Issues and resolves the opaque bearer tokens carried by REST calls and by the
 * {@code token} query parameter of the sync WebSocket.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-19
 */
public interface TokenService {

    String issue(Principal principal);

    /**
     * @return the owner of a known, unexpired token
     */
    Optional<Principal> resolve(String token);

    Duration ttl();
}
