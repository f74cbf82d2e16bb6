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

package dev.mars.reveille.agent.channel;

import io.vertx.core.Future;

/**
 * Obtains a fresh access token for the sync channel. Called before every connect attempt.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-19
 */
@FunctionalInterface
public interface CredentialProvider {

    /**
     * @return a future with the bearer token, failed when the credentials are rejected or the
     *         authority is unreachable
     */
    Future<String> authenticate();
}
