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

package dev.mars.reveille.controller.sync;

import io.vertx.core.json.JsonObject;

import java.time.Instant;

/**
 * Agent presence for one principal: whether an agent channel is open and when the last one
 * opened and closed.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-19
 */
public record ConnectionStatus(long principalId, boolean agentOnline, int openChannels,
                               Instant lastConnected, Instant lastDisconnected) {

    public JsonObject toJson() {
        return new JsonObject()
                .put("user_id", principalId)
                .put("alarm_client_connected", agentOnline)
                .put("open_channels", openChannels)
                .put("last_connected", lastConnected == null ? null : lastConnected.toString())
                .put("last_disconnected", lastDisconnected == null ? null : lastDisconnected.toString());
    }
}
