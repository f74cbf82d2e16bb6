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

import dev.mars.reveille.controller.auth.Principal;
import dev.mars.reveille.core.SyncMessage;
import io.vertx.core.Future;

/**
 * One authenticated connection as seen by the {@link ConnectionRegistry}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-19
 */
public interface SyncChannel {

    String id();

    Principal principal();

    ChannelRole role();

    boolean isOpen();

    /**
     * Queues one message for delivery.
     *
     * @return false if the channel is closed or the write was refused, in which case the
     *         registry drops the channel
     */
    boolean send(SyncMessage message);

    Future<Void> close(short code, String reason);
}
