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

/**
 * Connection states of the agent's sync channel.
 *
 * <pre>
 * UNAUTHENTICATED → AUTHENTICATING → CONNECTING → OPEN → CLOSED → AUTHENTICATING → ...
 *                                                              ↘ STOPPED
 * </pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-19
 */
public enum ChannelState {
    UNAUTHENTICATED,
    AUTHENTICATING,
    CONNECTING,
    OPEN,
    CLOSED,
    STOPPED;

    public boolean isOpen() {
        return this == OPEN;
    }
}
