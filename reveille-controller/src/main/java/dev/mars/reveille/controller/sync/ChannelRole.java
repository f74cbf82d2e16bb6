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

/**
 * What a sync channel is used for, taken from the {@code client_type} connection parameter.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-19
 */
public enum ChannelRole {

    /** An execution agent that arms schedules and runs the workload. */
    AGENT,

    /** A passive client, such as a browser dashboard, that only watches. */
    OBSERVER;

    public static final String AGENT_CLIENT_TYPE = "alarm_client";

    /**
     * Anything other than {@value #AGENT_CLIENT_TYPE}, including a missing parameter, is an observer.
     */
    public static ChannelRole fromClientType(String clientType) {
        return AGENT_CLIENT_TYPE.equals(clientType) ? AGENT : OBSERVER;
    }
}
