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

import dev.mars.reveille.core.SyncMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Tracks the open sync channels of every principal and fans messages out to them.
 *
 * <p>Each principal's channel list has its own lock, so a disconnect on one socket and a
 * broadcast triggered by a REST call never see a half-updated list. Messages are written
 * outside the lock; a channel whose write is refused is removed afterwards.</p>
 *
 * <p>The registry is an ordinary object passed to its collaborators, so tests can run
 * several independent instances side by side.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-19
 */
public class ConnectionRegistry {

    private static final Logger logger = LoggerFactory.getLogger(ConnectionRegistry.class);

    private final Clock clock;
    private final Map<Long, PrincipalChannels> channelsByPrincipal = new ConcurrentHashMap<>();

    public ConnectionRegistry(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
    }

    // ==================== Membership ====================

    public void register(SyncChannel channel) {
        Objects.requireNonNull(channel, "Channel cannot be null");
        long principalId = channel.principal().id();
        int count = channels(principalId).add(channel, clock.instant());
        logger.info("Channel {} registered for user '{}' as {} ({} open)",
                channel.id(), channel.principal().username(), channel.role(), count);
    }

    /**
     * @return true if the channel was registered and has now been removed
     */
    public boolean unregister(SyncChannel channel) {
        Objects.requireNonNull(channel, "Channel cannot be null");
        PrincipalChannels channels = channelsByPrincipal.get(channel.principal().id());
        if (channels == null || !channels.remove(channel, clock.instant())) {
            return false;
        }
        logger.info("Channel {} unregistered for user '{}'", channel.id(), channel.principal().username());
        return true;
    }

    // ==================== Fan-out ====================

    /**
     * Sends to every open channel of the principal.
     *
     * @return the number of channels that accepted the message
     */
    public int send(long principalId, SyncMessage message) {
        return deliver(principalId, null, message);
    }

    /**
     * Sends to the principal's channels of one role only.
     *
     * @return the number of channels that accepted the message
     */
    public int sendToRole(long principalId, ChannelRole role, SyncMessage message) {
        Objects.requireNonNull(role, "Role cannot be null");
        return deliver(principalId, role, message);
    }

    private int deliver(long principalId, ChannelRole role, SyncMessage message) {
        Objects.requireNonNull(message, "Message cannot be null");
        PrincipalChannels channels = channelsByPrincipal.get(principalId);
        if (channels == null) {
            logger.debug("No channels for user {}, {} not delivered", principalId, message.type());
            return 0;
        }

        int delivered = 0;
        List<SyncChannel> failed = new ArrayList<>();
        for (SyncChannel channel : channels.snapshot()) {
            if (role != null && channel.role() != role) {
                continue;
            }
            if (channel.send(message)) {
                delivered++;
            } else {
                failed.add(channel);
            }
        }

        for (SyncChannel channel : failed) {
            logger.warn("Dropping channel {} after failed {} delivery", channel.id(), message.type());
            channels.remove(channel, clock.instant());
        }
        logger.debug("Delivered {} to {} channel(s) of user {}", message.type(), delivered, principalId);
        return delivered;
    }

    // ==================== Queries ====================

    public boolean isAgentConnected(long principalId) {
        PrincipalChannels channels = channelsByPrincipal.get(principalId);
        return channels != null && channels.agentCount() > 0;
    }

    public int openChannels(long principalId) {
        PrincipalChannels channels = channelsByPrincipal.get(principalId);
        return channels == null ? 0 : channels.snapshot().size();
    }

    public ConnectionStatus status(long principalId) {
        PrincipalChannels channels = channelsByPrincipal.get(principalId);
        if (channels == null) {
            return new ConnectionStatus(principalId, false, 0, null, null);
        }
        return channels.status(principalId);
    }

    private PrincipalChannels channels(long principalId) {
        return channelsByPrincipal.computeIfAbsent(principalId, id -> new PrincipalChannels());
    }

    /**
     * Channel list of one principal together with its agent presence timestamps.
     * All access goes through the instance monitor.
     */
    private static final class PrincipalChannels {

        private final List<SyncChannel> channels = new ArrayList<>();
        private Instant lastConnected;
        private Instant lastDisconnected;

        synchronized int add(SyncChannel channel, Instant now) {
            if (!channels.contains(channel)) {
                channels.add(channel);
                if (channel.role() == ChannelRole.AGENT) {
                    lastConnected = now;
                }
            }
            return channels.size();
        }

        synchronized boolean remove(SyncChannel channel, Instant now) {
            boolean removed = channels.remove(channel);
            if (removed && channel.role() == ChannelRole.AGENT) {
                lastDisconnected = now;
            }
            return removed;
        }

        synchronized List<SyncChannel> snapshot() {
            return List.copyOf(channels);
        }

        synchronized int agentCount() {
            int count = 0;
            for (SyncChannel channel : channels) {
                if (channel.role() == ChannelRole.AGENT) {
                    count++;
                }
            }
            return count;
        }

        synchronized ConnectionStatus status(long principalId) {
            return new ConnectionStatus(principalId, agentCount() > 0, channels.size(),
                    lastConnected, lastDisconnected);
        }
    }
}
