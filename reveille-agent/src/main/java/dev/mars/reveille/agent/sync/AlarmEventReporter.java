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

package dev.mars.reveille.agent.sync;

import dev.mars.reveille.agent.workload.WorkloadListener;
import dev.mars.reveille.agent.workload.WorkloadOutcome;
import dev.mars.reveille.core.SyncMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reports workload lifecycle events to the controller as ALARM_TRIGGERED and
 * ALARM_COMPLETED frames. Events raised while the channel is down are dropped.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-19
 */
public class AlarmEventReporter implements WorkloadListener {

    private static final Logger logger = LoggerFactory.getLogger(AlarmEventReporter.class);

    private final MessageSink sink;

    public AlarmEventReporter(MessageSink sink) {
        this.sink = sink;
    }

    @Override
    public void onTriggered(long scheduleId) {
        if (!sink.send(SyncMessage.alarmTriggered(scheduleId))) {
            logger.warn("Could not report start of alarm {}, channel is down", scheduleId);
        }
    }

    @Override
    public void onCompleted(WorkloadOutcome outcome) {
        SyncMessage message = SyncMessage.alarmCompleted(outcome.scheduleId(), outcome.status(), outcome.error());
        if (!sink.send(message)) {
            logger.warn("Could not report {} of alarm {}, channel is down",
                    outcome.status().wireValue(), outcome.scheduleId());
        }
    }
}
