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

package dev.mars.reveille.controller.http.handlers;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import dev.mars.reveille.controller.auth.Principal;
import dev.mars.reveille.controller.http.BearerAuthHandler;
import dev.mars.reveille.controller.http.ReveilleApiException;
import dev.mars.reveille.controller.service.AlarmService;
import dev.mars.reveille.controller.store.AlarmEvent;
import dev.mars.reveille.controller.store.AlarmRecord;
import dev.mars.reveille.core.AlarmStatus;
import io.vertx.core.Handler;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.RoutingContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * HTTP handler for alarm operations. All routes require a bearer token and only ever see
 * the caller's own alarms.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>{@code GET /api/alarms}: list alarms</li>
 *   <li>{@code POST /api/alarms}: create an alarm</li>
 *   <li>{@code GET /api/alarms/:id}: get one alarm</li>
 *   <li>{@code PUT /api/alarms/:id}: update the fields present in the body</li>
 *   <li>{@code PATCH /api/alarms/:id/toggle}: set {@code enabled}</li>
 *   <li>{@code DELETE /api/alarms/:id}: delete an alarm</li>
 *   <li>{@code GET /api/alarms/:id/history}: firing history, newest first</li>
 * </ul>
 *
 * <p>Writes are pushed to the caller's connected agents before the response is sent.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-19
 */
public class AlarmHandler {

    private static final Logger logger = LoggerFactory.getLogger(AlarmHandler.class);

    private final AlarmService alarmService;
    private final ObjectMapper objectMapper;

    public AlarmHandler(AlarmService alarmService) {
        this.alarmService = Objects.requireNonNull(alarmService, "AlarmService cannot be null");
        this.objectMapper = createObjectMapper();
    }

    /**
     * Handles {@code GET /api/alarms}.
     */
    public Handler<RoutingContext> handleList() {
        return ctx -> {
            Principal principal = BearerAuthHandler.principal(ctx);
            JsonArray alarms = new JsonArray();
            alarmService.list(principal).forEach(record -> alarms.add(record.toJson()));
            ctx.json(alarms);
        };
    }

    /**
     * Handles {@code POST /api/alarms}.
     */
    public Handler<RoutingContext> handleCreate() {
        return ctx -> {
            Principal principal = BearerAuthHandler.principal(ctx);
            AlarmRecord created = alarmService.create(principal, ctx.body().asJsonObject());
            ctx.response().setStatusCode(201);
            ctx.json(created.toJson());
        };
    }

    /**
     * Handles {@code GET /api/alarms/:id}.
     */
    public Handler<RoutingContext> handleGet() {
        return ctx -> {
            Principal principal = BearerAuthHandler.principal(ctx);
            ctx.json(alarmService.get(principal, alarmId(ctx)).toJson());
        };
    }

    /**
     * Handles {@code PUT /api/alarms/:id}.
     */
    public Handler<RoutingContext> handleUpdate() {
        return ctx -> {
            Principal principal = BearerAuthHandler.principal(ctx);
            ctx.json(alarmService.update(principal, alarmId(ctx), ctx.body().asJsonObject()).toJson());
        };
    }

    /**
     * Handles {@code PATCH /api/alarms/:id/toggle} with body {@code {"enabled": true|false}}.
     */
    public Handler<RoutingContext> handleToggle() {
        return ctx -> {
            Principal principal = BearerAuthHandler.principal(ctx);
            long alarmId = alarmId(ctx);
            JsonObject body = ctx.body().asJsonObject();
            Object enabled = body == null ? null : body.getValue("enabled");
            if (!(enabled instanceof Boolean)) {
                throw ReveilleApiException.missingField("enabled");
            }
            ctx.json(alarmService.toggle(principal, alarmId, (Boolean) enabled).toJson());
        };
    }

    /**
     * Handles {@code DELETE /api/alarms/:id}.
     */
    public Handler<RoutingContext> handleDelete() {
        return ctx -> {
            Principal principal = BearerAuthHandler.principal(ctx);
            alarmService.delete(principal, alarmId(ctx));
            ctx.response().setStatusCode(204).end();
        };
    }

    /**
     * Handles {@code GET /api/alarms/:id/history}.
     */
    public Handler<RoutingContext> handleHistory() {
        return ctx -> {
            Principal principal = BearerAuthHandler.principal(ctx);
            long alarmId = alarmId(ctx);
            List<AlarmEvent> events = alarmService.history(principal, alarmId);

            Map<String, Object> body = new LinkedHashMap<>();
            body.put("alarm_id", alarmId);
            body.put("events", events);
            try {
                ctx.response()
                        .putHeader("Content-Type", "application/json")
                        .end(objectMapper.writeValueAsString(body));
            } catch (JsonProcessingException e) {
                logger.error("Failed to serialize history of alarm {}: {}", alarmId, e.getMessage());
                ctx.fail(ReveilleApiException.internal("history serialization", e));
            }
        };
    }

    private static long alarmId(RoutingContext ctx) {
        String raw = ctx.pathParam("id");
        try {
            return Long.parseLong(raw);
        } catch (NumberFormatException e) {
            throw ReveilleApiException.invalidAlarmId(raw);
        }
    }

    static ObjectMapper createObjectMapper() {
        SimpleModule statusModule = new SimpleModule("alarm-status");
        statusModule.addSerializer(AlarmStatus.class, new StdSerializer<>(AlarmStatus.class) {
            @Override
            public void serialize(AlarmStatus value, JsonGenerator gen, SerializerProvider provider) throws IOException {
                gen.writeString(value.wireValue());
            }
        });

        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.registerModule(statusModule);
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
        return mapper;
    }
}
