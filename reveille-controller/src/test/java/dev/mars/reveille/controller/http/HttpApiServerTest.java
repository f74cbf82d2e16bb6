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

package dev.mars.reveille.controller.http;

import dev.mars.reveille.controller.auth.InMemoryTokenService;
import dev.mars.reveille.controller.auth.InMemoryUserDirectory;
import dev.mars.reveille.controller.auth.Principal;
import dev.mars.reveille.controller.http.handlers.AlarmHandler;
import dev.mars.reveille.controller.http.handlers.LoginHandler;
import dev.mars.reveille.controller.http.handlers.StatusHandler;
import dev.mars.reveille.controller.service.AlarmService;
import dev.mars.reveille.controller.store.InMemoryAlarmEventLog;
import dev.mars.reveille.controller.store.InMemoryAlarmRepository;
import dev.mars.reveille.controller.sync.ChannelRole;
import dev.mars.reveille.controller.sync.ConnectionRegistry;
import dev.mars.reveille.controller.sync.RecordingSyncChannel;
import dev.mars.reveille.controller.sync.SyncEndpoint;
import dev.mars.reveille.core.AlarmStatus;
import dev.mars.reveille.core.MessageType;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.client.HttpRequest;
import io.vertx.ext.web.client.HttpResponse;
import io.vertx.ext.web.client.WebClient;
import io.vertx.junit5.VertxExtension;
import io.vertx.junit5.VertxTestContext;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.extension.ExtendWith;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end tests for the REST API: login, bearer authentication, alarm CRUD, history,
 * connection status and the error envelope. Runs the real server on an ephemeral port with
 * the in-memory stores (no mocking).
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-19
 */
@ExtendWith(VertxExtension.class)
@DisplayName("HttpApiServer Tests")
class HttpApiServerTest {

    private static final String HOST = "127.0.0.1";
    private static final String USERNAME = "admin";
    private static final String PASSWORD = "letmein";

    private static Vertx vertx;
    private static HttpApiServer httpServer;
    private static WebClient webClient;
    private static int port;

    private static Principal admin;
    private static Principal other;
    private static InMemoryTokenService tokens;
    private static InMemoryAlarmEventLog eventLog;
    private static ConnectionRegistry registry;

    @BeforeAll
    static void setUp() throws Exception {
        vertx = Vertx.vertx();
        Clock clock = Clock.systemUTC();

        InMemoryUserDirectory users = new InMemoryUserDirectory();
        admin = users.addUser(USERNAME, PASSWORD);
        other = users.addUser("other", "other-pw");
        tokens = new InMemoryTokenService(clock, Duration.ofHours(24));
        InMemoryAlarmRepository repository = new InMemoryAlarmRepository(clock);
        eventLog = new InMemoryAlarmEventLog(clock);
        registry = new ConnectionRegistry(clock);
        SyncEndpoint syncEndpoint = new SyncEndpoint(tokens, repository, eventLog, registry);

        httpServer = new HttpApiServer(vertx, HOST, 0,
                new LoginHandler(users, tokens),
                new AlarmHandler(new AlarmService(repository, eventLog, syncEndpoint)),
                new StatusHandler(registry),
                new BearerAuthHandler(tokens),
                syncEndpoint);
        httpServer.start().toCompletionStage().toCompletableFuture().get(5, TimeUnit.SECONDS);
        port = httpServer.actualPort();

        webClient = WebClient.create(vertx);
    }

    @AfterAll
    static void tearDown() throws Exception {
        if (webClient != null) webClient.close();
        if (httpServer != null) httpServer.stop().toCompletionStage().toCompletableFuture()
                .get(5, TimeUnit.SECONDS);
        if (vertx != null) vertx.close().toCompletionStage().toCompletableFuture()
                .get(5, TimeUnit.SECONDS);
    }

    private static HttpRequest<Buffer> authorized(HttpRequest<Buffer> request, Principal principal) {
        return request.putHeader("Authorization", "Bearer " + tokens.issue(principal));
    }

    private static HttpResponse<Buffer> await(Future<HttpResponse<Buffer>> future) throws Exception {
        return future.toCompletionStage().toCompletableFuture().get(5, TimeUnit.SECONDS);
    }

    private static JsonObject error(HttpResponse<Buffer> response) {
        return response.bodyAsJsonObject().getJsonObject("error");
    }

    // ==================== Health ====================

    @Nested
    @DisplayName("GET /health")
    class HealthTests {

        @Test
        @DisplayName("Should return UP without authentication")
        void shouldReturnUp(VertxTestContext ctx) {
            webClient.get(port, HOST, "/health")
                    .send()
                    .onComplete(ctx.succeeding(response -> ctx.verify(() -> {
                        assertEquals(200, response.statusCode());
                        assertEquals("UP", response.bodyAsJsonObject().getString("status"));
                        ctx.completeNow();
                    })));
        }
    }

    // ==================== Login ====================

    @Nested
    @DisplayName("POST /api/login")
    class LoginTests {

        @Test
        @DisplayName("Should issue a bearer token that opens /api/me")
        void shouldLogin() throws Exception {
            HttpResponse<Buffer> login = await(webClient.post(port, HOST, "/api/login")
                    .sendJsonObject(new JsonObject().put("username", USERNAME).put("password", PASSWORD)));

            assertEquals(200, login.statusCode());
            JsonObject body = login.bodyAsJsonObject();
            assertEquals("bearer", body.getString("token_type"));
            assertEquals(24 * 3600L, body.getLong("expires_in"));
            String token = body.getString("access_token");
            assertThat(token).isNotBlank();

            HttpResponse<Buffer> me = await(webClient.get(port, HOST, "/api/me")
                    .putHeader("Authorization", "Bearer " + token)
                    .send());
            assertEquals(200, me.statusCode());
            assertEquals(USERNAME, me.bodyAsJsonObject().getString("username"));
            assertEquals(admin.id(), me.bodyAsJsonObject().getLong("id"));
        }

        @Test
        @DisplayName("Should reject a wrong password with INVALID_CREDENTIALS")
        void shouldRejectWrongPassword(VertxTestContext ctx) {
            webClient.post(port, HOST, "/api/login")
                    .sendJsonObject(new JsonObject().put("username", USERNAME).put("password", "nope"))
                    .onComplete(ctx.succeeding(response -> ctx.verify(() -> {
                        assertEquals(401, response.statusCode());
                        JsonObject error = error(response);
                        assertEquals("INVALID_CREDENTIALS", error.getString("code"));
                        assertEquals("Incorrect username or password", error.getString("message"));
                        assertEquals("/api/login", error.getString("path"));
                        assertFalse(error.containsKey("alarmId"));
                        assertNotNull(error.getString("timestamp"));
                        ctx.completeNow();
                    })));
        }

        @Test
        @DisplayName("Should name the missing field")
        void shouldRejectMissingPassword(VertxTestContext ctx) {
            webClient.post(port, HOST, "/api/login")
                    .sendJsonObject(new JsonObject().put("username", USERNAME))
                    .onComplete(ctx.succeeding(response -> ctx.verify(() -> {
                        assertEquals(400, response.statusCode());
                        assertEquals("MISSING_REQUIRED_FIELD", error(response).getString("code"));
                        assertTrue(error(response).getString("message").contains("password"));
                        assertEquals("password", error(response).getString("field"));
                        ctx.completeNow();
                    })));
        }
    }

    // ==================== Authentication ====================

    @Nested
    @DisplayName("Bearer authentication")
    class AuthenticationTests {

        @Test
        @DisplayName("Should reject alarm routes without a token")
        void shouldRequireToken(VertxTestContext ctx) {
            webClient.get(port, HOST, "/api/alarms")
                    .send()
                    .onComplete(ctx.succeeding(response -> ctx.verify(() -> {
                        assertEquals(401, response.statusCode());
                        assertEquals("UNAUTHORIZED", error(response).getString("code"));
                        ctx.completeNow();
                    })));
        }

        @Test
        @DisplayName("Should reject an unknown token")
        void shouldRejectUnknownToken(VertxTestContext ctx) {
            webClient.get(port, HOST, "/api/status")
                    .putHeader("Authorization", "Bearer forged")
                    .send()
                    .onComplete(ctx.succeeding(response -> ctx.verify(() -> {
                        assertEquals(401, response.statusCode());
                        ctx.completeNow();
                    })));
        }
    }

    // ==================== Alarms ====================

    @Nested
    @DisplayName("Alarm CRUD")
    class AlarmTests {

        @Test
        @DisplayName("Should create, read, update, toggle and delete an alarm")
        void shouldRunFullLifecycle() throws Exception {
            RecordingSyncChannel agent = new RecordingSyncChannel(admin, ChannelRole.AGENT);
            registry.register(agent);
            try {
                HttpResponse<Buffer> created = await(authorized(webClient.post(port, HOST, "/api/alarms"), admin)
                        .sendJsonObject(new JsonObject()
                                .put("label", "Weekdays")
                                .put("time", "06:30")
                                .put("repeat_days", new JsonArray().add(0).add(1).add(2).add(3).add(4))));
                assertEquals(201, created.statusCode());
                JsonObject alarm = created.bodyAsJsonObject();
                long id = alarm.getLong("id");
                assertEquals(admin.id(), alarm.getLong("user_id"));
                assertTrue(alarm.getBoolean("enabled"));
                assertNotNull(alarm.getString("created_at"));

                HttpResponse<Buffer> list = await(authorized(webClient.get(port, HOST, "/api/alarms"), admin).send());
                assertThat(list.bodyAsJsonArray().stream().map(o -> ((JsonObject) o).getLong("id"))).contains(id);

                HttpResponse<Buffer> updated = await(authorized(webClient.put(port, HOST, "/api/alarms/" + id), admin)
                        .sendJsonObject(new JsonObject().put("time", "06:45")));
                assertEquals(200, updated.statusCode());
                assertEquals("06:45", updated.bodyAsJsonObject().getString("time"));
                assertEquals("Weekdays", updated.bodyAsJsonObject().getString("label"));

                HttpResponse<Buffer> toggled = await(authorized(webClient.patch(port, HOST, "/api/alarms/" + id + "/toggle"), admin)
                        .sendJsonObject(new JsonObject().put("enabled", false)));
                assertEquals(200, toggled.statusCode());
                assertFalse(toggled.bodyAsJsonObject().getBoolean("enabled"));

                HttpResponse<Buffer> fetched = await(authorized(webClient.get(port, HOST, "/api/alarms/" + id), admin).send());
                assertFalse(fetched.bodyAsJsonObject().getBoolean("enabled"));
                assertEquals("06:45", fetched.bodyAsJsonObject().getString("time"));

                HttpResponse<Buffer> deleted = await(authorized(webClient.delete(port, HOST, "/api/alarms/" + id), admin).send());
                assertEquals(204, deleted.statusCode());

                HttpResponse<Buffer> gone = await(authorized(webClient.get(port, HOST, "/api/alarms/" + id), admin).send());
                assertEquals(404, gone.statusCode());
                assertEquals("ALARM_NOT_FOUND", error(gone).getString("code"));
                assertEquals(id, error(gone).getLong("alarmId").longValue());

                assertThat(agent.sentTypes()).containsExactly(
                        MessageType.SET_ALARM, MessageType.SET_ALARM, MessageType.SET_ALARM, MessageType.DELETE_ALARM);
            } finally {
                registry.unregister(agent);
            }
        }

        @Test
        @DisplayName("Should reject an invalid time with ALARM_INVALID")
        void shouldRejectInvalidTime(VertxTestContext ctx) {
            authorized(webClient.post(port, HOST, "/api/alarms"), admin)
                    .sendJsonObject(new JsonObject().put("time", "7am"))
                    .onComplete(ctx.succeeding(response -> ctx.verify(() -> {
                        assertEquals(400, response.statusCode());
                        JsonObject error = error(response);
                        assertEquals("ALARM_INVALID", error.getString("code"));
                        assertEquals("time", error.getString("field"));
                        assertFalse(error.containsKey("alarmId"));
                        ctx.completeNow();
                    })));
        }

        @Test
        @DisplayName("Should reject a body that is not JSON")
        void shouldRejectMalformedJson(VertxTestContext ctx) {
            authorized(webClient.post(port, HOST, "/api/alarms"), admin)
                    .putHeader("Content-Type", "application/json")
                    .sendBuffer(Buffer.buffer("{\"time\": "))
                    .onComplete(ctx.succeeding(response -> ctx.verify(() -> {
                        assertEquals(400, response.statusCode());
                        assertEquals("BAD_REQUEST", error(response).getString("code"));
                        ctx.completeNow();
                    })));
        }

        @Test
        @DisplayName("Should reject a non-numeric id")
        void shouldRejectBadId(VertxTestContext ctx) {
            authorized(webClient.get(port, HOST, "/api/alarms/abc"), admin)
                    .send()
                    .onComplete(ctx.succeeding(response -> ctx.verify(() -> {
                        assertEquals(400, response.statusCode());
                        assertEquals("BAD_REQUEST", error(response).getString("code"));
                        assertEquals("id", error(response).getString("field"));
                        ctx.completeNow();
                    })));
        }

        @Test
        @DisplayName("Should require a boolean enabled flag to toggle")
        void shouldRejectToggleWithoutFlag() throws Exception {
            HttpResponse<Buffer> created = await(authorized(webClient.post(port, HOST, "/api/alarms"), admin)
                    .sendJsonObject(new JsonObject().put("time", "05:00")));
            long id = created.bodyAsJsonObject().getLong("id");

            HttpResponse<Buffer> response = await(authorized(webClient.patch(port, HOST, "/api/alarms/" + id + "/toggle"), admin)
                    .sendJsonObject(new JsonObject().put("enabled", "yes")));

            assertEquals(400, response.statusCode());
            assertEquals("MISSING_REQUIRED_FIELD", error(response).getString("code"));
            assertEquals("enabled", error(response).getString("field"));
        }

        @Test
        @DisplayName("Should hide alarms of other users")
        void shouldHideOtherUsersAlarms() throws Exception {
            HttpResponse<Buffer> created = await(authorized(webClient.post(port, HOST, "/api/alarms"), admin)
                    .sendJsonObject(new JsonObject().put("time", "04:00")));
            long id = created.bodyAsJsonObject().getLong("id");

            HttpResponse<Buffer> response = await(authorized(webClient.delete(port, HOST, "/api/alarms/" + id), other).send());
            assertEquals(404, response.statusCode());

            HttpResponse<Buffer> list = await(authorized(webClient.get(port, HOST, "/api/alarms"), other).send());
            assertTrue(list.bodyAsJsonArray().isEmpty());
        }

        @Test
        @DisplayName("Should return firing history newest first")
        void shouldReturnHistory() throws Exception {
            HttpResponse<Buffer> created = await(authorized(webClient.post(port, HOST, "/api/alarms"), admin)
                    .sendJsonObject(new JsonObject().put("time", "08:00")));
            long id = created.bodyAsJsonObject().getLong("id");
            eventLog.append(admin.id(), id, AlarmStatus.STARTED, null);
            eventLog.append(admin.id(), id, AlarmStatus.FAILED, "speaker missing");

            HttpResponse<Buffer> response = await(authorized(webClient.get(port, HOST, "/api/alarms/" + id + "/history"), admin).send());

            assertEquals(200, response.statusCode());
            JsonObject body = response.bodyAsJsonObject();
            assertEquals(id, body.getLong("alarm_id"));
            JsonArray events = body.getJsonArray("events");
            assertEquals(2, events.size());
            assertEquals("failed", events.getJsonObject(0).getString("status"));
            assertEquals("speaker missing", events.getJsonObject(0).getString("error"));
            assertEquals(id, events.getJsonObject(0).getLong("alarm_id"));
            assertEquals("started", events.getJsonObject(1).getString("status"));
            assertThat(events.getJsonObject(1).getString("timestamp")).contains("T");
        }
    }

    // ==================== Status and Routing ====================

    @Nested
    @DisplayName("Status and routing")
    class StatusTests {

        @Test
        @DisplayName("Should report whether the caller's agent is connected")
        void shouldReportAgentPresence() throws Exception {
            HttpResponse<Buffer> before = await(authorized(webClient.get(port, HOST, "/api/status"), other).send());
            assertEquals(200, before.statusCode());
            assertFalse(before.bodyAsJsonObject().getBoolean("alarm_client_connected"));
            assertEquals(0, before.bodyAsJsonObject().getInteger("open_channels"));

            RecordingSyncChannel agent = new RecordingSyncChannel(other, ChannelRole.AGENT);
            registry.register(agent);
            try {
                HttpResponse<Buffer> after = await(authorized(webClient.get(port, HOST, "/api/status"), other).send());
                assertTrue(after.bodyAsJsonObject().getBoolean("alarm_client_connected"));
                assertEquals(other.id(), after.bodyAsJsonObject().getLong("user_id"));
                assertNotNull(after.bodyAsJsonObject().getString("last_connected"));
            } finally {
                registry.unregister(agent);
            }
        }

        @Test
        @DisplayName("Should return the error envelope for unknown routes")
        void shouldReturnNotFound(VertxTestContext ctx) {
            webClient.get(port, HOST, "/nowhere")
                    .send()
                    .onComplete(ctx.succeeding(response -> ctx.verify(() -> {
                        assertEquals(404, response.statusCode());
                        assertEquals("NOT_FOUND", error(response).getString("code"));
                        assertEquals("/nowhere", error(response).getString("path"));
                        ctx.completeNow();
                    })));
        }
    }
}
