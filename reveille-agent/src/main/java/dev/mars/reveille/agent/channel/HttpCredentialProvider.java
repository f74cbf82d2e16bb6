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

import dev.mars.reveille.agent.config.AgentConfiguration;
import dev.mars.reveille.core.exceptions.ReveilleException;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.client.WebClient;
import io.vertx.ext.web.client.WebClientOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs in against the controller's REST API: {@code POST {restApiUrl}/login} with
 * {@code {"username","password"}}, expecting {@code {"access_token": "..."}}.
 * Uses Vert.x WebClient for non-blocking HTTP communication.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-19
 */
public class HttpCredentialProvider implements CredentialProvider {

    private static final Logger logger = LoggerFactory.getLogger(HttpCredentialProvider.class);

    private final AgentConfiguration config;
    private final WebClient webClient;

    public HttpCredentialProvider(Vertx vertx, AgentConfiguration config) {
        this.config = config;
        this.webClient = WebClient.create(vertx, new WebClientOptions()
                .setConnectTimeout((int) config.getHttpTimeout().toMillis())
                .setUserAgent("Reveille-Agent/1.0"));
    }

    @Override
    public Future<String> authenticate() {
        String url = config.getRestApiUrl() + "/login";
        logger.debug("Authenticating as {} at {}", config.getUsername(), url);

        JsonObject credentials = new JsonObject()
                .put("username", config.getUsername())
                .put("password", config.getPassword());

        return webClient.postAbs(url)
                .timeout(config.getHttpTimeout().toMillis())
                .sendJsonObject(credentials)
                .compose(response -> {
                    if (response.statusCode() != 200) {
                        return Future.failedFuture(new ReveilleException(
                                "Login rejected with HTTP " + response.statusCode()));
                    }
                    JsonObject body = response.bodyAsJsonObject();
                    String token = body == null ? null : body.getString("access_token");
                    if (token == null || token.isEmpty()) {
                        return Future.failedFuture(new ReveilleException("Login response carried no access_token"));
                    }
                    logger.info("Authenticated as {}", config.getUsername());
                    return Future.succeededFuture(token);
                });
    }

    public void close() {
        webClient.close();
    }
}
