/*******************************************************************************
 * Copyright (c) 2026 Contributors to the Eclipse Foundation
 *
 * See the NOTICE file(s) distributed with this work for additional
 * information regarding copyright ownership.
 *
 * This program and the accompanying materials are made available under the
 * terms of the Eclipse Public License 2.0 which is available at
 * http://www.eclipse.org/legal/epl-2.0
 *
 * SPDX-License-Identifier: EPL-2.0
 *******************************************************************************/

package org.eclipse.raptor.agent;

import static com.google.common.truth.Truth.assertThat;

import java.io.IOException;
import java.net.ServerSocket;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import org.eclipse.raptor.client.mqtt.InboundMessage;
import org.eclipse.raptor.client.telemetry.InMemoryTelemetrySource;
import org.eclipse.raptor.config.AgentConfig;
import org.eclipse.raptor.config.MqttConnectionConfig;
import org.eclipse.raptor.config.TopicConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import io.netty.handler.codec.mqtt.MqttQoS;
import io.vertx.core.Vertx;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.junit5.Checkpoint;
import io.vertx.junit5.Timeout;
import io.vertx.junit5.VertxExtension;
import io.vertx.junit5.VertxTestContext;
import io.vertx.mqtt.MqttEndpoint;
import io.vertx.mqtt.MqttServer;
import io.vertx.mqtt.MqttServerOptions;
import io.vertx.mqtt.MqttTopicSubscription;

/**
 * Tests verifying behavior of {@link AgentVerticle} running against an in-process MQTT broker.
 *
 */
@ExtendWith(VertxExtension.class)
@Timeout(value = 15, timeUnit = TimeUnit.SECONDS)
public class AgentVerticleTest {

    private static final TopicConfig TOPICS = TopicConfig.fromJson(new JsonObject()
            .put("interval", 1)
            .put("root_path", "site-1")
            .put("telemetry_path", "telemetry")
            .put("messages_path", "messages"));

    private final List<JsonArray> uploads = new CopyOnWriteArrayList<>();

    private MqttServer server;
    private InMemoryTelemetrySource telemetrySource;

    /**
     * Starts the broker.
     *
     * @param vertx The vert.x instance.
     * @param ctx The vert.x test context.
     */
    @BeforeEach
    public void startBroker(final Vertx vertx, final VertxTestContext ctx) {
        telemetrySource = new InMemoryTelemetrySource();
        server = MqttServer.create(vertx, new MqttServerOptions().setHost("127.0.0.1").setPort(0));
        server.endpointHandler(this::handleEndpoint)
            .listen()
            .onComplete(ctx.succeedingThenComplete());
    }

    /**
     * Stops the broker.
     *
     * @param ctx The vert.x test context.
     */
    @AfterEach
    public void stopBroker(final VertxTestContext ctx) {
        server.close().onComplete(ctx.succeedingThenComplete());
    }

    private void handleEndpoint(final MqttEndpoint endpoint) {
        endpoint.publishHandler(message -> {
            if (TOPICS.getTelemetryTopic().equals(message.topicName())) {
                uploads.add(message.payload().toJsonArray());
            }
            if (message.qosLevel() == MqttQoS.AT_LEAST_ONCE) {
                endpoint.publishAcknowledge(message.messageId());
            }
        });
        endpoint.subscribeHandler(subscribe -> {
            final List<MqttQoS> granted = subscribe.topicSubscriptions().stream()
                    .map(MqttTopicSubscription::qualityOfService)
                    .collect(Collectors.toList());
            endpoint.subscribeAcknowledge(subscribe.messageId(), granted);
            if (subscribe.topicSubscriptions().stream()
                    .anyMatch(sub -> TOPICS.getMessagesTopic().equals(sub.topicName()))) {
                endpoint.publish(TOPICS.getMessagesTopic(), new JsonObject().put("cmd", "reboot").toBuffer(),
                        MqttQoS.AT_MOST_ONCE, false, false);
            }
        });
        endpoint.accept(false);
    }

    private AgentConfig config(final int port) {
        return new AgentConfig(
                MqttConnectionConfig.builder("127.0.0.1").port(port).clientId("device-1").build(),
                TOPICS);
    }

    /**
     * Verifies that messages published to the device's messages topic are passed to the dispatcher.
     *
     * @param vertx The vert.x instance.
     * @param ctx The vert.x test context.
     */
    @Test
    public void testMessagesAreDispatched(final Vertx vertx, final VertxTestContext ctx) {
        final Checkpoint dispatched = ctx.checkpoint();
        final InboundMessageDispatcher dispatcher = (final InboundMessage message) -> {
            ctx.verify(() -> {
                assertThat(message.getTopic()).isEqualTo("site-1/messages");
                assertThat(message.getBodyAsJsonObject()).isEqualTo(new JsonObject().put("cmd", "reboot"));
            });
            dispatched.flag();
        };
        vertx.deployVerticle(new AgentVerticle(config(server.actualPort()), telemetrySource, dispatcher))
            .onComplete(ctx.succeeding(id -> {}));
    }

    /**
     * Verifies that stored telemetry data is periodically uploaded and removed from the store.
     *
     * @param vertx The vert.x instance.
     * @param ctx The vert.x test context.
     */
    @Test
    public void testStoredTelemetryIsUploaded(final Vertx vertx, final VertxTestContext ctx) {
        telemetrySource.add(new JsonObject().put("temperature", 21.5).put("timestamp", 1000L));

        final AgentVerticle verticle = new AgentVerticle(
                config(server.actualPort()),
                telemetrySource,
                message -> {});
        vertx.deployVerticle(verticle)
            .onComplete(ctx.succeeding(id -> {
                vertx.setPeriodic(100, tid -> {
                    if (!uploads.isEmpty() && telemetrySource.size() == 0) {
                        vertx.cancelTimer(tid);
                        ctx.verify(() -> {
                            assertThat(uploads.get(0)).isEqualTo(new JsonArray()
                                    .add(new JsonObject().put("temperature", 21.5).put("timestamp", 1000L)));
                        });
                        ctx.completeNow();
                    }
                });
            }));
    }

    /**
     * Verifies that the agent starts even if the broker cannot be reached and keeps
     * the stored telemetry data.
     *
     * @param vertx The vert.x instance.
     * @param ctx The vert.x test context.
     * @throws IOException if no free port can be determined.
     */
    @Test
    public void testAgentStartsWithUnreachableBroker(final Vertx vertx, final VertxTestContext ctx) throws IOException {
        final int port;
        try (ServerSocket socket = new ServerSocket(0)) {
            port = socket.getLocalPort();
        }
        telemetrySource.add(new JsonObject().put("temperature", 21.5));
        final AgentVerticle verticle = new AgentVerticle(config(port), telemetrySource, message -> {});

        vertx.deployVerticle(verticle)
            .compose(id -> verticle.uploadBacklog())
            .onComplete(ctx.succeeding(uploaded -> {
                ctx.verify(() -> {
                    assertThat(uploaded).isFalse();
                    assertThat(telemetrySource.size()).isEqualTo(1);
                });
                ctx.completeNow();
            }));
    }

    /**
     * Verifies that undeploying the agent stops the listener.
     *
     * @param vertx The vert.x instance.
     * @param ctx The vert.x test context.
     */
    @Test
    public void testUndeployStopsAgent(final Vertx vertx, final VertxTestContext ctx) {
        final AgentVerticle verticle = new AgentVerticle(config(server.actualPort()), telemetrySource, message -> {});
        vertx.deployVerticle(verticle)
            .compose(vertx::undeploy)
            .onComplete(ctx.succeedingThenComplete());
    }
}
