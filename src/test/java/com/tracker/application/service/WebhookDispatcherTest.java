package com.tracker.application.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tracker.application.port.out.MetricsPort;
import com.tracker.application.port.out.WebhookRepository;
import com.tracker.application.port.out.WebhookTransport;
import com.tracker.domain.model.DeliveryAttempt;
import com.tracker.domain.model.WebhookSubscription;
import com.tracker.infrastructure.exception.PersistenceException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.net.ConnectException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Unit tests for WebhookDispatcher.
 * Deliveries go to a scripted in-memory transport; retry delays are a few milliseconds.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("WebhookDispatcher")
class WebhookDispatcherTest {

    private static final String ISSUE_CREATED = "issue_created";

    @Mock
    private WebhookRepository webhookRepository;

    @Mock
    private MetricsPort metrics;

    private ScriptedTransport transport;
    private ExecutorService executor;
    private final ObjectMapper objectMapper = new ObjectMapper();
    private WebhookDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        transport = new ScriptedTransport();
        executor = Executors.newFixedThreadPool(4);
        RetryPolicy retryPolicy = RetryPolicy.exponential(4, Duration.ofMillis(1), 2.0, Duration.ofMillis(5));
        dispatcher = new WebhookDispatcher(webhookRepository, transport, retryPolicy, executor, objectMapper, metrics);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private static WebhookSubscription subscription(String url, String... events) {
        return new WebhookSubscription(UUID.randomUUID(), url, Set.of(events), true, null, Instant.now());
    }

    private List<DeliveryOutcome> dispatch(String eventName, Object payload) throws Exception {
        return dispatcher.dispatch(eventName, payload).get(5, TimeUnit.SECONDS);
    }

    private static Map<String, Object> issuePayload() {
        Map<String, Object> issue = new LinkedHashMap<>();
        issue.put("key", "TASK-1");
        issue.put("title", "Fix login");
        return issue;
    }

    @Nested
    @DisplayName("matching")
    class MatchingTests {

        @Test
        @DisplayName("Should deliver only to subscriptions listening for the exact event name")
        void shouldMatchExactEventNames() throws Exception {
            // Given
            WebhookSubscription exact = subscription("http://a.test/hook", ISSUE_CREATED);
            WebhookSubscription prefix = subscription("http://b.test/hook", "issue");
            WebhookSubscription other = subscription("http://c.test/hook", "issue_updated");
            when(webhookRepository.findAll()).thenReturn(List.of(exact, prefix, other));

            // When
            List<DeliveryOutcome> outcomes = dispatch(ISSUE_CREATED, issuePayload());

            // Then
            assertEquals(1, outcomes.size());
            assertEquals(exact.id(), outcomes.get(0).subscriptionId());
            assertEquals(List.of("http://a.test/hook"), transport.urls());
        }

        @Test
        @DisplayName("Should not deliver to a subscription whose event only starts with the triggered name")
        void shouldNotMatchLongerSubscribedEvent() throws Exception {
            // Given
            when(webhookRepository.findAll()).thenReturn(List.of(subscription("http://a.test/hook", ISSUE_CREATED)));

            // When
            List<DeliveryOutcome> outcomes = dispatch("issue", issuePayload());

            // Then
            assertTrue(outcomes.isEmpty());
            assertTrue(transport.urls().isEmpty());
        }

        @Test
        @DisplayName("Should skip paused subscriptions")
        void shouldSkipInactiveSubscriptions() throws Exception {
            // Given
            WebhookSubscription paused = subscription("http://a.test/hook", ISSUE_CREATED).withActive(false);
            when(webhookRepository.findAll()).thenReturn(List.of(paused));

            // When
            List<DeliveryOutcome> outcomes = dispatch(ISSUE_CREATED, issuePayload());

            // Then
            assertTrue(outcomes.isEmpty());
            assertTrue(transport.urls().isEmpty());
        }

        @Test
        @DisplayName("Should complete immediately when nobody listens")
        void shouldCompleteWhenNoSubscribers() throws Exception {
            when(webhookRepository.findAll()).thenReturn(List.of());

            assertTrue(dispatch(ISSUE_CREATED, issuePayload()).isEmpty());
            verifyNoInteractions(metrics);
        }
    }

    @Nested
    @DisplayName("request body")
    class BodyTests {

        @Test
        @DisplayName("Should send event name, entity payload and timestamp")
        void shouldSendEnvelope() throws Exception {
            // Given
            when(webhookRepository.findAll()).thenReturn(List.of(subscription("http://a.test/hook", ISSUE_CREATED)));
            long before = System.currentTimeMillis();

            // When
            dispatch(ISSUE_CREATED, issuePayload());

            // Then
            JsonNode body = objectMapper.readTree(transport.attempts().get(0).body());
            assertEquals(ISSUE_CREATED, body.get("webhookEvent").asText());
            assertEquals("TASK-1", body.get("issue").get("key").asText());
            assertEquals("Fix login", body.get("issue").get("title").asText());
            assertTrue(body.get("timestamp").asLong() >= before);
        }

        @Test
        @DisplayName("Should name the payload field after the entity")
        void shouldUseEntityAsPayloadField() throws Exception {
            // Given
            when(webhookRepository.findAll()).thenReturn(List.of(subscription("http://a.test/hook", "epic_deleted")));

            // When
            dispatch("epic_deleted", Map.of("key", "EPIC-3"));

            // Then
            JsonNode body = objectMapper.readTree(transport.attempts().get(0).body());
            assertEquals("EPIC-3", body.get("epic").get("key").asText());
            assertNull(body.get("issue"));
        }

        @Test
        @DisplayName("Should send the identical body on every retry")
        void shouldReuseBodyAcrossRetries() throws Exception {
            // Given
            when(webhookRepository.findAll()).thenReturn(List.of(subscription("http://a.test/hook", ISSUE_CREATED)));
            transport.script("http://a.test/hook", 500, 500, 200);

            // When
            dispatch(ISSUE_CREATED, issuePayload());

            // Then
            List<DeliveryAttempt> attempts = transport.attempts();
            assertEquals(3, attempts.size());
            assertEquals(attempts.get(0).body(), attempts.get(1).body());
            assertEquals(attempts.get(0).body(), attempts.get(2).body());
            assertEquals(List.of(1, 2, 3), attempts.stream().map(DeliveryAttempt::attemptNumber).toList());
        }
    }

    @Nested
    @DisplayName("retries")
    class RetryTests {

        @Test
        @DisplayName("Should succeed on first attempt without retrying")
        void shouldDeliverOnce() throws Exception {
            // Given
            when(webhookRepository.findAll()).thenReturn(List.of(subscription("http://a.test/hook", ISSUE_CREATED)));

            // When
            List<DeliveryOutcome> outcomes = dispatch(ISSUE_CREATED, issuePayload());

            // Then
            DeliveryOutcome outcome = outcomes.get(0);
            assertTrue(outcome.delivered());
            assertEquals(1, outcome.attempts());
            assertEquals(200, outcome.statusCode());
            verify(metrics).incrementWebhookDeliveryAttempts();
            verify(metrics).incrementWebhookDeliveriesSucceeded();
            verify(metrics).recordWebhookDeliveryDuration(any(Duration.class));
        }

        @Test
        @DisplayName("Should give up after four attempts against a failing endpoint")
        void shouldStopAfterMaxAttempts() throws Exception {
            // Given
            when(webhookRepository.findAll()).thenReturn(List.of(subscription("http://a.test/hook", ISSUE_CREATED)));
            transport.script("http://a.test/hook", 500, 502, 503, 500, 200);

            // When
            List<DeliveryOutcome> outcomes = dispatch(ISSUE_CREATED, issuePayload());

            // Then
            DeliveryOutcome outcome = outcomes.get(0);
            assertFalse(outcome.delivered());
            assertEquals(4, outcome.attempts());
            assertEquals(500, outcome.statusCode());
            assertEquals(4, transport.urls().size());
            verify(metrics, times(4)).incrementWebhookDeliveryAttempts();
            verify(metrics).incrementWebhookDeliveriesFailed();
            verify(metrics, never()).incrementWebhookDeliveriesSucceeded();
        }

        @Test
        @DisplayName("Should make exactly four attempts against an unreachable endpoint")
        void shouldStopAfterMaxAttemptsOnNetworkErrors() throws Exception {
            // Given
            when(webhookRepository.findAll()).thenReturn(List.of(subscription("http://a.test/hook", ISSUE_CREATED)));
            transport.script("http://a.test/hook",
                new ConnectException("refused"), new ConnectException("refused"),
                new ConnectException("refused"), new ConnectException("refused"),
                new ConnectException("refused"));

            // When
            DeliveryOutcome outcome = dispatch(ISSUE_CREATED, issuePayload()).get(0);

            // Then
            assertFalse(outcome.delivered());
            assertEquals(4, outcome.attempts());
            assertEquals(0, outcome.statusCode());
            assertEquals(4, transport.urls().size());
            verify(metrics, times(4)).incrementWebhookDeliveryAttempts();
            verify(metrics).incrementWebhookDeliveriesFailed();
        }

        @Test
        @DisplayName("Should recover when a retry succeeds")
        void shouldRecoverAfterTransientFailures() throws Exception {
            // Given
            when(webhookRepository.findAll()).thenReturn(List.of(subscription("http://a.test/hook", ISSUE_CREATED)));
            transport.script("http://a.test/hook", new ConnectException("refused"), 503, 201);

            // When
            DeliveryOutcome outcome = dispatch(ISSUE_CREATED, issuePayload()).get(0);

            // Then
            assertTrue(outcome.delivered());
            assertEquals(3, outcome.attempts());
            assertEquals(201, outcome.statusCode());
        }

        @Test
        @DisplayName("Should not retry a client error")
        void shouldNotRetryClientErrors() throws Exception {
            // Given
            when(webhookRepository.findAll()).thenReturn(List.of(subscription("http://a.test/hook", ISSUE_CREATED)));
            transport.script("http://a.test/hook", 404);

            // When
            DeliveryOutcome outcome = dispatch(ISSUE_CREATED, issuePayload()).get(0);

            // Then
            assertFalse(outcome.delivered());
            assertEquals(1, outcome.attempts());
            assertEquals(404, outcome.statusCode());
            assertEquals(1, transport.urls().size());
        }

        @Test
        @DisplayName("Should treat a transport that throws as a failed attempt")
        void shouldContainSynchronousTransportErrors() throws Exception {
            // Given
            when(webhookRepository.findAll()).thenReturn(List.of(subscription("http://a.test/hook", ISSUE_CREATED)));
            transport.throwOnCall("http://a.test/hook", new IllegalArgumentException("invalid URI"));

            // When
            DeliveryOutcome outcome = dispatch(ISSUE_CREATED, issuePayload()).get(0);

            // Then
            assertFalse(outcome.delivered());
            assertEquals(1, outcome.attempts());
            assertEquals(0, outcome.statusCode());
        }
    }

    @Nested
    @DisplayName("isolation")
    class IsolationTests {

        @Test
        @DisplayName("Should deliver to healthy endpoints while another keeps failing")
        void shouldIsolateFailures() throws Exception {
            // Given
            WebhookSubscription broken = subscription("http://broken.test/hook", ISSUE_CREATED);
            WebhookSubscription healthy = subscription("http://healthy.test/hook", ISSUE_CREATED);
            when(webhookRepository.findAll()).thenReturn(List.of(broken, healthy));
            transport.script("http://broken.test/hook",
                new ConnectException("refused"), new ConnectException("refused"),
                new ConnectException("refused"), new ConnectException("refused"));

            // When
            List<DeliveryOutcome> outcomes = dispatch(ISSUE_CREATED, issuePayload());

            // Then
            assertEquals(2, outcomes.size());
            DeliveryOutcome brokenOutcome = outcomes.get(0);
            DeliveryOutcome healthyOutcome = outcomes.get(1);
            assertFalse(brokenOutcome.delivered());
            assertEquals(4, brokenOutcome.attempts());
            assertTrue(healthyOutcome.delivered());
            assertEquals(1, healthyOutcome.attempts());
            assertEquals(1, transport.urls().stream().filter("http://healthy.test/hook"::equals).count());
        }
    }

    @Nested
    @DisplayName("trigger")
    class TriggerTests {

        @Test
        @DisplayName("Should complete normally when the registry lookup fails")
        void shouldSwallowLookupFailure() throws Exception {
            // Given
            when(webhookRepository.findAll()).thenThrow(new PersistenceException("database down", new IOException("eof")));

            // When
            CompletableFuture<Void> result = dispatcher.trigger(ISSUE_CREATED, issuePayload());

            // Then
            assertDoesNotThrow(() -> result.get(5, TimeUnit.SECONDS));
            assertTrue(transport.urls().isEmpty());
        }

        @Test
        @DisplayName("Should complete normally when every delivery fails")
        void shouldNeverFailTheCaller() throws Exception {
            // Given
            when(webhookRepository.findAll()).thenReturn(List.of(subscription("http://a.test/hook", ISSUE_CREATED)));
            transport.script("http://a.test/hook", 400);

            // When
            CompletableFuture<Void> result = dispatcher.trigger(ISSUE_CREATED, issuePayload());

            // Then
            assertDoesNotThrow(() -> result.get(5, TimeUnit.SECONDS));
            assertFalse(result.isCompletedExceptionally());
        }

        @Test
        @DisplayName("Should resolve when the executor shuts down while a retry is waiting")
        void shouldResolveWhenExecutorShutsDownDuringBackoff() throws Exception {
            // Given
            ExecutorService shortLived = Executors.newFixedThreadPool(2);
            RetryPolicy slowRetries = RetryPolicy.exponential(4, Duration.ofMillis(300), 2.0, Duration.ofSeconds(1));
            WebhookDispatcher slowDispatcher =
                new WebhookDispatcher(webhookRepository, transport, slowRetries, shortLived, objectMapper, metrics);
            when(webhookRepository.findAll()).thenReturn(List.of(subscription("http://a.test/hook", ISSUE_CREATED)));
            transport.script("http://a.test/hook", 503, 503, 503, 503);

            // When
            CompletableFuture<List<DeliveryOutcome>> result = slowDispatcher.dispatch(ISSUE_CREATED, issuePayload());
            await().atMost(Duration.ofSeconds(2)).pollInterval(Duration.ofMillis(5))
                .until(() -> transport.urls().size() == 1);
            shortLived.shutdown();

            // Then
            DeliveryOutcome outcome = result.get(3, TimeUnit.SECONDS).get(0);
            assertFalse(outcome.delivered());
            assertEquals(1, outcome.attempts());
            assertEquals(503, outcome.statusCode());
            assertEquals("executor shut down", outcome.failureReason());
            assertEquals(1, transport.urls().size());
            verify(metrics).incrementWebhookDeliveriesFailed();
        }

        @Test
        @DisplayName("Should complete normally when the payload cannot be serialized")
        void shouldContainSerializationFailure() throws Exception {
            // Given
            when(webhookRepository.findAll()).thenReturn(List.of(subscription("http://a.test/hook", ISSUE_CREATED)));

            // When
            CompletableFuture<List<DeliveryOutcome>> result = dispatcher.dispatch(ISSUE_CREATED, new Object());

            // Then
            assertTrue(result.get(5, TimeUnit.SECONDS).isEmpty());
            assertTrue(transport.urls().isEmpty());
        }
    }

    /**
     * Answers each URL from a queue of scripted responses; 200 once the queue is empty.
     */
    private static class ScriptedTransport implements WebhookTransport {

        private final Map<String, Deque<Object>> scripts = new HashMap<>();
        private final Map<String, RuntimeException> synchronousErrors = new HashMap<>();
        private final List<DeliveryAttempt> attempts = Collections.synchronizedList(new ArrayList<>());

        synchronized void script(String url, Object... responses) {
            scripts.put(url, new ArrayDeque<>(List.of(responses)));
        }

        synchronized void throwOnCall(String url, RuntimeException error) {
            synchronousErrors.put(url, error);
        }

        List<DeliveryAttempt> attempts() {
            synchronized (attempts) {
                return new ArrayList<>(attempts);
            }
        }

        List<String> urls() {
            return attempts().stream().map(attempt -> attempt.subscription().url()).toList();
        }

        @Override
        public CompletableFuture<Integer> deliver(DeliveryAttempt attempt) {
            String url = attempt.subscription().url();
            attempts.add(attempt);
            Object next;
            synchronized (this) {
                RuntimeException error = synchronousErrors.get(url);
                if (error != null) {
                    throw error;
                }
                Deque<Object> script = scripts.get(url);
                next = script == null || script.isEmpty() ? 200 : script.poll();
            }
            if (next instanceof Throwable failure) {
                return CompletableFuture.failedFuture(failure);
            }
            return CompletableFuture.completedFuture((Integer) next);
        }
    }
}
