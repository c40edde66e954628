package com.clauselens.infrastructure.stream;

import com.clauselens.domain.comparison.event.ComparisonStatusChangedEvent;
import com.clauselens.domain.comparison.model.ComparisonStatus;
import com.clauselens.domain.comparison.model.ComparisonStatusSnapshot;
import com.clauselens.domain.comparison.repository.ComparisonRepository;
import com.clauselens.domain.comparison.repository.ComparisonStatusView;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionalEventListener;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;

/**
 * Pushes comparison status changes to subscribers.
 *
 * Every subscription polls the store on its own schedule and additionally re-checks at once when a
 * run records a terminal status. A subscriber receives {@code connected} first, then a {@code status}
 * event whenever a watched comparison's status differs from the last one it was sent, and a final
 * {@code done} once nothing it watches is processing. Store failures produce an {@code error} event
 * and a retry on the backoff interval.
 */
@Slf4j
@Component
public class ComparisonStatusBroadcaster {

    public static final String EVENT_CONNECTED = "connected";
    public static final String EVENT_STATUS = "status";
    public static final String EVENT_DONE = "done";
    public static final String EVENT_ERROR = "error";

    private final ComparisonRepository comparisonRepository;
    private final TaskScheduler taskScheduler;
    private final ObjectMapper objectMapper;
    private final Duration pollInterval;
    private final Duration errorBackoff;
    private final long streamTimeoutMs;

    private final Map<String, Subscription> subscriptions = new ConcurrentHashMap<>();

    public ComparisonStatusBroadcaster(ComparisonRepository comparisonRepository,
                                       TaskScheduler taskScheduler,
                                       ObjectMapper objectMapper,
                                       @Value("${comparison.stream.poll-interval-ms:2000}") long pollIntervalMs,
                                       @Value("${comparison.stream.error-backoff-ms:5000}") long errorBackoffMs,
                                       @Value("${comparison.stream.timeout-ms:1800000}") long streamTimeoutMs) {
        this.comparisonRepository = comparisonRepository;
        this.taskScheduler = taskScheduler;
        this.objectMapper = objectMapper;
        this.pollInterval = Duration.ofMillis(pollIntervalMs);
        this.errorBackoff = Duration.ofMillis(errorBackoffMs);
        this.streamTimeoutMs = streamTimeoutMs;
    }

    public SseEmitter openSseStream(String orgId, Collection<String> comparisonIds) {
        SseStatusEventSink sink = new SseStatusEventSink(new SseEmitter(streamTimeoutMs), objectMapper);
        subscribe(orgId, comparisonIds, sink);
        return sink.getEmitter();
    }

    /**
     * @param comparisonIds watched comparisons, or empty to watch every comparison of the organization
     */
    public Subscription subscribe(String orgId, Collection<String> comparisonIds, StatusEventSink sink) {
        Subscription subscription = new Subscription(UUID.randomUUID().toString(), orgId,
                comparisonIds == null ? Set.of() : Set.copyOf(comparisonIds), sink);
        subscriptions.put(subscription.id, subscription);
        sink.onClose(() -> cancel(subscription));

        try {
            sink.send(EVENT_CONNECTED, Map.of("orgId", orgId, "comparisonIds", subscription.comparisonIds));
        } catch (IOException e) {
            log.debug("[StatusStream] Subscriber {} gone before connect: {}", subscription.id, e.getMessage());
            cancel(subscription);
            return subscription;
        }

        log.info("[StatusStream] Subscriber {} connected - orgId: {}, watching: {}", subscription.id, orgId,
                subscription.watchesAll() ? "all" : subscription.comparisonIds.size());
        schedule(subscription, Duration.ZERO);
        return subscription;
    }

    /**
     * Hands an immediate re-check of every watching subscription to the scheduler. Runs on the
     * pipeline thread, so it never waits for a subscription that is busy sending.
     */
    @TransactionalEventListener(fallbackExecution = true)
    public void onStatusChanged(ComparisonStatusChangedEvent event) {
        subscriptions.values().stream()
                .filter(subscription -> !subscription.cancelled)
                .filter(subscription -> subscription.watches(event.orgId(), event.comparisonId()))
                .forEach(subscription -> taskScheduler.schedule(() -> check(subscription), Instant.now()));
    }

    public int activeSubscriptions() {
        return subscriptions.size();
    }

    void check(Subscription subscription) {
        synchronized (subscription) {
            if (subscription.cancelled) {
                return;
            }
            List<ComparisonStatusView> views;
            try {
                views = subscription.watchesAll()
                        ? comparisonRepository.findStatusViewsByOrgIdOrderByCreatedAtDesc(subscription.orgId)
                        : comparisonRepository.findStatusViewsByOrgIdAndIdIn(subscription.orgId, subscription.comparisonIds);
            } catch (RuntimeException e) {
                log.warn("[StatusStream] Status check failed for subscriber {}, retrying in {}ms: {}",
                        subscription.id, errorBackoff.toMillis(), e.getMessage());
                sendOrCancel(subscription, EVENT_ERROR, Map.of("message", "Status check failed, retrying"));
                schedule(subscription, errorBackoff);
                return;
            }

            boolean anyProcessing = false;
            for (ComparisonStatusView view : views) {
                if (view.getStatus() == ComparisonStatus.PROCESSING) {
                    anyProcessing = true;
                }
                if (!Objects.equals(subscription.lastSent.get(view.getId()), view.getStatus())) {
                    if (!sendOrCancel(subscription, EVENT_STATUS, ComparisonStatusSnapshot.from(view))) {
                        return;
                    }
                    subscription.lastSent.put(view.getId(), view.getStatus());
                }
            }

            if (!anyProcessing) {
                if (sendOrCancel(subscription, EVENT_DONE, Map.of("comparisons", views.size()))) {
                    log.info("[StatusStream] Subscriber {} done, nothing left processing", subscription.id);
                    cancel(subscription);
                    subscription.sink.complete();
                }
                return;
            }
            schedule(subscription, pollInterval);
        }
    }

    private boolean sendOrCancel(Subscription subscription, String eventName, Object payload) {
        try {
            subscription.sink.send(eventName, payload);
            return true;
        } catch (IOException e) {
            log.debug("[StatusStream] Send to subscriber {} failed, cancelling: {}", subscription.id, e.getMessage());
            cancel(subscription);
            return false;
        }
    }

    private void schedule(Subscription subscription, Duration delay) {
        synchronized (subscription) {
            if (subscription.cancelled) {
                return;
            }
            if (subscription.next != null) {
                subscription.next.cancel(false);
            }
            subscription.next = taskScheduler.schedule(() -> check(subscription), Instant.now().plus(delay));
        }
    }

    void cancel(Subscription subscription) {
        synchronized (subscription) {
            if (subscription.cancelled) {
                return;
            }
            subscription.cancelled = true;
            if (subscription.next != null) {
                subscription.next.cancel(false);
            }
        }
        subscriptions.remove(subscription.id);
        log.debug("[StatusStream] Subscriber {} cancelled", subscription.id);
    }

    public static final class Subscription {

        private final String id;
        private final String orgId;
        private final Set<String> comparisonIds;
        private final StatusEventSink sink;
        private final Map<String, ComparisonStatus> lastSent = new HashMap<>();
        private volatile boolean cancelled;
        private ScheduledFuture<?> next;

        private Subscription(String id, String orgId, Set<String> comparisonIds, StatusEventSink sink) {
            this.id = id;
            this.orgId = orgId;
            this.comparisonIds = comparisonIds;
            this.sink = sink;
        }

        boolean watchesAll() {
            return comparisonIds.isEmpty();
        }

        boolean watches(String eventOrgId, String comparisonId) {
            return orgId.equals(eventOrgId) && (watchesAll() || comparisonIds.contains(comparisonId));
        }

        public String getId() {
            return id;
        }

        public boolean isCancelled() {
            return cancelled;
        }
    }
}
