package com.clauselens.infrastructure.stream;

import com.clauselens.domain.comparison.event.ComparisonStatusChangedEvent;
import com.clauselens.domain.comparison.model.ComparisonStatus;
import com.clauselens.domain.comparison.model.ComparisonStatusSnapshot;
import com.clauselens.domain.comparison.repository.ComparisonRepository;
import com.clauselens.domain.comparison.repository.ComparisonStatusView;
import com.clauselens.infrastructure.stream.ComparisonStatusBroadcaster.Subscription;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.scheduling.TaskScheduler;

import java.io.IOException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ComparisonStatusBroadcasterTest {

    @Mock
    private ComparisonRepository comparisonRepository;

    @Mock
    private TaskScheduler taskScheduler;

    private ComparisonStatusBroadcaster broadcaster;
    private RecordingSink sink;

    @BeforeEach
    void setUp() {
        broadcaster = new ComparisonStatusBroadcaster(comparisonRepository, taskScheduler, new ObjectMapper(),
                2000, 5000, 60000);
        sink = new RecordingSink();
    }

    private static ComparisonStatusView view(String id, ComparisonStatus status) {
        return new StubView(id, status);
    }

    private void givenStatuses(ComparisonStatusView... views) {
        when(comparisonRepository.findStatusViewsByOrgIdAndIdIn(any(), anyCollection())).thenReturn(List.of(views));
    }

    @Test
    @DisplayName("a new subscriber gets connected and an immediate first check")
    void connect() {
        Subscription subscription = broadcaster.subscribe("org", List.of("c1"), sink);

        assertThat(sink.eventNames()).containsExactly(ComparisonStatusBroadcaster.EVENT_CONNECTED);
        assertThat(subscription.isCancelled()).isFalse();
        assertThat(broadcaster.activeSubscriptions()).isEqualTo(1);
        verify(taskScheduler).schedule(any(Runnable.class), any(Instant.class));
    }

    @Test
    @DisplayName("status events are sent only when a status changes")
    void sendsOnChangeOnly() {
        Subscription subscription = broadcaster.subscribe("org", List.of("c1", "c2"), sink);
        givenStatuses(view("c1", ComparisonStatus.PROCESSING), view("c2", ComparisonStatus.PROCESSING));

        broadcaster.check(subscription);
        broadcaster.check(subscription);

        assertThat(sink.eventNames()).containsExactly(
                ComparisonStatusBroadcaster.EVENT_CONNECTED,
                ComparisonStatusBroadcaster.EVENT_STATUS,
                ComparisonStatusBroadcaster.EVENT_STATUS);
        assertThat(sink.payloads.get(1)).isInstanceOf(ComparisonStatusSnapshot.class);
        verify(taskScheduler, times(3)).schedule(any(Runnable.class), any(Instant.class));
    }

    @Test
    @DisplayName("done is sent and the stream closes once nothing is processing")
    void doneWhenTerminal() {
        Subscription subscription = broadcaster.subscribe("org", List.of("c1"), sink);
        when(comparisonRepository.findStatusViewsByOrgIdAndIdIn(any(), anyCollection()))
                .thenReturn(List.of(view("c1", ComparisonStatus.PROCESSING)))
                .thenReturn(List.of(view("c1", ComparisonStatus.COMPLETED)));

        broadcaster.check(subscription);
        broadcaster.check(subscription);

        assertThat(sink.eventNames()).containsExactly(
                ComparisonStatusBroadcaster.EVENT_CONNECTED,
                ComparisonStatusBroadcaster.EVENT_STATUS,
                ComparisonStatusBroadcaster.EVENT_STATUS,
                ComparisonStatusBroadcaster.EVENT_DONE);
        assertThat(((ComparisonStatusSnapshot) sink.payloads.get(2)).status()).isEqualTo(ComparisonStatus.COMPLETED);
        assertThat(sink.completed).isTrue();
        assertThat(subscription.isCancelled()).isTrue();
        assertThat(broadcaster.activeSubscriptions()).isZero();
    }

    @Test
    @DisplayName("an empty id list watches the whole organization")
    void watchesWholeOrg() {
        Subscription subscription = broadcaster.subscribe("org", List.of(), sink);
        when(comparisonRepository.findStatusViewsByOrgIdOrderByCreatedAtDesc("org"))
                .thenReturn(List.of(view("c9", ComparisonStatus.FAILED)));

        broadcaster.check(subscription);

        assertThat(sink.eventNames()).containsExactly(
                ComparisonStatusBroadcaster.EVENT_CONNECTED,
                ComparisonStatusBroadcaster.EVENT_STATUS,
                ComparisonStatusBroadcaster.EVENT_DONE);
    }

    @Test
    @DisplayName("a store failure sends error and retries without closing")
    void storeFailure() {
        Subscription subscription = broadcaster.subscribe("org", List.of("c1"), sink);
        when(comparisonRepository.findStatusViewsByOrgIdAndIdIn(any(), anyCollection()))
                .thenThrow(new DataAccessResourceFailureException("connection refused"));

        broadcaster.check(subscription);

        assertThat(sink.eventNames()).containsExactly(
                ComparisonStatusBroadcaster.EVENT_CONNECTED,
                ComparisonStatusBroadcaster.EVENT_ERROR);
        assertThat(subscription.isCancelled()).isFalse();
        verify(taskScheduler, times(2)).schedule(any(Runnable.class), any(Instant.class));
    }

    @Test
    @DisplayName("a failed send cancels the subscription")
    void sendFailure() {
        Subscription subscription = broadcaster.subscribe("org", List.of("c1"), sink);
        sink.failing = true;
        givenStatuses(view("c1", ComparisonStatus.PROCESSING));

        broadcaster.check(subscription);

        assertThat(subscription.isCancelled()).isTrue();
        assertThat(broadcaster.activeSubscriptions()).isZero();
    }

    @Test
    @DisplayName("client disconnect cancels the subscription")
    void disconnect() {
        Subscription subscription = broadcaster.subscribe("org", List.of("c1"), sink);

        sink.onCloseCallback.run();

        assertThat(subscription.isCancelled()).isTrue();
        assertThat(broadcaster.activeSubscriptions()).isZero();
    }

    @Test
    @DisplayName("terminal status events reschedule only the subscriptions watching that comparison")
    void statusChangedEvent() {
        broadcaster.subscribe("org", List.of("c1"), sink);
        broadcaster.subscribe("other-org", List.of(), new RecordingSink());

        broadcaster.onStatusChanged(new ComparisonStatusChangedEvent("c1", "org", ComparisonStatus.COMPLETED));
        broadcaster.onStatusChanged(new ComparisonStatusChangedEvent("c2", "org", ComparisonStatus.FAILED));

        // two initial checks plus one for the matching event
        verify(taskScheduler, times(3)).schedule(any(Runnable.class), any(Instant.class));
    }

    @Test
    @DisplayName("a status change does not wait for a subscription that is busy checking")
    void statusChangedWhileBusy() throws Exception {
        Subscription subscription = broadcaster.subscribe("org", List.of("c1"), sink);
        ComparisonStatusChangedEvent event = new ComparisonStatusChangedEvent("c1", "org", ComparisonStatus.COMPLETED);

        synchronized (subscription) {
            CompletableFuture.runAsync(() -> broadcaster.onStatusChanged(event)).get(2, TimeUnit.SECONDS);
        }

        ArgumentCaptor<Runnable> recheck = ArgumentCaptor.forClass(Runnable.class);
        verify(taskScheduler, times(2)).schedule(recheck.capture(), any(Instant.class));
        givenStatuses(view("c1", ComparisonStatus.COMPLETED));
        recheck.getValue().run();

        assertThat(sink.eventNames()).containsExactly(
                ComparisonStatusBroadcaster.EVENT_CONNECTED,
                ComparisonStatusBroadcaster.EVENT_STATUS,
                ComparisonStatusBroadcaster.EVENT_DONE);
    }

    private record StubView(String id, ComparisonStatus status) implements ComparisonStatusView {

        @Override
        public String getId() {
            return id;
        }

        @Override
        public String getName() {
            return "Comparison " + id;
        }

        @Override
        public ComparisonStatus getStatus() {
            return status;
        }

        @Override
        public Integer getOverallRiskScore() {
            return status == ComparisonStatus.COMPLETED ? 40 : null;
        }

        @Override
        public String getErrorMessage() {
            return status == ComparisonStatus.FAILED ? "failed" : null;
        }

        @Override
        public LocalDateTime getCreatedAt() {
            return LocalDateTime.of(2024, 1, 1, 9, 0);
        }

        @Override
        public LocalDateTime getCompletedAt() {
            return null;
        }
    }

    private static class RecordingSink implements StatusEventSink {

        private final List<String> names = new ArrayList<>();
        private final List<Object> payloads = new ArrayList<>();
        private Runnable onCloseCallback;
        private boolean completed;
        private boolean failing;

        @Override
        public void send(String eventName, Object payload) throws IOException {
            if (failing) {
                throw new IOException("broken pipe");
            }
            names.add(eventName);
            payloads.add(payload);
        }

        @Override
        public void complete() {
            completed = true;
        }

        @Override
        public void onClose(Runnable callback) {
            this.onCloseCallback = callback;
        }

        List<String> eventNames() {
            return names;
        }
    }
}
