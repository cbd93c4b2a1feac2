package io.fullerstack.performance.engine.events;

import io.fullerstack.performance.core.model.Analysis;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class AnalyzerEventsTest {

    private AnalyzerEvents events;

    @BeforeEach
    void setUp() {
        events = new AnalyzerEvents();
    }

    @Test
    @DisplayName("a throwing listener does not stop delivery to the others")
    void listenerFailureIsIsolated() {
        // given
        AnalyzerListener failing = mock(AnalyzerListener.class);
        AnalyzerListener healthy = mock(AnalyzerListener.class);
        doThrow(new IllegalStateException("listener bug")).when(failing).onInitialized();
        events.subscribe(failing);
        events.subscribe(healthy);

        // when
        events.initialized();

        // then
        verify(failing).onInitialized();
        verify(healthy).onInitialized();
    }

    @Test
    void closedSubscriptionStopsDelivery() {
        AnalyzerListener listener = mock(AnalyzerListener.class);
        Subscription subscription = events.subscribe(listener);

        subscription.close();
        events.analysisFailed(new IllegalStateException("cycle failed"));

        verify(listener, never()).onAnalysisFailed(any());
        assertThat(events.listenerCount()).isZero();
    }

    @Test
    void shutdownCarriesFinalAnalysis() {
        AnalyzerListener listener = mock(AnalyzerListener.class);
        events.subscribe(listener);

        events.shutdown(Optional.empty());

        verify(listener).onShutdown(Optional.<Analysis>empty());
    }

    @Test
    void listenersWithOnlyDefaultsAreAccepted() {
        events.subscribe(new AnalyzerListener() {
        });

        events.initialized();
        events.analysisFailed(new IllegalStateException("ignored"));

        assertThat(events.listenerCount()).isEqualTo(1);
    }
}
