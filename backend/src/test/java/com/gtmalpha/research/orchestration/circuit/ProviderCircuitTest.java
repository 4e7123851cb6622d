package com.gtmalpha.research.orchestration.circuit;

import com.gtmalpha.research.orchestration.model.CircuitState;
import com.gtmalpha.research.orchestration.support.MutableClock;
import com.gtmalpha.research.orchestration.support.ResearchPipelineFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class ProviderCircuitTest {
    private MutableClock clock;
    private ProviderCircuit circuit;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-03-02T10:00:00Z"));
        circuit = new ProviderCircuit("firecrawl", ResearchPipelineFixture.CIRCUIT_SETTINGS, clock);
    }

    @Test
    void opensOnceTenCallsAreAllFailures() {
        for (int i = 0; i < 9; i++) {
            assertThat(circuit.tryAcquire()).isTrue();
            circuit.recordFailure();
        }
        assertThat(circuit.state()).isEqualTo(CircuitState.CLOSED);

        circuit.recordFailure();

        assertThat(circuit.state()).isEqualTo(CircuitState.OPEN);
        assertThat(circuit.tryAcquire()).isFalse();
    }

    @Test
    void halfTheWindowFailingDoesNotOpen() {
        for (int i = 0; i < 10; i++) {
            if (i % 2 == 0) {
                circuit.recordFailure();
            } else {
                circuit.recordSuccess();
            }
        }

        assertThat(circuit.state()).isEqualTo(CircuitState.CLOSED);
        assertThat(circuit.snapshot().failureRate()).isEqualTo(0.5);
    }

    @Test
    void windowForgetsOldOutcomes() {
        for (int i = 0; i < 5; i++) {
            circuit.recordFailure();
        }
        for (int i = 0; i < 10; i++) {
            circuit.recordSuccess();
        }
        for (int i = 0; i < 5; i++) {
            circuit.recordFailure();
        }

        assertThat(circuit.state()).isEqualTo(CircuitState.CLOSED);
        assertThat(circuit.snapshot().windowCalls()).isEqualTo(10);
    }

    @Test
    void cooldownLetsExactlyOneProbeThrough() {
        trip();

        clock.advance(Duration.ofSeconds(59));
        assertThat(circuit.tryAcquire()).isFalse();

        clock.advance(Duration.ofSeconds(1));
        assertThat(circuit.tryAcquire()).isTrue();
        assertThat(circuit.state()).isEqualTo(CircuitState.HALF_OPEN);
        assertThat(circuit.tryAcquire()).isFalse();
    }

    @Test
    void successfulProbeClosesCircuit() {
        trip();
        clock.advance(Duration.ofSeconds(60));
        assertThat(circuit.tryAcquire()).isTrue();

        circuit.recordSuccess();

        assertThat(circuit.state()).isEqualTo(CircuitState.CLOSED);
        assertThat(circuit.tryAcquire()).isTrue();
        assertThat(circuit.snapshot().transitions()).isEqualTo(3);
    }

    @Test
    void failedProbeReopensWithLongerCooldown() {
        trip();
        clock.advance(Duration.ofSeconds(60));
        assertThat(circuit.tryAcquire()).isTrue();

        circuit.recordFailure();

        assertThat(circuit.state()).isEqualTo(CircuitState.OPEN);
        clock.advance(Duration.ofSeconds(60));
        assertThat(circuit.tryAcquire()).isFalse();
        clock.advance(Duration.ofSeconds(60));
        assertThat(circuit.tryAcquire()).isTrue();
    }

    @Test
    void releasedProbeCanBeRetaken() {
        trip();
        clock.advance(Duration.ofSeconds(60));
        assertThat(circuit.tryAcquire()).isTrue();

        circuit.releaseProbe();

        assertThat(circuit.state()).isEqualTo(CircuitState.HALF_OPEN);
        assertThat(circuit.tryAcquire()).isTrue();
    }

    @Test
    void cooldownGrowthIsCapped() {
        CircuitSettings settings = new CircuitSettings(10, 10, 0.5, Duration.ofSeconds(60), 2.0, Duration.ofSeconds(100));

        assertThat(settings.nextCooldown(Duration.ofSeconds(60))).isEqualTo(Duration.ofSeconds(100));
    }

    private void trip() {
        for (int i = 0; i < 10; i++) {
            circuit.recordFailure();
        }
        assertThat(circuit.state()).isEqualTo(CircuitState.OPEN);
    }
}
