package com.gtmalpha.research.orchestration.circuit;

import com.gtmalpha.research.orchestration.model.CircuitSnapshot;
import com.gtmalpha.research.orchestration.model.CircuitState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

public class ProviderCircuit {
    private static final Logger log = LoggerFactory.getLogger(ProviderCircuit.class);

    private final String providerId;
    private final CircuitSettings settings;
    private final Clock clock;
    private final boolean[] window;
    private int windowCalls;
    private int windowFailures;
    private int nextSlot;
    private CircuitState state = CircuitState.CLOSED;
    private Instant cooldownUntil;
    private Duration cooldown;
    private boolean probeInFlight;
    private long transitions;

    public ProviderCircuit(String providerId, CircuitSettings settings, Clock clock) {
        this.providerId = providerId;
        this.settings = settings;
        this.clock = clock;
        this.window = new boolean[settings.windowSize()];
        this.cooldown = settings.cooldown();
    }

    /**
     * Returns true when a call may proceed. In half-open state only the first caller gets through;
     * that caller must report back through {@link #recordSuccess()}, {@link #recordFailure()} or
     * {@link #releaseProbe()}.
     */
    public synchronized boolean tryAcquire() {
        switch (state) {
            case CLOSED:
                return true;
            case OPEN:
                if (clock.instant().isBefore(cooldownUntil)) {
                    return false;
                }
                transitionTo(CircuitState.HALF_OPEN);
                probeInFlight = true;
                return true;
            case HALF_OPEN:
            default:
                if (probeInFlight) {
                    return false;
                }
                probeInFlight = true;
                return true;
        }
    }

    public synchronized void recordSuccess() {
        if (state == CircuitState.HALF_OPEN) {
            probeInFlight = false;
            cooldown = settings.cooldown();
            cooldownUntil = null;
            clearWindow();
            transitionTo(CircuitState.CLOSED);
            return;
        }
        if (state == CircuitState.CLOSED) {
            record(false);
        }
    }

    public synchronized void recordFailure() {
        if (state == CircuitState.HALF_OPEN) {
            probeInFlight = false;
            cooldown = settings.nextCooldown(cooldown);
            open();
            return;
        }
        if (state != CircuitState.CLOSED) {
            return;
        }
        record(true);
        if (windowCalls >= settings.minimumCalls()
            && ((double) windowFailures / windowCalls) > settings.failureRateThreshold()) {
            open();
        }
    }

    public synchronized void releaseProbe() {
        if (state == CircuitState.HALF_OPEN) {
            probeInFlight = false;
        }
    }

    public synchronized CircuitState state() {
        return state;
    }

    public synchronized CircuitSnapshot snapshot() {
        double rate = windowCalls == 0 ? 0.0 : (double) windowFailures / windowCalls;
        return new CircuitSnapshot(providerId, state, windowCalls, rate, cooldownUntil, transitions);
    }

    public String providerId() {
        return providerId;
    }

    private void open() {
        cooldownUntil = clock.instant().plus(cooldown);
        clearWindow();
        transitionTo(CircuitState.OPEN);
        log.warn("Circuit opened for provider {} until {}", providerId, cooldownUntil);
    }

    private void record(boolean failure) {
        if (windowCalls == window.length) {
            if (window[nextSlot]) {
                windowFailures--;
            }
        } else {
            windowCalls++;
        }
        window[nextSlot] = failure;
        if (failure) {
            windowFailures++;
        }
        nextSlot = (nextSlot + 1) % window.length;
    }

    private void clearWindow() {
        for (int i = 0; i < window.length; i++) {
            window[i] = false;
        }
        windowCalls = 0;
        windowFailures = 0;
        nextSlot = 0;
    }

    private void transitionTo(CircuitState next) {
        if (state != next) {
            log.debug("Circuit {} {} -> {}", providerId, state, next);
            state = next;
            transitions++;
        }
    }
}
