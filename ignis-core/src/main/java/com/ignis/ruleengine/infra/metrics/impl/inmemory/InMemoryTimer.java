package com.ignis.ruleengine.infra.metrics.impl.inmemory;

import com.ignis.ruleengine.infra.metrics.Timer;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Keeps every recorded duration so tests can assert on them.
 */
final class InMemoryTimer implements Timer {
    private final List<Duration> recordings = new CopyOnWriteArrayList<>();

    @Override
    public void record(Duration duration) {
        if (duration.isNegative()) {
            throw new IllegalArgumentException("Cannot record negative duration: " + duration);
        }
        recordings.add(duration);
    }

    @Override
    public long count() {
        return recordings.size();
    }

    List<Duration> recordings() {
        return List.copyOf(recordings);
    }
}
