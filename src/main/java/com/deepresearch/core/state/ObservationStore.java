package com.deepresearch.core.state;

import com.deepresearch.core.model.Observation;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Ordered, append-only collection of every observation made in a session.
 * <p>
 * There is no way to remove or reorder entries. Reads return immutable snapshots,
 * so a snapshot handed to a collaborator never changes underneath it.
 */
public class ObservationStore {

    private final List<Observation> observations = new ArrayList<>();

    public synchronized void append(Observation observation) {
        if (observation == null) {
            throw new IllegalArgumentException("observation must not be null");
        }
        observations.add(observation);
    }

    public synchronized void appendAll(Collection<Observation> batch) {
        for (Observation observation : batch) {
            append(observation);
        }
    }

    public synchronized int size() {
        return observations.size();
    }

    public synchronized boolean isEmpty() {
        return observations.isEmpty();
    }

    public synchronized List<Observation> snapshot() {
        return List.copyOf(observations);
    }

    public synchronized List<String> contents() {
        return observations.stream().map(Observation::content).toList();
    }
}
