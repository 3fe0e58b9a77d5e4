package br.edu.ifba.kgrag.concurrency;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of a batch run. A failed unit never hides the others.
 *
 * @param successes    results in completion order
 * @param unitFailures one entry per failed input, in completion order
 * @param cancelled    units never submitted because the batch was cancelled
 * @param <T> result type
 */
public record BatchResult<T>(List<T> successes, List<UnitFailure> unitFailures, int cancelled) {

    public BatchResult {
        successes = List.copyOf(successes);
        unitFailures = List.copyOf(unitFailures);
    }

    /**
     * Failure message per unit key, in completion order. When the same key
     * failed more than once the first message is kept; {@link #failureCount()}
     * still counts every input.
     */
    public Map<String, String> failures() {
        Map<String, String> byUnit = new LinkedHashMap<>();
        for (UnitFailure failure : unitFailures) {
            byUnit.putIfAbsent(failure.unit(), failure.message());
        }
        return Collections.unmodifiableMap(byUnit);
    }

    public int successCount() {
        return successes.size();
    }

    public int failureCount() {
        return unitFailures.size();
    }

    public int total() {
        return successes.size() + unitFailures.size() + cancelled;
    }

    /**
     * @return true when every unit was submitted and succeeded
     */
    public boolean isComplete() {
        return unitFailures.isEmpty() && cancelled == 0;
    }

    /**
     * A failed input of the batch.
     *
     * @param unit    key reported for the input
     * @param message exception type and message
     */
    public record UnitFailure(String unit, String message) {}
}
