package com.tasksmith.core.run;

/**
 * Check applied to a run's output after the execution service reported success and before the
 * run is marked completed.
 */
@FunctionalInterface
public interface RunVerifier {

    /**
     * @throws com.tasksmith.workspace.PolicyViolationException if the output is unacceptable
     */
    void verify();
}
