package io.flaresignals.engine;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Container for results from several analyzers run over one history.
 *
 * <h2>Usage</h2>
 *
 * <pre>{@code
 * AnalysisResults results = harness.run(observations);
 *
 * FlareAnalysis flare = results.getResult("flare", FlareAnalysis.class);
 *
 * if (results.hasErrors()) {
 *     results.getErrors().forEach((type, error) ->
 *         System.err.println(type + " failed: " + error.getMessage()));
 * }
 * }</pre>
 *
 * <p>Maps keep the order in which the analyzers were registered.
 *
 * @see AnalyzerHarness
 */
public final class AnalysisResults {

    private final Map<String, Object> results;
    private final Map<String, Throwable> errors;
    private final int observationCount;
    private final long processingTimeMs;

    /**
     * Creates an AnalysisResults with results and errors.
     *
     * @param results map of analyzer type to result object
     * @param errors map of analyzer type to error (if any failed)
     * @param observationCount number of observations analyzed
     * @param processingTimeMs total processing time in milliseconds
     */
    public AnalysisResults(Map<String, Object> results, Map<String, Throwable> errors, int observationCount, long processingTimeMs) {
        this.results = Collections.unmodifiableMap(new LinkedHashMap<>(results));
        this.errors = Collections.unmodifiableMap(new LinkedHashMap<>(errors));
        this.observationCount = observationCount;
        this.processingTimeMs = processingTimeMs;
    }

    /**
     * Gets a result by analyzer type with type safety.
     *
     * @param analyzerType the analyzer type identifier
     * @param resultClass the expected result class
     * @param <R> the result type
     * @return the result, or null if not found or type mismatch
     */
    @SuppressWarnings("unchecked")
    public <R> R getResult(String analyzerType, Class<R> resultClass) {
        Object result = results.get(analyzerType);
        if (result != null && resultClass.isAssignableFrom(result.getClass())) {
            return (R) result;
        }
        return null;
    }

    public Object getResult(String analyzerType) {
        return results.get(analyzerType);
    }

    public boolean hasResult(String analyzerType) {
        return results.containsKey(analyzerType);
    }

    public Map<String, Object> getAllResults() {
        return results;
    }

    public Set<String> getSuccessfulAnalyzers() {
        return results.keySet();
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    public Throwable getError(String analyzerType) {
        return errors.get(analyzerType);
    }

    public Map<String, Throwable> getErrors() {
        return errors;
    }

    public Set<String> getFailedAnalyzers() {
        return errors.keySet();
    }

    public int getObservationCount() {
        return observationCount;
    }

    public long getProcessingTimeMs() {
        return processingTimeMs;
    }

    /**
     * Returns a multi-line summary of the results.
     *
     * @return human-readable summary
     */
    public String getSummary() {
        StringBuilder sb = new StringBuilder();
        sb.append("AnalysisResults:\n");
        sb.append(String.format("  Observations: %d, processing time: %dms\n", observationCount, processingTimeMs));
        sb.append(String.format("  Successful: %d, Failed: %d\n", results.size(), errors.size()));

        if (!results.isEmpty()) {
            sb.append("  Results:\n");
            for (Map.Entry<String, Object> entry : results.entrySet()) {
                sb.append(String.format("    - %s: %s\n",
                    entry.getKey(),
                    entry.getValue().getClass().getSimpleName()));
            }
        }

        if (!errors.isEmpty()) {
            sb.append("  Errors:\n");
            for (Map.Entry<String, Throwable> entry : errors.entrySet()) {
                sb.append(String.format("    - %s: %s\n",
                    entry.getKey(),
                    entry.getValue().getMessage()));
            }
        }

        return sb.toString();
    }

    @Override
    public String toString() {
        return String.format("AnalysisResults[results=%d, errors=%d, observations=%d, time=%dms]",
            results.size(), errors.size(), observationCount, processingTimeMs);
    }
}
