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

import io.flaresignals.engine.model.Observation;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/// Runs several analyzers over the same observation history.
///
/// ## Usage
///
/// ```java
/// AnalyzerHarness harness = new AnalyzerHarness()
///     .register("flare")
///     .register(new FoodCorrelationAnalyzer(config.getCorrelation()));
///
/// AnalysisResults results = harness.run(observations);
/// ```
///
/// Each analyzer receives an unmodifiable copy of the history. A failing
/// analyzer is logged and recorded under its type in the results while the
/// remaining analyzers still run. With fail-fast enabled the remaining
/// analyzers are skipped instead.
public final class AnalyzerHarness {

    private static final Logger logger = LogManager.getLogger(AnalyzerHarness.class);

    private final Map<String, SignalAnalyzer<?>> analyzers = new LinkedHashMap<>();
    private boolean failFast = false;

    public AnalyzerHarness() {
    }

    /// Sets whether to stop at the first failing analyzer.
    ///
    /// @param failFast true to stop on first error, false to run the others (default)
    /// @return this harness for chaining
    public AnalyzerHarness failFast(boolean failFast) {
        this.failFast = failFast;
        return this;
    }

    /// Registers an analyzer instance.
    ///
    /// @param analyzer the analyzer to register
    /// @return this harness for chaining
    /// @throws IllegalArgumentException if an analyzer of the same type is already registered
    public AnalyzerHarness register(SignalAnalyzer<?> analyzer) {
        Objects.requireNonNull(analyzer, "analyzer cannot be null");
        String type = analyzer.getAnalyzerType();
        if (analyzers.containsKey(type)) {
            throw new IllegalArgumentException("An analyzer of type '" + type + "' is already registered");
        }
        analyzers.put(type, analyzer);
        return this;
    }

    /// Registers an analyzer by name using SPI discovery.
    ///
    /// @param analyzerName the name of the analyzer to register
    /// @return this harness for chaining
    /// @throws IllegalArgumentException if no analyzer with the given name is found
    public AnalyzerHarness register(String analyzerName) {
        Optional<SignalAnalyzer<?>> analyzer = SignalAnalyzerIO.get(analyzerName);
        if (analyzer.isEmpty()) {
            throw new IllegalArgumentException(
                "No analyzer found with name: " + analyzerName +
                ". Available: " + SignalAnalyzerIO.getAvailableNames());
        }
        return register(analyzer.get());
    }

    /// Registers every analyzer found through SPI.
    ///
    /// @return this harness for chaining
    public AnalyzerHarness registerAllAvailable() {
        for (SignalAnalyzer<?> analyzer : SignalAnalyzerIO.getAll()) {
            register(analyzer);
        }
        return this;
    }

    /// Returns the registered analyzer types in registration order.
    public List<String> getRegisteredTypes() {
        return List.copyOf(analyzers.keySet());
    }

    /// Runs all registered analyzers.
    ///
    /// @param observations the history to analyze, in any order
    /// @return results and errors keyed by analyzer type
    public AnalysisResults run(List<Observation> observations) {
        Objects.requireNonNull(observations, "observations cannot be null");
        List<Observation> input = Collections.unmodifiableList(new ArrayList<>(observations));
        Map<String, Object> results = new LinkedHashMap<>();
        Map<String, Throwable> errors = new LinkedHashMap<>();
        long start = System.currentTimeMillis();

        for (SignalAnalyzer<?> analyzer : analyzers.values()) {
            String type = analyzer.getAnalyzerType();
            try {
                Object result = analyzer.analyze(input);
                results.put(type, Objects.requireNonNull(result, "analyzer '" + type + "' returned null"));
                logger.debug("Analyzer '{}' completed over {} observations", type, input.size());
            } catch (RuntimeException e) {
                logger.error("Analyzer '{}' failed", type, e);
                errors.put(type, e);
                if (failFast) {
                    break;
                }
            }
        }

        return new AnalysisResults(results, errors, input.size(), System.currentTimeMillis() - start);
    }
}
