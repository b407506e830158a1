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

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.stream.Stream;

/**
 * Discovers {@link SignalAnalyzer} implementations via SPI.
 *
 * <h2>Usage</h2>
 *
 * <pre>{@code
 * Optional<SignalAnalyzer<?>> flare = SignalAnalyzerIO.get("flare");
 * List<String> names = SignalAnalyzerIO.getAvailableNames();
 *
 * AnalyzerHarness harness = new AnalyzerHarness();
 * SignalAnalyzerIO.get("food-correlation").ifPresent(harness::register);
 * }</pre>
 *
 * <p>Each lookup returns a fresh instance configured with defaults.
 *
 * @see SignalAnalyzer
 * @see AnalyzerName
 */
public final class SignalAnalyzerIO {

    private SignalAnalyzerIO() {
    }

    /**
     * Gets an analyzer by name.
     *
     * @param name the analyzer name to find
     * @return a new instance of the analyzer, or empty if not found
     */
    public static Optional<SignalAnalyzer<?>> get(String name) {
        return providers()
            .filter(provider -> name.equals(getAnalyzerName(provider)))
            .findFirst()
            .map(provider -> (SignalAnalyzer<?>) provider.get());
    }

    /**
     * Gets an analyzer by name with its result type.
     *
     * @param name the analyzer name to find
     * @param resultType the expected result class
     * @param <R> the result type
     * @return a new instance of the analyzer, or empty if not found
     */
    @SuppressWarnings("unchecked")
    public static <R> Optional<SignalAnalyzer<R>> get(String name, Class<R> resultType) {
        return get(name).map(a -> (SignalAnalyzer<R>) a);
    }

    /**
     * Gets new instances of all registered analyzers, sorted by name.
     *
     * @return list of analyzer instances
     */
    public static List<SignalAnalyzer<?>> getAll() {
        List<SignalAnalyzer<?>> result = new ArrayList<>();
        providers()
            .sorted((a, b) -> getAnalyzerName(a).compareTo(getAnalyzerName(b)))
            .forEach(provider -> result.add((SignalAnalyzer<?>) provider.get()));
        return result;
    }

    /**
     * Gets the names of all registered analyzers, sorted.
     *
     * @return list of analyzer names
     */
    public static List<String> getAvailableNames() {
        List<String> names = new ArrayList<>();
        providers().forEach(provider -> names.add(getAnalyzerName(provider)));
        names.sort(String::compareTo);
        return names;
    }

    /**
     * Checks if an analyzer with the given name is registered.
     *
     * @param name the analyzer name to check
     * @return true if an analyzer with the given name exists
     */
    public static boolean isAvailable(String name) {
        return providers().anyMatch(provider -> name.equals(getAnalyzerName(provider)));
    }

    @SuppressWarnings("rawtypes")
    private static Stream<ServiceLoader.Provider<SignalAnalyzer>> providers() {
        return ServiceLoader.load(SignalAnalyzer.class).stream();
    }

    @SuppressWarnings("rawtypes")
    private static String getAnalyzerName(ServiceLoader.Provider<SignalAnalyzer> provider) {
        AnalyzerName annotation = provider.type().getAnnotation(AnalyzerName.class);
        if (annotation != null) {
            return annotation.value();
        }
        return provider.get().getAnalyzerType();
    }
}
