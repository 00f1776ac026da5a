package com.hiltest.application.service;

import com.hiltest.domain.model.TestCase;
import com.hiltest.domain.model.TestOutcome;
import com.hiltest.domain.model.TestResult;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Seguimiento de resultados durante la ejecución de un plan.
 *
 * - Pruebas superadas, fallidas y omitidas en conjuntos disjuntos
 * - Registro de reintentos: se crea en el primer fallo y se elimina al pasar
 * - Un nombre puede pasar de fallido a superado, nunca estar en dos conjuntos
 *
 * Pertenece a un único bucle de ejecución; no es seguro para uso concurrente.
 */
public class ResultTracker {

    private final int maxRetries;

    private final Set<String> passed = new LinkedHashSet<>();
    private final Set<String> failed = new LinkedHashSet<>();
    private final Set<String> skipped = new LinkedHashSet<>();

    // nombre -> reintentos restantes
    private final Map<String, Integer> retryLedger = new LinkedHashMap<>();

    public ResultTracker(int maxRetries) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries no puede ser negativo: " + maxRetries);
        }
        this.maxRetries = maxRetries;
    }

    /**
     * Registra una prueba omitida.
     *
     * Si la prueba ya había fallado (el dispositivo desapareció durante un
     * reintento) sigue como fallida y consume un reintento. Una prueba ya
     * superada no cambia.
     */
    public void registerSkip(String testName) {
        if (passed.contains(testName)) {
            return;
        }
        if (failed.contains(testName)) {
            retryLedger.computeIfPresent(testName, (name, remaining) -> remaining - 1);
            return;
        }
        skipped.add(testName);
    }

    /**
     * Registra un fallo. El primero crea la entrada de reintentos con el
     * máximo configurado; los siguientes la decrementan.
     */
    public void registerFail(String testName) {
        skipped.remove(testName);
        if (!failed.contains(testName)) {
            failed.add(testName);
            retryLedger.put(testName, maxRetries);
        } else {
            retryLedger.computeIfPresent(testName, (name, remaining) -> remaining - 1);
        }
    }

    /**
     * Registra una prueba superada, eliminándola de fallidas y del registro
     * de reintentos.
     */
    public void registerPass(String testName) {
        if (failed.remove(testName)) {
            retryLedger.remove(testName);
        }
        skipped.remove(testName);
        passed.add(testName);
    }

    /**
     * Pruebas de la lista que todavía tienen reintentos disponibles.
     */
    public List<TestCase> filterRetries(List<TestCase> tests) {
        return tests.stream()
                .filter(t -> retryLedger.getOrDefault(t.getName(), 0) > 0)
                .collect(Collectors.toList());
    }

    /**
     * Reintentos restantes de una prueba, vacío si no tiene entrada.
     */
    public Optional<Integer> remainingRetries(String testName) {
        return Optional.ofNullable(retryLedger.get(testName));
    }

    public boolean hasFailures() {
        return !failed.isEmpty();
    }

    public List<String> getPassed() {
        return List.copyOf(passed);
    }

    public List<String> getFailed() {
        return List.copyOf(failed);
    }

    public List<String> getSkipped() {
        return List.copyOf(skipped);
    }

    public Map<String, Integer> getRetryLedger() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(retryLedger));
    }

    /**
     * Resultado final de cada prueba registrada.
     */
    public List<TestResult> toResults() {
        List<TestResult> results = new ArrayList<>();
        passed.forEach(name -> results.add(result(name, TestOutcome.PASSED)));
        failed.forEach(name -> results.add(result(name, TestOutcome.FAILED)));
        skipped.forEach(name -> results.add(result(name, TestOutcome.SKIPPED)));
        return results;
    }

    private TestResult result(String name, TestOutcome outcome) {
        return TestResult.builder()
                .name(name)
                .outcome(outcome)
                .remainingRetries(retryLedger.get(name))
                .build();
    }
}
