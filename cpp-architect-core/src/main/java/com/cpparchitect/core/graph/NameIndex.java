package com.cpparchitect.core.graph;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

import com.cpparchitect.core.model.UnresolvedReference.Reason;

/**
 * Exact-name lookup over register entities, without type information.
 *
 * <p>A name resolves when it equals exactly one entity's qualified name, or failing that,
 * exactly one entity's simple name. Several candidates make the reference ambiguous;
 * nothing is guessed.
 *
 * @param <T> entity type
 */
final class NameIndex<T> {

    private final Map<String, List<T>> byQualifiedName = new LinkedHashMap<>();
    private final Map<String, List<T>> bySimpleName = new LinkedHashMap<>();

    NameIndex(List<T> entities, Function<T, String> simpleName, Function<T, String> qualifiedName) {
        for (T entity : entities) {
            byQualifiedName.computeIfAbsent(qualifiedName.apply(entity), k -> new ArrayList<>()).add(entity);
            bySimpleName.computeIfAbsent(simpleName.apply(entity), k -> new ArrayList<>()).add(entity);
        }
    }

    /**
     * Resolves a reference.
     *
     * @param rawName name as written in source
     * @return the single match, or the reason there is none
     */
    Resolution<T> resolve(String rawName) {
        String name = normalize(rawName);
        List<T> qualified = byQualifiedName.getOrDefault(name, List.of());
        if (qualified.size() == 1) {
            return Resolution.resolved(qualified.get(0));
        }
        if (qualified.size() > 1) {
            return Resolution.failed(Reason.AMBIGUOUS);
        }
        List<T> simple = bySimpleName.getOrDefault(name, List.of());
        if (simple.size() == 1) {
            return Resolution.resolved(simple.get(0));
        }
        return Resolution.failed(simple.isEmpty() ? Reason.UNKNOWN : Reason.AMBIGUOUS);
    }

    /**
     * Drops a leading global-scope qualifier and an explicit {@code this->} receiver.
     */
    static String normalize(String name) {
        String result = name.trim();
        if (result.startsWith("::")) {
            result = result.substring(2);
        }
        if (result.startsWith("this->")) {
            result = result.substring("this->".length());
        }
        return result;
    }

    /**
     * Outcome of a lookup: a target or a failure reason.
     */
    record Resolution<T>(T target, Reason reason) {
        static <T> Resolution<T> resolved(T target) {
            return new Resolution<>(target, null);
        }

        static <T> Resolution<T> failed(Reason reason) {
            return new Resolution<>(null, reason);
        }

        boolean isResolved() {
            return target != null;
        }
    }
}
