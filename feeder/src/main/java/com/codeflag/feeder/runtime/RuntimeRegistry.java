package com.codeflag.feeder.runtime;

import com.codeflag.feeder.piston.dto.PistonRuntime;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Language name or alias → engine runtime, case-insensitive.
 *
 * Built once at startup and never modified, so lookups need no locking.
 * When several runtimes claim the same name, the first one listed wins.
 * The engine itself matches names case-sensitively, so callers send the
 * runtime's own language name rather than what they looked up.
 */
public final class RuntimeRegistry {

    private final Map<String, PistonRuntime> runtimes;

    private RuntimeRegistry(Map<String, PistonRuntime> runtimes) {
        this.runtimes = Map.copyOf(runtimes);
    }

    public static RuntimeRegistry of(List<PistonRuntime> runtimes) {
        Map<String, PistonRuntime> byName = new HashMap<>();
        for (PistonRuntime runtime : runtimes) {
            if (runtime.language() == null || runtime.version() == null) {
                continue;
            }
            byName.putIfAbsent(normalize(runtime.language()), runtime);
            for (String alias : runtime.aliasesOrEmpty()) {
                if (alias != null) {
                    byName.putIfAbsent(normalize(alias), runtime);
                }
            }
        }
        return new RuntimeRegistry(byName);
    }

    public Optional<PistonRuntime> resolve(String language) {
        if (language == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(runtimes.get(normalize(language)));
    }

    /** Number of distinct names and aliases. */
    public int size() {
        return runtimes.size();
    }

    private static String normalize(String name) {
        return name.toLowerCase(Locale.ROOT);
    }
}
