package com.optmodeler.core.symbol;

import com.optmodeler.core.exception.DuplicateNameException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Issues unique names and creation indices for the components of one container.
 *
 * <p>Every container owns exactly one registry; there is no process-wide state. Names
 * are either supplied by the caller or synthesized per kind ({@code var_1}, {@code con_1},
 * ...). Synthesized names skip any candidate already taken, so a caller may freely mix
 * explicit and synthesized names.
 *
 * <p>Creation indices are never reused, even after {@link #release(String)}, which keeps
 * the declaration order of a container stable across drops and re-adds.
 *
 * <p>Example:
 * <pre>{@code
 * SymbolRegistry registry = new SymbolRegistry("production");
 * RegisteredName x = registry.register("x", SymbolKind.VARIABLE);      // x, #0
 * RegisteredName anon = registry.register(null, SymbolKind.VARIABLE);  // var_1, #1
 * }</pre>
 */
public class SymbolRegistry {

    private static final Logger log = LoggerFactory.getLogger(SymbolRegistry.class);

    private final String ownerName;
    private final Map<String, RegisteredName> names = new LinkedHashMap<>();
    private final Map<SymbolKind, Integer> counters = new EnumMap<>(SymbolKind.class);
    private long nextIndex;

    public SymbolRegistry(String ownerName) {
        this.ownerName = ownerName == null ? "" : ownerName;
    }

    /**
     * Registers a name for a new component.
     *
     * @param preferredName requested name, or null/blank to synthesize one
     * @param kind component kind
     * @return registered name with its creation index
     * @throws DuplicateNameException if the preferred name is already in use
     */
    public RegisteredName register(String preferredName, SymbolKind kind) {
        if (kind == null) {
            throw new IllegalArgumentException("kind must not be null");
        }
        String name = preferredName == null || preferredName.isBlank()
                ? synthesize(kind)
                : normalize(preferredName);

        if (names.containsKey(name)) {
            throw new DuplicateNameException(name, ownerName);
        }
        RegisteredName registered = new RegisteredName(name, kind, nextIndex++);
        names.put(name, registered);
        log.trace("Registered {} '{}' as #{} in '{}'", kind, name, registered.creationIndex(), ownerName);
        return registered;
    }

    /**
     * Frees a name so it can be registered again. The creation index is not reused.
     *
     * @param name name to release
     * @return true if the name was registered
     */
    public boolean release(String name) {
        return names.remove(name) != null;
    }

    /**
     * Puts back a name released earlier, keeping its original creation index.
     *
     * @param registered name returned by an earlier {@link #register(String, SymbolKind)}
     * @throws DuplicateNameException if the name was taken in the meantime
     */
    public void restore(RegisteredName registered) {
        if (names.containsKey(registered.name())) {
            throw new DuplicateNameException(registered.name(), ownerName);
        }
        names.put(registered.name(), registered);
    }

    /**
     * Clears all names and per-kind counters.
     *
     * <p>Creation indices restart at zero, so rebuilding the same model after a reset
     * reproduces the same names and order.
     */
    public void reset() {
        names.clear();
        counters.clear();
        nextIndex = 0;
        log.debug("Registry of '{}' reset", ownerName);
    }

    public boolean isRegistered(String name) {
        return names.containsKey(name);
    }

    /**
     * Returns the creation index of a registered name.
     *
     * @param name registered name
     * @return creation index, or -1 if unknown
     */
    public long creationIndex(String name) {
        RegisteredName registered = names.get(name);
        return registered == null ? -1 : registered.creationIndex();
    }

    /**
     * Returns all live names in creation order.
     *
     * @return unmodifiable list of names
     */
    public List<RegisteredName> names() {
        return Collections.unmodifiableList(new ArrayList<>(names.values()));
    }

    public String getOwnerName() {
        return ownerName;
    }

    private String synthesize(SymbolKind kind) {
        String candidate;
        do {
            int next = counters.merge(kind, 1, Integer::sum);
            candidate = kind.getPrefix() + "_" + next;
        } while (names.containsKey(candidate));
        return candidate;
    }

    private static String normalize(String name) {
        String trimmed = name.trim();
        return trimmed.replace(' ', '_');
    }
}
