package com.optmodeler.core.symbol;

import java.util.Objects;

/**
 * A name handed out by a {@link SymbolRegistry} together with its creation index.
 *
 * @param name unique name within the registry
 * @param kind kind of the component owning the name
 * @param creationIndex monotonically increasing index assigned at registration
 */
public record RegisteredName(String name, SymbolKind kind, long creationIndex) {

    public RegisteredName {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        if (creationIndex < 0) {
            throw new IllegalArgumentException("creationIndex must not be negative");
        }
    }
}
