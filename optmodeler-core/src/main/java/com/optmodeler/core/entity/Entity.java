package com.optmodeler.core.entity;

import com.optmodeler.core.container.Container;
import com.optmodeler.core.symbol.SymbolKind;

import java.util.Set;

/**
 * A named, declared component of a container: a set, parameter, variable or implicit variable.
 *
 * <p>Entities are created by the factory methods of {@link Container} and belong to exactly
 * one container for their whole life.
 */
public interface Entity {

    String getName();

    SymbolKind getKind();

    /**
     * Returns the creation index handed out by the owner's registry. Declarations render in
     * ascending creation order.
     *
     * @return creation index
     */
    long getCreationIndex();

    Container getOwner();

    /**
     * Returns the entities this entity's declaration refers to, such as indexing sets or
     * parameters used in an initializer.
     *
     * @return referenced entities, empty if none
     */
    default Set<Entity> getDependencies() {
        return Set.of();
    }
}
