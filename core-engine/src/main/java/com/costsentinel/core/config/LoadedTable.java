package com.costsentinel.core.config;

/**
 * Base for taxonomy tables that SnakeYAML fills through their setters.
 * The loader freezes every table after validation; from then on each
 * setter throws {@link IllegalStateException}.
 *
 * @since 1.0.0
 */
abstract class LoadedTable {

    private boolean frozen;

    void freeze() {
        frozen = true;
    }

    final void checkMutable() {
        if (frozen) {
            throw new IllegalStateException(getClass().getSimpleName() + " is read-only once loaded");
        }
    }
}
