package com.menuvo.menuImport.menu.repository;

import com.menuvo.menuImport.comparison.model.MenuChangeSet;

/**
 * Write access to a store's live menu.
 */
public interface LiveMenuWriter {

    /**
     * Applies a change set: create entries produce new records, update entries patch the
     * matched record. Entries are applied in order categories, items, option groups.
     */
    void apply(MenuChangeSet changeSet);
}
