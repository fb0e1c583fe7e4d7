package com.menuvo.menuImport.menu.repository;

import com.menuvo.menuImport.menu.model.ExistingMenuSnapshot;

/**
 * Read access to a store's live menu.
 */
public interface ExistingMenuProvider {

    /**
     * Returns a snapshot of the store's live menu; an empty snapshot for an unknown store.
     * Callers may not assume the snapshot reflects later writes.
     */
    ExistingMenuSnapshot getExistingMenu(String storeId);
}
