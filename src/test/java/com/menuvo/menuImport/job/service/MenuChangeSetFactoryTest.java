package com.menuvo.menuImport.job.service;

import com.menuvo.menuImport.comparison.model.DiffAction;
import com.menuvo.menuImport.comparison.model.MenuChangeSet;
import com.menuvo.menuImport.job.dto.ImportSelection;
import com.menuvo.menuImport.job.dto.SelectionEntityType;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class MenuChangeSetFactoryTest {

    @Test
    void skippedEntitiesAreNeverIncluded() {
        MenuChangeSet changeSet = MenuChangeSetFactory.fromSelections("store-1", MenuImportServiceTest.comparison(),
                List.of(new ImportSelection(SelectionEntityType.CATEGORY, "Drinks"),
                        new ImportSelection(SelectionEntityType.ITEM, "Coca Cola 0.3l")));

        assertThat(changeSet.isEmpty()).isTrue();
    }

    @Test
    void selectionTypeMustMatchEntity() {
        MenuChangeSet changeSet = MenuChangeSetFactory.fromSelections("store-1", MenuImportServiceTest.comparison(),
                List.of(new ImportSelection(SelectionEntityType.ITEM, "Pizza"),
                        new ImportSelection(SelectionEntityType.CATEGORY, "Extras")));

        assertThat(changeSet.isEmpty()).isTrue();
    }

    @Test
    void updateKeepsLiveIdsAndCreateHasNone() {
        MenuChangeSet changeSet = MenuChangeSetFactory.fromSelections("store-1", MenuImportServiceTest.comparison(),
                List.of(new ImportSelection(SelectionEntityType.CATEGORY, "Pizza"),
                        new ImportSelection(SelectionEntityType.OPTION_GROUP, "Extras")));

        assertThat(changeSet.getCategories()).singleElement().satisfies(change -> {
            assertThat(change.getAction()).isEqualTo(DiffAction.UPDATE);
            assertThat(change.getExistingId()).isEqualTo("cat-pizza");
        });
        assertThat(changeSet.getOptionGroups()).singleElement().satisfies(change -> {
            assertThat(change.getAction()).isEqualTo(DiffAction.CREATE);
            assertThat(change.getExistingId()).isNull();
            assertThat(change.getGroup().getName()).isEqualTo("Extras");
        });
        assertThat(changeSet.getItems()).isEmpty();
    }
}
