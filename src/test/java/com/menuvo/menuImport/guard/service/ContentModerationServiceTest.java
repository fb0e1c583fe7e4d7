package com.menuvo.menuImport.guard.service;

import com.menuvo.menuImport.menu.model.ExtractedCategory;
import com.menuvo.menuImport.menu.model.ExtractedItem;
import com.menuvo.menuImport.menu.model.ExtractedMenuData;
import com.menuvo.menuImport.menu.model.ExtractedOptionChoice;
import com.menuvo.menuImport.menu.model.ExtractedOptionGroup;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ContentModerationServiceTest {

    private final ContentModerationService service = new ContentModerationService();

    @Test
    void offensiveFieldsAreReplacedAsAWhole() {
        ExtractedMenuData data = ExtractedMenuData.builder()
                .categories(List.of(ExtractedCategory.builder()
                        .name("Burgers")
                        .description("Holy sh1t these are good")
                        .items(List.of(
                                ExtractedItem.builder().name("Fucking Big Burger").description("Beef").price(1200)
                                        .categoryName("Burgers").build(),
                                ExtractedItem.builder().name("Cheeseburger").description("Cheddar").price(1100)
                                        .categoryName("Burgers").build()))
                        .build()))
                .optionGroups(List.of(ExtractedOptionGroup.builder()
                        .name("Shitty Sauces")
                        .choices(List.of(new ExtractedOptionChoice("Assholes Dip", 50), new ExtractedOptionChoice("Mayo", 0)))
                        .build()))
                .confidence(0.8)
                .build();

        ExtractedMenuData moderated = service.moderate(data);

        ExtractedCategory category = moderated.getCategories().get(0);
        assertThat(category.getName()).isEqualTo("Burgers");
        assertThat(category.getDescription()).isEqualTo(ContentModerationService.FILTERED_DESCRIPTION);
        assertThat(category.getItems()).extracting(ExtractedItem::getName)
                .containsExactly(ContentModerationService.FILTERED_ITEM, "Cheeseburger");
        assertThat(category.getItems().get(0).getDescription()).isEqualTo("Beef");

        ExtractedOptionGroup group = moderated.getOptionGroups().get(0);
        assertThat(group.getName()).isEqualTo(ContentModerationService.FILTERED_OPTION);
        assertThat(group.getChoices()).extracting(ExtractedOptionChoice::getName)
                .containsExactly(ContentModerationService.FILTERED_CHOICE, "Mayo");
        assertThat(moderated.getConfidence()).isEqualTo(0.8);
    }

    @Test
    void inputIsNotModified() {
        ExtractedMenuData data = ExtractedMenuData.builder()
                .categories(List.of(ExtractedCategory.builder().name("Fuck Fries").build()))
                .build();

        service.moderate(data);

        assertThat(data.getCategories().get(0).getName()).isEqualTo("Fuck Fries");
    }

    @Test
    void harmlessWordsContainingBlockedLettersPass() {
        assertThat(service.containsBlockedContent("Scunthorpe Pudding")).isFalse();
        assertThat(service.containsBlockedContent("Spicy Chicken")).isFalse();
        assertThat(service.containsBlockedContent(null)).isFalse();
    }
}
