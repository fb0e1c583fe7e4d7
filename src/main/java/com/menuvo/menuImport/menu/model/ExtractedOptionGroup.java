package com.menuvo.menuImport.menu.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;

/**
 * Option group (sizes, extras, sides...) as read from the merchant's document. Immutable.
 */
@Value
@AllArgsConstructor
@Builder(toBuilder = true)
public class ExtractedOptionGroup {

    private String name;

    private String description;

    @Builder.Default
    private OptionGroupType type = OptionGroupType.SINGLE_SELECT;

    @JsonProperty("isRequired")
    private boolean required;

    @Builder.Default
    private List<ExtractedOptionChoice> choices = new ArrayList<>();

    /**
     * Names of the items this group is offered on.
     */
    @Builder.Default
    private List<String> appliesTo = new ArrayList<>();
}
