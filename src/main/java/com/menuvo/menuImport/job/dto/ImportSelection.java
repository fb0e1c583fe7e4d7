package com.menuvo.menuImport.job.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One entity of the diff picked for application, identified by its extracted name.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ImportSelection {

    @NotNull(message = "type cannot be null")
    private SelectionEntityType type;

    @NotBlank(message = "extractedName cannot be blank")
    private String extractedName;
}
