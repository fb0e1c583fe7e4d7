package com.menuvo.menuImport.job.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Request DTO for applying a reviewed import.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ApplyChangesRequest {

    @Valid
    @NotNull(message = "selections cannot be null")
    private List<ImportSelection> selections = new ArrayList<>();
}
