package com.latticeMarket.latticeLedger.collection.dto;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CollectionStatusRequest {

    @NotNull(message = "isOpen is required")
    private Boolean isOpen;
}
