package com.latticeMarket.latticeLedger.marketplace.dto;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for listing a token.
 * Price bounds are checked by the marketplace ledger.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ListingRequest {

    @NotNull(message = "price is required")
    private Long price;
}
