package com.latticeMarket.latticeLedger.admin.dto;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for changing the platform fee.
 * The range is enforced by the ledger, which reports it as InvalidParameters.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PlatformFeeRequest {

    @NotNull(message = "feeBps is required")
    private Integer feeBps;
}
