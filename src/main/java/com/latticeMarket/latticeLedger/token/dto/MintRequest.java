package com.latticeMarket.latticeLedger.token.dto;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class MintRequest {

    @NotNull(message = "seed is required")
    private Long seed;
}
