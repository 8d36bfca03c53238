package com.latticeMarket.latticeLedger.balance.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One opening balance entry of the genesis file.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class GenesisBalance {

    private String account;
    private long amount;
}
