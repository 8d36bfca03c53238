package com.latticeMarket.latticeLedger.admin.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PlatformSettingsResponse {

    private String admin;
    private int platformFeeBps;
}
