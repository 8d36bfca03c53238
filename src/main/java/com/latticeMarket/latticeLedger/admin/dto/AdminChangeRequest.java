package com.latticeMarket.latticeLedger.admin.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class AdminChangeRequest {

    @NotBlank(message = "newAdmin cannot be blank")
    private String newAdmin;
}
