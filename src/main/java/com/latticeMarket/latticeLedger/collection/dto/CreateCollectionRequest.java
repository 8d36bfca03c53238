package com.latticeMarket.latticeLedger.collection.dto;

import com.latticeMarket.latticeLedger.collection.model.ExtraParam;
import com.latticeMarket.latticeLedger.collection.model.LatticeConnection;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Request DTO for creating a collection.
 * The creator comes from the X-Account-ID header. Range and size limits are
 * enforced by the registry so they surface as ledger error kinds.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CreateCollectionRequest {

    @NotBlank(message = "name cannot be blank")
    private String name;

    private String description;

    @NotNull(message = "maxSupply is required")
    private Long maxSupply;

    @NotNull(message = "mintPrice is required")
    private Long mintPrice;

    @NotNull(message = "royaltyBps is required")
    private Integer royaltyBps;

    @NotBlank(message = "metadataLocator cannot be blank")
    private String metadataLocator;

    @NotNull(message = "dimensions is required")
    private Integer dimensions;

    @NotNull(message = "nodeCount is required")
    private Integer nodeCount;

    private List<LatticeConnection> connections;
    private String colorScheme;
    private List<String> transformations;
    private List<ExtraParam> extraParams;
}
