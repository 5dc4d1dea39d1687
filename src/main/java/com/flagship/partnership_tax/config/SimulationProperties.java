package com.flagship.partnership_tax.config;

import com.flagship.partnership_tax.network.AssetType;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import java.math.BigDecimal;
import java.util.EnumSet;
import java.util.Set;

/**
 * Tax rules and run behaviour, bound from the {@code simulation.*} properties.
 */
@ConfigurationProperties(prefix = "simulation")
@Validated
@Getter
@Setter
public class SimulationProperties {

    /**
     * Built-in loss above which a basis adjustment is mandatory.
     * A loss equal to the threshold does not trigger.
     */
    @NotNull
    @PositiveOrZero
    private BigDecimal substantialLossThreshold = new BigDecimal("250000");

    /**
     * Record negative liabilities (losses) as they are. When false, losses
     * are recorded as zero and tax records never decrease.
     */
    private boolean recognizeLosses = false;

    /**
     * Asset types left out of every tax and built-in loss computation.
     */
    @NotNull
    private Set<AssetType> excludedAssetTypes = EnumSet.of(AssetType.ANNUITY);

    /**
     * Stop a sequence at the first rejected transaction instead of skipping it.
     */
    private boolean stopOnRejection = false;

    public boolean isExcluded(AssetType type) {
        return excludedAssetTypes.contains(type);
    }
}
