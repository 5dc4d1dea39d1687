package com.flagship.partnership_tax.network;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Directed ownership edge: {@code upstream} owns {@code share} of {@code downstream}.
 */
@Value
public class PartnershipEdge {
    String upstream;
    String downstream;
    BigDecimal share;

    public PartnershipEdge withShare(BigDecimal newShare) {
        return new PartnershipEdge(upstream, downstream, newShare);
    }
}
