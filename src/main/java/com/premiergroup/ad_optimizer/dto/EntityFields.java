package com.premiergroup.ad_optimizer.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.premiergroup.ad_optimizer.enums.EntityStatus;

import java.math.BigDecimal;

/**
 * The mutable fields of an ad set or ad. Either side of a decision's mutation names only the fields it
 * touches; absent fields are null.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record EntityFields(EntityStatus status, BigDecimal budget) {

    public static EntityFields status(EntityStatus status) {
        return new EntityFields(status, null);
    }

    public static EntityFields budget(BigDecimal budget) {
        return new EntityFields(null, budget);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return status == null && budget == null;
    }
}
