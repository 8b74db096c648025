package com.premiergroup.ad_optimizer.engine;

import lombok.extern.log4j.Log4j2;

import java.math.BigDecimal;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Committed budget per campaign for the duration of one cycle.
 */
@Log4j2
public class CampaignBudgetLedger {

    private final Function<String, BigDecimal> committedBudgetLoader;
    private final Map<String, BigDecimal> committed = new ConcurrentHashMap<>();

    /**
     * @param committedBudgetLoader sum of the ACTIVE ad-set budgets of a campaign, called once per campaign
     */
    public CampaignBudgetLedger(Function<String, BigDecimal> committedBudgetLoader) {
        this.committedBudgetLoader = committedBudgetLoader;
    }

    /**
     * Reserves up to {@code requestedIncrease} of the campaign's remaining headroom.
     *
     * @return the granted increase, between zero and {@code requestedIncrease}
     */
    public BigDecimal reserve(String campaignId, BigDecimal campaignTotalBudget, BigDecimal requestedIncrease) {
        if (requestedIncrease.signum() <= 0) {
            return BigDecimal.ZERO;
        }
        BigDecimal[] granted = {BigDecimal.ZERO};
        committed.compute(campaignId, (id, current) -> {
            BigDecimal base = current != null ? current : loadCommitted(id);
            BigDecimal headroom = campaignTotalBudget.subtract(base);
            if (headroom.signum() <= 0) {
                return base;
            }
            granted[0] = requestedIncrease.min(headroom);
            return base.add(granted[0]);
        });
        if (granted[0].compareTo(requestedIncrease) < 0) {
            log.info("Campaign {} headroom limited budget increase to {} (requested {})",
                    campaignId, granted[0], requestedIncrease);
        }
        return granted[0];
    }

    /**
     * Returns headroom granted to an increase that was not applied.
     */
    public void release(String campaignId, BigDecimal grantedIncrease) {
        if (grantedIncrease == null || grantedIncrease.signum() <= 0) {
            return;
        }
        committed.computeIfPresent(campaignId, (id, current) -> current.subtract(grantedIncrease));
        log.debug("Released {} of campaign {} headroom", grantedIncrease, campaignId);
    }

    public BigDecimal committed(String campaignId) {
        return committed.getOrDefault(campaignId, BigDecimal.ZERO);
    }

    private BigDecimal loadCommitted(String campaignId) {
        BigDecimal loaded = committedBudgetLoader.apply(campaignId);
        return loaded != null ? loaded : BigDecimal.ZERO;
    }
}
