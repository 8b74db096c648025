package com.premiergroup.ad_optimizer.store;

import com.premiergroup.ad_optimizer.entity.Ad;
import com.premiergroup.ad_optimizer.entity.AdSet;
import com.premiergroup.ad_optimizer.entity.Campaign;
import com.premiergroup.ad_optimizer.enums.EntityStatus;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

/**
 * Ad sets, ads and campaigns as owned by the account. Updates are conditional on the entity's expected
 * current state and return whether a row was changed.
 */
public interface EntityStore {

    Optional<AdSet> findAdSet(String adSetId);

    Optional<Ad> findAd(String adId);

    Optional<Campaign> findCampaign(String campaignId);

    /**
     * @param accountId optional account filter, null for all accounts
     */
    List<String> findAdSetIds(EntityStatus status, String accountId);

    List<String> findAdIds(EntityStatus status, String accountId);

    BigDecimal sumActiveAdSetBudgets(String campaignId);

    /**
     * @return false when the ad set is gone, no longer in {@code expectedStatus}, or already in {@code status}
     */
    boolean updateAdSetStatus(String adSetId, EntityStatus expectedStatus, EntityStatus status);

    /**
     * @return false when the ad set is gone or its status or budget changed since {@code expected*} were read
     */
    boolean updateAdSetBudget(String adSetId, EntityStatus expectedStatus, BigDecimal expectedBudget,
                              BigDecimal budget);

    boolean updateAdStatus(String adId, EntityStatus expectedStatus, EntityStatus status);

    long countActiveAdSets(String accountId);

    long countLearningAdSets(String accountId);
}
