package com.premiergroup.ad_optimizer.store;

import com.premiergroup.ad_optimizer.entity.Ad;
import com.premiergroup.ad_optimizer.entity.AdSet;
import com.premiergroup.ad_optimizer.entity.Campaign;
import com.premiergroup.ad_optimizer.enums.EntityStatus;
import com.premiergroup.ad_optimizer.enums.LearningPhaseStatus;
import com.premiergroup.ad_optimizer.repository.AdRepository;
import com.premiergroup.ad_optimizer.repository.AdSetRepository;
import com.premiergroup.ad_optimizer.repository.CampaignRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

@Component
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class JpaEntityStore implements EntityStore {

    private final AdSetRepository adSetRepository;
    private final AdRepository adRepository;
    private final CampaignRepository campaignRepository;

    @Override
    public Optional<AdSet> findAdSet(String adSetId) {
        return adSetRepository.findByAdSetId(adSetId);
    }

    @Override
    public Optional<Ad> findAd(String adId) {
        return adRepository.findByAdId(adId);
    }

    @Override
    public Optional<Campaign> findCampaign(String campaignId) {
        return campaignRepository.findByCampaignId(campaignId);
    }

    @Override
    public List<String> findAdSetIds(EntityStatus status, String accountId) {
        return adSetRepository.findAdSetIdsByStatus(status, accountId);
    }

    @Override
    public List<String> findAdIds(EntityStatus status, String accountId) {
        return adRepository.findAdIdsByStatus(status, accountId);
    }

    @Override
    public BigDecimal sumActiveAdSetBudgets(String campaignId) {
        BigDecimal sum = adSetRepository.sumBudgetByCampaignIdAndStatus(campaignId, EntityStatus.ACTIVE);
        return sum != null ? sum : BigDecimal.ZERO;
    }

    @Override
    @Transactional
    public boolean updateAdSetStatus(String adSetId, EntityStatus expectedStatus, EntityStatus status) {
        return adSetRepository.updateStatus(adSetId, expectedStatus, status) > 0;
    }

    @Override
    @Transactional
    public boolean updateAdSetBudget(String adSetId, EntityStatus expectedStatus, BigDecimal expectedBudget,
                                     BigDecimal budget) {
        return adSetRepository.updateBudget(adSetId, expectedStatus, expectedBudget, budget) > 0;
    }

    @Override
    @Transactional
    public boolean updateAdStatus(String adId, EntityStatus expectedStatus, EntityStatus status) {
        return adRepository.updateStatus(adId, expectedStatus, status) > 0;
    }

    @Override
    public long countActiveAdSets(String accountId) {
        return accountId == null
                ? adSetRepository.countByStatus(EntityStatus.ACTIVE)
                : adSetRepository.countByStatusAndAccountId(EntityStatus.ACTIVE, accountId);
    }

    @Override
    public long countLearningAdSets(String accountId) {
        return accountId == null
                ? adSetRepository.countByStatusAndLearningPhaseStatus(EntityStatus.ACTIVE, LearningPhaseStatus.LEARNING)
                : adSetRepository.countByStatusAndLearningPhaseStatusAndAccountId(
                        EntityStatus.ACTIVE, LearningPhaseStatus.LEARNING, accountId);
    }
}
