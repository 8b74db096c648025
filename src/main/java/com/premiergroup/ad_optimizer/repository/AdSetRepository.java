package com.premiergroup.ad_optimizer.repository;

import com.premiergroup.ad_optimizer.entity.AdSet;
import com.premiergroup.ad_optimizer.enums.EntityStatus;
import com.premiergroup.ad_optimizer.enums.LearningPhaseStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

public interface AdSetRepository extends JpaRepository<AdSet, Integer> {

    Optional<AdSet> findByAdSetId(String adSetId);

    @Query("select a.adSetId from AdSet a where a.status = :status "
            + "and (:accountId is null or a.accountId = :accountId) order by a.id")
    List<String> findAdSetIdsByStatus(@Param("status") EntityStatus status,
                                      @Param("accountId") String accountId);

    @Query("select sum(a.budget) from AdSet a where a.campaignId = :campaignId and a.status = :status")
    BigDecimal sumBudgetByCampaignIdAndStatus(@Param("campaignId") String campaignId,
                                              @Param("status") EntityStatus status);

    @Modifying(clearAutomatically = true)
    @Query("update AdSet a set a.status = :status "
            + "where a.adSetId = :adSetId and a.status = :expectedStatus and a.status <> :status")
    int updateStatus(@Param("adSetId") String adSetId,
                     @Param("expectedStatus") EntityStatus expectedStatus,
                     @Param("status") EntityStatus status);

    @Modifying(clearAutomatically = true)
    @Query("update AdSet a set a.budget = :budget where a.adSetId = :adSetId "
            + "and a.status = :expectedStatus and coalesce(a.budget, 0) = :expectedBudget")
    int updateBudget(@Param("adSetId") String adSetId,
                     @Param("expectedStatus") EntityStatus expectedStatus,
                     @Param("expectedBudget") BigDecimal expectedBudget,
                     @Param("budget") BigDecimal budget);

    long countByStatus(EntityStatus status);

    long countByStatusAndAccountId(EntityStatus status, String accountId);

    long countByStatusAndLearningPhaseStatus(EntityStatus status, LearningPhaseStatus learningPhaseStatus);

    long countByStatusAndLearningPhaseStatusAndAccountId(EntityStatus status,
                                                         LearningPhaseStatus learningPhaseStatus,
                                                         String accountId);
}
