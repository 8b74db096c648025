package com.premiergroup.ad_optimizer.repository;

import com.premiergroup.ad_optimizer.entity.Campaign;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface CampaignRepository extends JpaRepository<Campaign, Integer> {

    Optional<Campaign> findByCampaignId(String campaignId);
}
