package com.premiergroup.ad_optimizer.repository;

import com.premiergroup.ad_optimizer.entity.Ad;
import com.premiergroup.ad_optimizer.enums.EntityStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface AdRepository extends JpaRepository<Ad, Integer> {

    Optional<Ad> findByAdId(String adId);

    @Query("select a.adId from Ad a where a.status = :status "
            + "and (:accountId is null or a.accountId = :accountId) order by a.id")
    List<String> findAdIdsByStatus(@Param("status") EntityStatus status,
                                   @Param("accountId") String accountId);

    @Modifying(clearAutomatically = true)
    @Query("update Ad a set a.status = :status "
            + "where a.adId = :adId and a.status = :expectedStatus and a.status <> :status")
    int updateStatus(@Param("adId") String adId,
                     @Param("expectedStatus") EntityStatus expectedStatus,
                     @Param("status") EntityStatus status);
}
