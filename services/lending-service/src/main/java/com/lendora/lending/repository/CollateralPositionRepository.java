package com.lendora.lending.repository;

import com.lendora.lending.domain.CollateralPosition;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface CollateralPositionRepository extends JpaRepository<CollateralPosition, Long> {

    Optional<CollateralPosition> findByBorrowerIdAndAssetId(String borrowerId, String assetId);

    List<CollateralPosition> findByBorrowerIdOrderByAssetIdAsc(String borrowerId);
}
