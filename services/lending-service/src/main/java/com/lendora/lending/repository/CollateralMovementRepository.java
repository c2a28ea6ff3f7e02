package com.lendora.lending.repository;

import com.lendora.lending.domain.CollateralMovement;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface CollateralMovementRepository extends JpaRepository<CollateralMovement, Long> {

    List<CollateralMovement> findByBorrowerIdAndAssetIdOrderByIdAsc(String borrowerId, String assetId);

    List<CollateralMovement> findByLoanIdOrderByIdAsc(Long loanId);
}
