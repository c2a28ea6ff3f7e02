package com.lendora.lending.repository;

import com.lendora.lending.domain.Loan;
import com.lendora.lending.domain.LoanStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public interface LoanRepository extends JpaRepository<Loan, Long> {

    Optional<Loan> findByLoanNumber(String loanNumber);

    List<Loan> findByBorrowerIdOrderByOriginatedAtDesc(String borrowerId);

    /**
     * Loans secured by one collateral position.
     */
    List<Loan> findByBorrowerIdAndCollateralAssetAndStatus(String borrowerId, String collateralAsset, LoanStatus status);

    List<Loan> findByStatus(LoanStatus status);

    List<Loan> findByStatusAndMaturityAtLessThanEqual(LoanStatus status, Instant maturity);

    long countByStatus(LoanStatus status);

    @Query("select distinct l.collateralAsset from Loan l where l.status = :status")
    List<String> findDistinctCollateralAssetsByStatus(@Param("status") LoanStatus status);

    @Query("select coalesce(sum(l.outstandingPrincipal + l.outstandingInterest), 0) from Loan l where l.status = :status")
    BigDecimal sumOutstandingBalanceByStatus(@Param("status") LoanStatus status);
}
