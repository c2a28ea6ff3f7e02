package com.lendora.lending.repository;

import com.lendora.lending.domain.LiquidationEvent;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface LiquidationEventRepository extends JpaRepository<LiquidationEvent, Long> {

    List<LiquidationEvent> findByLoanIdOrderByIdAsc(Long loanId);

    List<LiquidationEvent> findAllByOrderByIdDesc();

    long countByLoanId(Long loanId);
}
