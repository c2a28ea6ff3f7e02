package com.lendora.lending.repository;

import com.lendora.lending.domain.LoanActivity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface LoanActivityRepository extends JpaRepository<LoanActivity, Long> {

    List<LoanActivity> findByLoanIdOrderByIdAsc(Long loanId);
}
