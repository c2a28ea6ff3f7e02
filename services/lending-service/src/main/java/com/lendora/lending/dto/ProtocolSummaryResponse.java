package com.lendora.lending.dto;

import com.lendora.lending.domain.LoanStatus;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Map;

@Value
@Builder
public class ProtocolSummaryResponse {
    Map<LoanStatus, Long> loansByStatus;
    BigDecimal totalOutstanding;
    long parameterVersion;
    long liquidationCount;
}
