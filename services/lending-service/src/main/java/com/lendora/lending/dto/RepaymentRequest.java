package com.lendora.lending.dto;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class RepaymentRequest {

    @NotNull
    @DecimalMin(value = "1")
    @Digits(integer = 38, fraction = 0)
    private BigDecimal amount;

    @NotBlank
    private String payerId;
}
