package com.lendora.lending.dto;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Request to open a collateralized loan. Amounts are whole smallest units.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OriginateLoanRequest {

    @NotBlank
    private String borrowerId;

    /**
     * Lender identity or liquidity pool reference.
     */
    @NotBlank
    private String lenderId;

    @NotNull
    @DecimalMin(value = "1")
    @Digits(integer = 38, fraction = 0)
    private BigDecimal principal;

    @NotNull
    @Min(1)
    @Max(360)
    private Integer termMonths;

    @NotBlank
    private String collateralAsset;

    @NotNull
    @DecimalMin(value = "1")
    @Digits(integer = 38, fraction = 0)
    private BigDecimal collateralAmount;

    /**
     * Opaque credit attestation; absent means the borrower is priced as not credit eligible.
     */
    private String attestation;
}
