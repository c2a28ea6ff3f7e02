package com.lendora.lending.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * OpenAPI/Swagger Configuration
 *
 * Accessible at: /swagger-ui.html
 */
@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI lendingServiceOpenAPI() {
        return new OpenAPI()
            .info(new Info()
                .title("Lendora Lending Service API")
                .version("1.0.0")
                .description("""
                    Collateralized lending protocol.

                    - **Loans**: origination, repayment, health checks and term expiry
                    - **Collateral**: deposits, withdrawals and price references
                    - **Liquidations**: append-only liquidation and default history
                    - **Administration**: audited changes to rate and liquidation parameters

                    Amounts are integers in the smallest currency unit. Rates and ratios are basis points.
                    """));
    }
}
