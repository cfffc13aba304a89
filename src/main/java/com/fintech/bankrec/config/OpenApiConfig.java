package com.fintech.bankrec.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI bankReconciliationOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Bank Reconciliation API")
                        .description("Operator API for matching bank statement lines to receipts: trigger runs, "
                                + "import CSV batches, inspect the audit trail and re-match linked records.")
                        .version("1.0.0"))
                .servers(List.of(
                        new Server().url("http://localhost:8080").description("Development server")
                ));
    }
}
