package com.fintech.supply.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class OpenApiConfig {

    @Value("${supply.version:1.0.0}")
    private String version;

    @Bean
    public OpenAPI supplyReconciliationOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Token Supply Reconciliation API")
                        .description("Reports total and circulating token supply reconciled across the layer one "
                                + "and layer two ledgers, netting bridge flows so no token is counted twice.")
                        .version(version)
                        .contact(new Contact()
                                .name("Supply Team")
                                .email("supply@example.com"))
                        .license(new License()
                                .name("MIT License")
                                .url("https://opensource.org/licenses/MIT")))
                .servers(List.of(
                        new Server().url("http://localhost:8080").description("Development server")
                ));
    }
}
