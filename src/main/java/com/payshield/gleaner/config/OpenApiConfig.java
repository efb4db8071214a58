package com.payshield.gleaner.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class OpenApiConfig {

    @Value("${server.port:2406}")
    private String serverPort;

    @Bean
    public OpenAPI gleanerOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("PayShield Invoice Gleaner API")
                        .description("""
                                Batch anomaly detection over vendor invoice history.

                                ## Gleans
                                - vendor_not_seen_in_a_while: first bill after more than 90 days of silence
                                - accrual_alert: invoice or line items cover periods more than 90 days ahead
                                - large_month_increase_mtd: month-to-date spend far above the 12 month average
                                - no_invoice_received: a monthly or quarterly invoice did not arrive on its usual day
                                """)
                        .version("1.0.0")
                        .contact(new Contact()
                                .name("PayShield Team")
                                .url("https://payshield.com")))
                .servers(List.of(
                        new Server()
                                .url("http://localhost:" + serverPort)
                                .description("Local Development Server")));
    }
}
