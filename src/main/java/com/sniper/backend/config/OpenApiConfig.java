package com.sniper.backend.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.tags.Tag;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI sniperOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Financial Sniper API")
                        .description("Motor de decisão de compras: capacidade de pagamento, importação, parcelamento e Smart Choice.")
                        .version("v1")
                        .contact(new Contact()
                                .name("Financial Sniper")
                                .email("contato@financialsniper.app")
                        )
                )
                .addTagsItem(new Tag().name("capacity").description("Capacidade de pagamento"))
                .addTagsItem(new Tag().name("imports").description("Custo de importação"))
                .addTagsItem(new Tag().name("payments").description("À vista vs. parcelado"))
                .addTagsItem(new Tag().name("smart-choice").description("Ranking de ofertas"))
                .addTagsItem(new Tag().name("affordability").description("Classificação de risco"))
                .addTagsItem(new Tag().name("projects").description("Projetos de compra"))
                .addTagsItem(new Tag().name("quotes").description("Cotação do dólar e leitura de preços"));
    }
}
