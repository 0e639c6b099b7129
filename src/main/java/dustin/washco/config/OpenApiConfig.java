package dustin.washco.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityScheme;

/**
 * OpenAPI (Swagger) 설정
 * OpenAPI Configuration
 *
 * 컨트롤러의 security = @SecurityRequirement(name = "BearerAuth") 와 연결되는 스킴 등록
 */
@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI washcoOpenApi() {
        return new OpenAPI()
                .info(new Info()
                        .title("Washco Auth API")
                        .description("Washco 인증/세션 API")
                        .version("v1"))
                .components(new Components()
                        .addSecuritySchemes("BearerAuth", new SecurityScheme()
                                .type(SecurityScheme.Type.HTTP)
                                .scheme("bearer")
                                .bearerFormat("JWT")));
    }
}
