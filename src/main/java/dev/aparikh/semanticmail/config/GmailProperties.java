package dev.aparikh.semanticmail.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "gmail")
public class GmailProperties {

    @NotBlank
    private String baseUrl = "https://gmail.googleapis.com/gmail/v1/users/me";

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }
}
