package net.revivatech.config;

import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.util.Assert;

/**
 * Business identity used in document heads and structured data.
 */
@Component
@ConfigurationProperties(prefix = "site")
public class SiteProperties {

    private String baseUrl = "https://revivatech.co.uk";
    private String name = "RevivaTech";
    private String titleSuffix = " | RevivaTech";
    private String defaultOgImage = "/images/default-og.png";
    private String logo = "/images/logo.png";
    private String telephone = "+44-20-7123-4567";
    private String email = "info@revivatech.co.uk";
    private String themeColor = "#0f172a";

    @PostConstruct
    void validate() {
        Assert.hasText(baseUrl, "site.base-url must not be blank");
        Assert.isTrue(baseUrl.startsWith("http"), "site.base-url must be an absolute URL");
        Assert.hasText(name, "site.name must not be blank");
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getTitleSuffix() {
        return titleSuffix;
    }

    public void setTitleSuffix(String titleSuffix) {
        this.titleSuffix = titleSuffix;
    }

    public String getDefaultOgImage() {
        return defaultOgImage;
    }

    public void setDefaultOgImage(String defaultOgImage) {
        this.defaultOgImage = defaultOgImage;
    }

    public String getLogo() {
        return logo;
    }

    public void setLogo(String logo) {
        this.logo = logo;
    }

    public String getTelephone() {
        return telephone;
    }

    public void setTelephone(String telephone) {
        this.telephone = telephone;
    }

    public String getEmail() {
        return email;
    }

    public void setEmail(String email) {
        this.email = email;
    }

    public String getThemeColor() {
        return themeColor;
    }

    public void setThemeColor(String themeColor) {
        this.themeColor = themeColor;
    }
}
