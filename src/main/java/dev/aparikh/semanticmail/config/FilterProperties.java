package dev.aparikh.semanticmail.config;

import dev.aparikh.semanticmail.filter.FilterPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.unit.DataSize;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Filter switches and domain lists. Configured blacklisted domains are added to
 * {@link FilterPolicy#DEFAULT_BLACKLISTED_DOMAINS}.
 */
@Validated
@ConfigurationProperties(prefix = "filter")
public class FilterProperties {

    private boolean enableDomainFiltering = true;
    private boolean enableContentFiltering = true;
    private boolean enableSizeFiltering = true;
    private boolean strictMode = false;

    private DataSize maxEmailSize = DataSize.ofBytes(FilterPolicy.DEFAULT_MAX_EMAIL_SIZE);

    private List<String> blacklistedDomains = new ArrayList<>();
    private List<String> whitelistedDomains = new ArrayList<>();

    public FilterPolicy toPolicy() {
        List<String> blacklist = new ArrayList<>(FilterPolicy.DEFAULT_BLACKLISTED_DOMAINS);
        blacklist.addAll(blacklistedDomains);
        return new FilterPolicy(enableDomainFiltering, enableContentFiltering, enableSizeFiltering, strictMode,
                maxEmailSize.toBytes(), blacklist, whitelistedDomains);
    }

    public boolean isEnableDomainFiltering() {
        return enableDomainFiltering;
    }

    public void setEnableDomainFiltering(boolean enableDomainFiltering) {
        this.enableDomainFiltering = enableDomainFiltering;
    }

    public boolean isEnableContentFiltering() {
        return enableContentFiltering;
    }

    public void setEnableContentFiltering(boolean enableContentFiltering) {
        this.enableContentFiltering = enableContentFiltering;
    }

    public boolean isEnableSizeFiltering() {
        return enableSizeFiltering;
    }

    public void setEnableSizeFiltering(boolean enableSizeFiltering) {
        this.enableSizeFiltering = enableSizeFiltering;
    }

    public boolean isStrictMode() {
        return strictMode;
    }

    public void setStrictMode(boolean strictMode) {
        this.strictMode = strictMode;
    }

    public DataSize getMaxEmailSize() {
        return maxEmailSize;
    }

    public void setMaxEmailSize(DataSize maxEmailSize) {
        this.maxEmailSize = maxEmailSize;
    }

    public List<String> getBlacklistedDomains() {
        return blacklistedDomains;
    }

    public void setBlacklistedDomains(List<String> blacklistedDomains) {
        this.blacklistedDomains = blacklistedDomains;
    }

    public List<String> getWhitelistedDomains() {
        return whitelistedDomains;
    }

    public void setWhitelistedDomains(List<String> whitelistedDomains) {
        this.whitelistedDomains = whitelistedDomains;
    }
}
