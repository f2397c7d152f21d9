package com.deepansh.policyradar.provider;

import com.deepansh.policyradar.config.RadarProperties;
import com.deepansh.policyradar.model.DataSource;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.Set;

/**
 * Which data sources have the credentials they need.
 * The api.data.gov key gates Regulations.gov, GovInfo and Congress.gov;
 * Search.gov needs both its affiliate and access key.
 */
@Component
public class SourceAvailability {

    private final RadarProperties.Providers providers;

    public SourceAvailability(RadarProperties properties) {
        this.providers = properties.getProviders();
    }

    public Set<DataSource> configuredSources() {
        Set<DataSource> sources = EnumSet.allOf(DataSource.class);
        if (!providers.hasGovApiKey()) {
            sources.remove(DataSource.REGULATIONS);
            sources.remove(DataSource.GOVINFO);
            sources.remove(DataSource.CONGRESS);
        }
        if (!providers.hasSearchGovCredentials()) {
            sources.remove(DataSource.SEARCHGOV);
        }
        return sources;
    }
}
