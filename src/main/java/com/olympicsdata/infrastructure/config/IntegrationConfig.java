package com.olympicsdata.infrastructure.config;

import com.olympicsdata.domain.reconcile.CountryAliasTable;
import com.olympicsdata.domain.reconcile.IdentifierReconciler;
import com.olympicsdata.domain.service.AgeCalculator;
import com.olympicsdata.domain.service.MedalTallyAggregator;
import com.olympicsdata.domain.service.TableMerger;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the integration engine, which itself carries no framework annotations.
 */
@Configuration
@EnableConfigurationProperties(IntegrationProperties.class)
public class IntegrationConfig {

    @Bean
    public CountryAliasTable countryAliasTable(IntegrationProperties properties) {
        return new CountryAliasTable(properties.getCountryAliases());
    }

    @Bean
    public IdentifierReconciler identifierReconciler(CountryAliasTable countryAliasTable) {
        return new IdentifierReconciler(countryAliasTable);
    }

    @Bean
    public TableMerger tableMerger() {
        return new TableMerger();
    }

    @Bean
    public AgeCalculator ageCalculator() {
        return new AgeCalculator();
    }

    @Bean
    public MedalTallyAggregator medalTallyAggregator(IntegrationProperties properties) {
        return new MedalTallyAggregator(properties.getTally().isCollapseTeamMedals());
    }
}
