package com.candor.api.config;

import com.candor.core.domain.Principal;
import com.candor.core.store.CaseStore;
import com.candor.core.store.InMemoryCaseStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class CaseStoreConfiguration {

    private static final Logger log = LoggerFactory.getLogger(CaseStoreConfiguration.class);

    @Bean
    public CaseStore caseStore(CandorProperties properties) {
        if (properties.getAuthority() == null || properties.getAuthority().isBlank()) {
            throw new IllegalStateException("candor.case.authority must be set");
        }
        Principal authority = Principal.of(properties.getAuthority());
        if (authority.isNone()) {
            throw new IllegalStateException("Invalid authority address");
        }
        log.info("Case store initialised with authority {}", authority);
        return new InMemoryCaseStore(authority);
    }
}
