package com.voxelagent.config;

import com.voxelagent.domain.identifier.service.IdentifierFormatDomainService;
import com.voxelagent.domain.identifier.service.IdentifierFormatter;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.ZoneId;

/**
 * 标识符格式化器装配。
 */
@Slf4j
@Configuration
public class IdentifierConfig {

    @Bean
    public Clock identifierClock(IdentifierProperties properties) {
        if (StringUtils.isBlank(properties.getZoneId())) {
            return Clock.systemDefaultZone();
        }
        return Clock.system(ZoneId.of(properties.getZoneId().trim()));
    }

    @Bean
    public IdentifierFormatter identifierFormatter(Clock identifierClock, IdentifierProperties properties) {
        log.info("IDENTIFIER_FORMATTER_INIT zone={}, suffixLength={}, alphabetSize={}",
                identifierClock.getZone(),
                properties.getSuffixLength(),
                StringUtils.length(properties.getSuffixAlphabet()));
        return new IdentifierFormatDomainService(identifierClock,
                new SecureRandom(),
                properties.getSuffixLength(),
                properties.getSuffixAlphabet());
    }
}
