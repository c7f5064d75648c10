package com.anthem.csrfp.protector.config;

import com.anthem.csrfp.core.CsrfProtector;
import com.anthem.csrfp.protector.filter.CsrfProtectionFilter;
import jakarta.servlet.DispatcherType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.Ordered;

/**
 * Builds the protector from {@link CsrfpProperties} and puts its filter in
 * front of every request. A configuration error here stops the application.
 */
@Configuration
@EnableConfigurationProperties(CsrfpProperties.class)
@ConditionalOnProperty(prefix = "csrfp", name = "enabled", havingValue = "true", matchIfMissing = true)
public class CsrfProtectorConfig {

    private static final Logger log = LoggerFactory.getLogger(CsrfProtectorConfig.class);

    @Bean
    public CsrfProtector csrfProtector(CsrfpProperties properties) {
        log.info("Loading CSRF protector configuration: logDirectory={}, jsFile={}",
                properties.getLogDirectory(), properties.getJsFile());
        return CsrfProtector.init(properties.toConfig(), properties.toOverrides());
    }

    @Bean
    public FilterRegistrationBean<CsrfProtectionFilter> csrfProtectionFilter(CsrfProtector csrfProtector) {
        FilterRegistrationBean<CsrfProtectionFilter> registration =
                new FilterRegistrationBean<>(new CsrfProtectionFilter(csrfProtector));
        registration.addUrlPatterns("/*");
        registration.setDispatcherTypes(DispatcherType.REQUEST, DispatcherType.ASYNC);
        registration.setOrder(Ordered.HIGHEST_PRECEDENCE + 10);
        registration.setName("csrfProtectionFilter");
        return registration;
    }
}
