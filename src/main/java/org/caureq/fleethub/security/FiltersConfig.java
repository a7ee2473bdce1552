package org.caureq.fleethub.security;

import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class FiltersConfig {

    @Bean
    public FilterRegistrationBean<BearerTokenFilter> bearerFilterRegistration(BearerTokenFilter f) {
        var reg = new FilterRegistrationBean<>(f);
        reg.setOrder(5);
        reg.addUrlPatterns("/api/*");
        return reg;
    }

    @Bean
    public FilterRegistrationBean<SuperAdminFilter> adminFilterRegistration(SuperAdminFilter f) {
        var reg = new FilterRegistrationBean<>(f);
        reg.setOrder(10); // needs the caller set by the bearer filter
        reg.addUrlPatterns("/api/admin/*");
        return reg;
    }
}
