package com.example.products.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.Ordered;

/**
 * Registers the request pipeline.
 *
 * Exception handling, routing and endpoint dispatch are Spring Boot
 * defaults: the error page registered for server.error.path (/error),
 * the DispatcherServlet, and the @RestController handler methods. The
 * only stage added here is the HTTPS redirect, placed in front of every
 * other filter so that an insecure request never reaches routing.
 */
@Configuration
public class PipelineConfig {

    @Value("${app.https-redirect.port:#{null}}")
    private Integer httpsPort;

    @Value("${app.https-redirect.status:307}")
    private int redirectStatus;

    @Bean
    public FilterRegistrationBean<HttpsRedirectFilter> httpsRedirectFilter() {
        FilterRegistrationBean<HttpsRedirectFilter> registration =
            new FilterRegistrationBean<>(new HttpsRedirectFilter(httpsPort, redirectStatus));
        registration.setName("httpsRedirectFilter");
        registration.addUrlPatterns("/*");
        registration.setOrder(Ordered.HIGHEST_PRECEDENCE);
        return registration;
    }
}
