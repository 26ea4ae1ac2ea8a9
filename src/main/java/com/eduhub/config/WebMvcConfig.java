package com.eduhub.config;

import com.eduhub.quota.ApiQuotaInterceptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Registers the API call accounting interceptor.
 *
 * Tenant resolution itself runs earlier, in
 * {@link com.eduhub.security.TenantResolutionFilter}, so the interceptor
 * sees the bound context. Requests without a context pass uncharged.
 */
@Configuration
public class WebMvcConfig implements WebMvcConfigurer {
    
    private static final Logger log = LoggerFactory.getLogger(WebMvcConfig.class);
    
    private final ApiQuotaInterceptor apiQuotaInterceptor;
    
    public WebMvcConfig(ApiQuotaInterceptor apiQuotaInterceptor) {
        this.apiQuotaInterceptor = apiQuotaInterceptor;
    }
    
    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        registry.addInterceptor(apiQuotaInterceptor)
            .addPathPatterns("/api/**")
            .excludePathPatterns("/api/usage")
            .order(0);
        
        log.info("ApiQuotaInterceptor registered for /api/**");
    }
}
