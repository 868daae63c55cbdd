package com.talentforge.config;

import com.talentforge.security.AdminAuthInterceptor;
import com.talentforge.security.RateLimitInterceptor;
import com.talentforge.security.TranscriptCallbackAuthInterceptor;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
@RequiredArgsConstructor
public class WebMvcConfig implements WebMvcConfigurer {

    private final RateLimitInterceptor rateLimitInterceptor;
    private final AdminAuthInterceptor adminAuthInterceptor;
    private final TranscriptCallbackAuthInterceptor transcriptCallbackAuthInterceptor;

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        // Rate limit before authenticating
        registry.addInterceptor(rateLimitInterceptor)
                .addPathPatterns("/api/webhooks/**", "/api/admin/**");
        registry.addInterceptor(adminAuthInterceptor)
                .addPathPatterns("/api/admin/**");
        registry.addInterceptor(transcriptCallbackAuthInterceptor)
                .addPathPatterns("/api/interviews/*/transcript/callback");
    }
}
