package com.chronofill.backend.config;

import com.chronofill.backend.model.SourceSystem;
import com.chronofill.backend.service.EffectiveStatus;
import org.springframework.context.annotation.Configuration;
import org.springframework.format.FormatterRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
public class WebConfig implements WebMvcConfigurer {

    @Override
    public void addFormatters(FormatterRegistry registry) {
        // query parameters use the lower-case wire names
        registry.addConverter(String.class, SourceSystem.class, SourceSystem::fromValue);
        registry.addConverter(String.class, EffectiveStatus.class, EffectiveStatus::fromValue);
    }
}
