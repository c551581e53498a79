package com.openforge.taskmanager.config;

import com.openforge.taskmanager.domain.TaskPriority;
import com.openforge.taskmanager.domain.TaskStatus;
import org.springframework.context.annotation.Configuration;
import org.springframework.format.FormatterRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Lets query parameters use the same lower-case enum values as JSON bodies
 * (?status=in_progress&priority=high).
 */
@Configuration
public class WebConfig implements WebMvcConfigurer {

    @Override
    public void addFormatters(FormatterRegistry registry) {
        registry.addConverter(String.class, TaskStatus.class, TaskStatus::fromValue);
        registry.addConverter(String.class, TaskPriority.class, TaskPriority::fromValue);
    }
}
