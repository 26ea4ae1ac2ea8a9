package com.eduhub.security;

import org.springframework.core.task.TaskDecorator;
import org.springframework.stereotype.Component;

/**
 * Carries the submitting unit of work's tenant context to executor threads.
 * 
 * Spring Boot applies a single {@link TaskDecorator} bean to the
 * auto-configured {@code applicationTaskExecutor}, which also serves
 * {@code @Async} methods and asynchronous MVC handlers.
 */
@Component
public class TenantContextTaskDecorator implements TaskDecorator {
    
    @Override
    public Runnable decorate(Runnable runnable) {
        return TenantContextHolder.wrapRunnable(runnable);
    }
}
