package com.eduhub.config;

import com.eduhub.course.CourseRecordMapping;
import com.eduhub.domain.Course;
import com.eduhub.domain.Student;
import com.eduhub.isolation.InMemoryRecordStoreFactory;
import com.eduhub.isolation.RecordStore;
import com.eduhub.isolation.RecordStoreFactory;
import com.eduhub.isolation.TenantGuardedStore;
import com.eduhub.student.StudentRecordMapping;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Record stores exposed to application code.
 *
 * Only guarded stores are beans; the raw backends stay private to this
 * configuration so nothing can bypass the tenant checks.
 */
@Configuration
public class RecordStoreConfig {
    
    private static final Logger logger = LoggerFactory.getLogger(RecordStoreConfig.class);
    
    @Bean
    @ConditionalOnProperty(name = "eduhub.storage.backend", havingValue = "memory", matchIfMissing = true)
    public RecordStoreFactory inMemoryRecordStoreFactory(ObjectMapper objectMapper) {
        logger.info("Using in-memory record storage");
        return new InMemoryRecordStoreFactory(objectMapper);
    }
    
    @Bean
    public RecordStore<Student> studentStore(RecordStoreFactory factory, ObjectMapper objectMapper,
                                             MeterRegistry meterRegistry) {
        return new TenantGuardedStore<>(
            factory.create(Student.class, new StudentRecordMapping(objectMapper)), "student", meterRegistry);
    }
    
    @Bean
    public RecordStore<Course> courseStore(RecordStoreFactory factory, ObjectMapper objectMapper,
                                           MeterRegistry meterRegistry) {
        return new TenantGuardedStore<>(
            factory.create(Course.class, new CourseRecordMapping(objectMapper)), "course", meterRegistry);
    }
}
