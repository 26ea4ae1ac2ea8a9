package com.eduhub.course;

import com.eduhub.domain.Course;
import com.eduhub.isolation.RecordNotFoundException;
import com.eduhub.isolation.RecordQuery;
import com.eduhub.isolation.RecordStore;
import com.eduhub.security.TenantContext;
import com.eduhub.security.TenantContextHolder;
import com.eduhub.tenant.CustomFieldValidator;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Course catalog of the current tenant.
 */
@Service
public class CourseService {
    
    static final String ENTITY = "course";
    
    private final RecordStore<Course> courseStore;
    private final CustomFieldValidator customFieldValidator;
    
    public CourseService(RecordStore<Course> courseStore, CustomFieldValidator customFieldValidator) {
        this.courseStore = courseStore;
        this.customFieldValidator = customFieldValidator;
    }
    
    public Course create(Course course) {
        TenantContext context = TenantContextHolder.require();
        if (course.getCode() == null || course.getCode().isBlank()) {
            throw new IllegalArgumentException("Course code is required");
        }
        course.setId(null);
        course.setCustomFields(customFieldValidator.validate(context.getConfig(), ENTITY, course.getCustomFields()));
        return courseStore.insert(course);
    }
    
    public List<Course> list(String code) {
        return courseStore.find(RecordQuery.all().andIfPresent("code", code));
    }
    
    public Course get(String id) {
        return courseStore.findOne(RecordQuery.byId(id))
            .orElseThrow(() -> new RecordNotFoundException(ENTITY, id));
    }
}
