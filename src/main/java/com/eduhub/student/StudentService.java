package com.eduhub.student;

import com.eduhub.domain.ResourceKind;
import com.eduhub.domain.Student;
import com.eduhub.isolation.RecordNotFoundException;
import com.eduhub.isolation.RecordQuery;
import com.eduhub.isolation.RecordStore;
import com.eduhub.quota.ResourceAccountant;
import com.eduhub.security.TenantContext;
import com.eduhub.security.TenantContextHolder;
import com.eduhub.tenant.CustomFieldValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Student records of the current tenant.
 *
 * Every enrolled student counts against the plan's student quota; the unit
 * is returned when the student is deleted.
 */
@Service
public class StudentService {
    
    private static final Logger log = LoggerFactory.getLogger(StudentService.class);
    
    static final String ENTITY = "student";
    
    private final RecordStore<Student> studentStore;
    private final ResourceAccountant resourceAccountant;
    private final CustomFieldValidator customFieldValidator;
    
    public StudentService(
        RecordStore<Student> studentStore,
        ResourceAccountant resourceAccountant,
        CustomFieldValidator customFieldValidator
    ) {
        this.studentStore = studentStore;
        this.resourceAccountant = resourceAccountant;
        this.customFieldValidator = customFieldValidator;
    }
    
    public Student enroll(Student student) {
        TenantContext context = TenantContextHolder.require();
        student.setId(null);
        student.setCustomFields(
            customFieldValidator.validate(context.getConfig(), ENTITY, student.getCustomFields()));
        
        resourceAccountant.requireWithinQuota(context.getTenantId(), ResourceKind.STUDENTS, 1L);
        Student stored;
        try {
            stored = studentStore.insert(student);
        } catch (RuntimeException e) {
            resourceAccountant.release(context.getTenantId(), ResourceKind.STUDENTS, 1L);
            throw e;
        }
        
        log.debug("Enrolled student {} for tenant {}", stored.getId(), context.getTenantId());
        return stored;
    }
    
    public List<Student> list(Integer gradeLevel, int limit, int offset) {
        return studentStore.find(RecordQuery.all()
            .andIfPresent("gradeLevel", gradeLevel)
            .limit(limit)
            .offset(offset));
    }
    
    public Student get(String id) {
        return studentStore.findOne(RecordQuery.byId(id))
            .orElseThrow(() -> new RecordNotFoundException(ENTITY, id));
    }
    
    public Student update(String id, Student student) {
        TenantContext context = TenantContextHolder.require();
        student.setId(id);
        student.setCustomFields(
            customFieldValidator.validate(context.getConfig(), ENTITY, student.getCustomFields()));
        return studentStore.update(student)
            .orElseThrow(() -> new RecordNotFoundException(ENTITY, id));
    }
    
    public void delete(String id) {
        String tenantId = TenantContextHolder.requireTenantId();
        if (studentStore.delete(RecordQuery.byId(id)) == 0) {
            throw new RecordNotFoundException(ENTITY, id);
        }
        resourceAccountant.release(tenantId, ResourceKind.STUDENTS, 1L);
        log.debug("Deleted student {} for tenant {}", id, tenantId);
    }
}
