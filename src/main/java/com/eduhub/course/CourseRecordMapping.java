package com.eduhub.course;

import com.eduhub.domain.Course;
import com.eduhub.isolation.AbstractRecordMapping;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.jdbc.core.RowMapper;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps {@link Course} to the {@code courses} table.
 */
public class CourseRecordMapping extends AbstractRecordMapping<Course> {
    
    public static final String TABLE = "courses";
    
    public CourseRecordMapping(ObjectMapper objectMapper) {
        super(TABLE, Map.of(
            "code", "code",
            "title", "title",
            "credits", "credits"
        ), objectMapper);
    }
    
    @Override
    public Map<String, Object> toColumns(Course course) {
        Map<String, Object> columns = new LinkedHashMap<>();
        columns.put(ID_COLUMN, course.getId());
        columns.put(TENANT_COLUMN, course.getTenantId());
        columns.put("code", course.getCode());
        columns.put("title", course.getTitle());
        columns.put("credits", course.getCredits());
        columns.put("custom_fields", writeJson(course.getCustomFields()));
        return columns;
    }
    
    @Override
    public RowMapper<Course> getRowMapper() {
        return (rs, rowNum) -> {
            Course course = new Course(rs.getString("code"), rs.getString("title"), (Integer) rs.getObject("credits"));
            course.setId(rs.getString(ID_COLUMN));
            course.setTenantId(rs.getString(TENANT_COLUMN));
            course.setCustomFields(readJson(rs.getString("custom_fields")));
            return course;
        };
    }
}
