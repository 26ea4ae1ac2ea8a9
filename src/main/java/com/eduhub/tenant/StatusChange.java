package com.eduhub.tenant;

import com.eduhub.domain.TenantStatus;
import jakarta.validation.constraints.NotNull;

public class StatusChange {
    
    @NotNull
    private TenantStatus status;
    
    public TenantStatus getStatus() {
        return status;
    }
    
    public void setStatus(TenantStatus status) {
        this.status = status;
    }
}
