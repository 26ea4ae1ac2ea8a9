package com.eduhub.tenant;

import com.eduhub.domain.PlanTier;
import jakarta.validation.constraints.NotNull;

public class PlanChange {
    
    @NotNull
    private PlanTier plan;
    
    public PlanTier getPlan() {
        return plan;
    }
    
    public void setPlan(PlanTier plan) {
        this.plan = plan;
    }
}
