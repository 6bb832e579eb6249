package com.tripplanner.server.planner;

import com.tripplanner.pojo.model.BudgetAllocation;
import com.tripplanner.pojo.vo.PlanNote;
import lombok.Value;

import java.util.List;

@Value
public class AllocationResult {

    BudgetAllocation allocation;

    /** 被忽略或被调整的预算提示 */
    List<PlanNote> notes;
}
