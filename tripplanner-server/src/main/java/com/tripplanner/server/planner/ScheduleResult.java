package com.tripplanner.server.planner;

import com.tripplanner.pojo.enums.Category;
import com.tripplanner.pojo.model.Money;
import com.tripplanner.pojo.vo.ItineraryDay;
import com.tripplanner.pojo.vo.PlanNote;
import lombok.Value;

import java.util.List;
import java.util.Map;

@Value
public class ScheduleResult {

    List<ItineraryDay> days;

    /** 活动与餐饮的累计花费 */
    Map<Category, Money> spend;

    /** 未规划的天 */
    List<PlanNote> notes;
}
