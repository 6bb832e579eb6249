package com.tripplanner.pojo.vo;

import com.tripplanner.pojo.enums.DayStatus;
import com.tripplanner.pojo.model.ScheduledSlot;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.With;

import java.time.LocalDate;
import java.util.List;

@Value
@Builder
public class ItineraryDay {

    int dayIndex;

    LocalDate date;

    DayStatus status;

    @Singular
    List<ScheduledSlot> slots;

    /**
     * 叙述文案，由叙述桥接器附加，不参与任何规划计算。
     */
    @With
    String narrative;

    public boolean isUnplanned() {
        return status == DayStatus.PARTIAL;
    }
}
