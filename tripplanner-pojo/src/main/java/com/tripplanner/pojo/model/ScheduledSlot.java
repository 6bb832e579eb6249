package com.tripplanner.pojo.model;

import com.tripplanner.pojo.enums.SlotKind;
import lombok.Builder;
import lombok.Value;

import java.time.LocalTime;

@Value
@Builder
public class ScheduledSlot {

    int dayIndex;

    LocalTime start;

    LocalTime end;

    CandidateOption option;

    SlotKind kind;

    /** 从上一个地点过来的预计交通时间（分钟） */
    int travelMinutes;

    public boolean overlaps(ScheduledSlot other) {
        return start.isBefore(other.end) && other.start.isBefore(end);
    }
}
