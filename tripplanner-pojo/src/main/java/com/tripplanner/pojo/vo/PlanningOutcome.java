package com.tripplanner.pojo.vo;

import com.tripplanner.common.result.ErrorCode;
import com.tripplanner.pojo.enums.PlanStage;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * 一次规划的返回：要么是完整行程，要么是类型化失败。
 * 额外带上规划备注与简短的执行报告，便于日志与监控。
 */
@Data
public class PlanningOutcome {

    /** DONE | FAILED */
    private String status;

    private Itinerary itinerary;

    private PlanningFailure failure;

    private List<PlanNote> notes = new ArrayList<>();

    private String report;

    private long elapsedMs;

    public boolean isSuccess() {
        return "DONE".equals(status) && itinerary != null;
    }

    public static PlanningOutcome done(Itinerary itinerary, String report) {
        PlanningOutcome outcome = new PlanningOutcome();
        outcome.setStatus("DONE");
        outcome.setItinerary(itinerary);
        outcome.setNotes(new ArrayList<>(itinerary.getNotes()));
        outcome.setReport(report);
        return outcome;
    }

    public static PlanningOutcome failed(ErrorCode code, String message, PlanStage stage, List<PlanNote> notes) {
        PlanningOutcome outcome = new PlanningOutcome();
        outcome.setStatus("FAILED");
        outcome.setFailure(new PlanningFailure(code, message, stage));
        outcome.setNotes(new ArrayList<>(notes));
        outcome.setReport(code.getMsg());
        return outcome;
    }
}
