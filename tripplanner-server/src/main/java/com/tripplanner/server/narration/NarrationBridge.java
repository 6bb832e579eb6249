package com.tripplanner.server.narration;

import com.tripplanner.pojo.dto.TripRequest;
import com.tripplanner.pojo.enums.NarrationSource;
import com.tripplanner.pojo.model.CandidateOption;
import com.tripplanner.pojo.model.ScheduledSlot;
import com.tripplanner.pojo.vo.Itinerary;
import com.tripplanner.pojo.vo.ItineraryDay;
import com.tripplanner.server.metrics.MetricsRecorder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * Narration Bridge：把已校验的行程交给文本生成能力，并把返回的文案挂到每一天上。
 *
 * 约束：
 * - 单向交接：叙述结果只写入 narrative/summary 字段，绝不回写任何规划数据；
 * - 尽力而为：生成失败、超时、返回空文本时使用模板文案兜底，而不是让整次规划失败；
 * - 某一天缺失时只对这一天兜底。
 */
@Component
@Slf4j
public class NarrationBridge {

    /** 单日叙述的长度上限，超出视为异常输出 */
    private static final int MAX_DAY_TEXT_LENGTH = 4000;

    private final ItineraryNarrator itineraryNarrator;
    private final ExecutorService upstreamExecutor;
    private final MetricsRecorder metricsRecorder;

    public NarrationBridge(ItineraryNarrator itineraryNarrator,
                           @Qualifier("upstreamExecutor") ExecutorService upstreamExecutor,
                           MetricsRecorder metricsRecorder) {
        this.itineraryNarrator = itineraryNarrator;
        this.upstreamExecutor = upstreamExecutor;
        this.metricsRecorder = metricsRecorder;
    }

    public Itinerary narrate(Itinerary itinerary, Duration timeout) {
        NarrationRequest request = toRequest(itinerary);
        NarrationResult result = null;
        String reason = "ok";

        Future<NarrationResult> future = upstreamExecutor.submit(() -> itineraryNarrator.narrate(request));
        try {
            result = future.get(Math.max(1, timeout.toMillis()), TimeUnit.MILLISECONDS);
            if (result == null) {
                reason = "empty";
            }
        } catch (TimeoutException e) {
            future.cancel(true);
            reason = "timeout";
            log.warn("叙述生成超时，使用模板兜底: planId={}, timeoutMs={}", itinerary.getPlanId(), timeout.toMillis());
        } catch (ExecutionException e) {
            reason = "exception";
            log.warn("叙述生成失败，使用模板兜底: planId={}", itinerary.getPlanId(), e.getCause());
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            reason = "interrupted";
        }

        List<ItineraryDay> days = new ArrayList<>();
        int fallbackDays = 0;
        for (ItineraryDay day : itinerary.getDays()) {
            String text = result == null || result.getDayTexts() == null
                    ? null
                    : result.getDayTexts().get(day.getDayIndex());
            if (!acceptable(text)) {
                text = fallbackDayText(day, itinerary.getRequest());
                fallbackDays++;
            }
            days.add(day.withNarrative(text));
        }

        NarrationSource source;
        if (fallbackDays == 0) {
            source = NarrationSource.AI;
        } else if (fallbackDays == days.size()) {
            source = NarrationSource.FALLBACK;
        } else {
            source = NarrationSource.PARTIAL_FALLBACK;
        }
        String summary = result != null && StringUtils.hasText(result.getSummary())
                ? result.getSummary()
                : fallbackSummary(itinerary);
        metricsRecorder.recordNarration(source.name().toLowerCase(), reason);

        return itinerary.toBuilder()
                .clearDays()
                .days(days)
                .summary(summary)
                .narrationSource(source)
                .build();
    }

    private boolean acceptable(String text) {
        return StringUtils.hasText(text) && text.length() <= MAX_DAY_TEXT_LENGTH;
    }

    NarrationRequest toRequest(Itinerary itinerary) {
        TripRequest req = itinerary.getRequest();
        NarrationRequest.NarrationRequestBuilder builder = NarrationRequest.builder()
                .origin(req.getOrigin())
                .destination(req.getDestination())
                .startDate(req.getStartDate())
                .endDate(req.getEndDate())
                .travelers(req.getTravelers())
                .interests(req.normalizedInterests())
                .flight(describe(itinerary.getFlight()))
                .lodging(describe(itinerary.getLodging()))
                .totalCost(itinerary.getTotalCost().toString());
        for (ItineraryDay day : itinerary.getDays()) {
            List<String> lines = day.getSlots().stream()
                    .map(this::slotLine)
                    .collect(Collectors.toList());
            builder.day(new NarrationRequest.DaySummary(day.getDayIndex(), day.getDate(), day.isUnplanned(), lines));
        }
        return builder.build();
    }

    /**
     * 模板兜底：按时间顺序拼接当天的时段与名称。
     */
    String fallbackDayText(ItineraryDay day, TripRequest request) {
        StringBuilder sb = new StringBuilder();
        sb.append("Day ").append(day.getDayIndex() + 1).append(" (").append(day.getDate()).append("): ");
        if (day.getSlots().isEmpty()) {
            sb.append("Free day in ").append(request.getDestination()).append(", nothing could be planned.");
            return sb.toString();
        }
        sb.append(day.getSlots().stream().map(this::slotLine).collect(Collectors.joining("; ")));
        sb.append(".");
        if (day.isUnplanned()) {
            sb.append(" No sightseeing could be planned for this day.");
        }
        return sb.toString();
    }

    String fallbackSummary(Itinerary itinerary) {
        TripRequest req = itinerary.getRequest();
        StringBuilder sb = new StringBuilder();
        sb.append(req.dayCount()).append("-day trip from ").append(req.getOrigin())
                .append(" to ").append(req.getDestination())
                .append(" for ").append(req.getTravelers()).append(req.getTravelers() == 1 ? " traveler." : " travelers.");
        if (itinerary.getFlight() != null) {
            sb.append(" Flight: ").append(describe(itinerary.getFlight())).append(".");
        }
        if (itinerary.getLodging() != null) {
            sb.append(" Stay: ").append(describe(itinerary.getLodging())).append(".");
        }
        sb.append(" Total cost ").append(itinerary.getTotalCost())
                .append(" of ").append(req.getTotalBudget()).append(" budget.");
        return sb.toString();
    }

    private String slotLine(ScheduledSlot slot) {
        return slot.getStart() + "-" + slot.getEnd() + " " + slot.getKind().getLabel()
                + (slot.getKind().isMeal() ? " at " : ": ") + slot.getOption().getName();
    }

    private String describe(CandidateOption option) {
        return option == null ? null : option.getName() + " (" + option.getPrice() + ")";
    }
}
