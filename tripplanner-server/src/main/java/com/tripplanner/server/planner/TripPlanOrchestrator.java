package com.tripplanner.server.planner;

import com.tripplanner.common.exception.PlanningException;
import com.tripplanner.common.properties.PlannerProperties;
import com.tripplanner.common.properties.ProviderProperties;
import com.tripplanner.common.result.ErrorCode;
import com.tripplanner.pojo.dto.ProviderQuery;
import com.tripplanner.pojo.dto.TripRequest;
import com.tripplanner.pojo.enums.Category;
import com.tripplanner.pojo.enums.PlanStage;
import com.tripplanner.pojo.model.BudgetAllocation;
import com.tripplanner.pojo.model.CandidateOption;
import com.tripplanner.pojo.vo.Itinerary;
import com.tripplanner.pojo.vo.PlanNote;
import com.tripplanner.pojo.vo.PlanningOutcome;
import com.tripplanner.server.metrics.MetricsRecorder;
import com.tripplanner.server.narration.NarrationBridge;
import com.tripplanner.server.provider.ProviderAdapter;
import com.tripplanner.server.provider.ProviderFetchResult;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 行程规划编排器。
 *
 * 状态机：VALIDATE_REQUEST -> ALLOCATE_BUDGET -> FETCH_CANDIDATES -> SELECT_CANDIDATES
 * -> SCHEDULE_DAYS -> ASSEMBLE -> NARRATE -> DONE/ERROR
 *
 * - 品类级的降级（数据源不可用、某品类无候选、某天未规划）记为规划备注，继续执行；
 * - 致命错误以 {@link PlanningException} 抛出，在这里统一转换为失败结果，绝不返回半成品行程；
 * - 各次规划之间只共享候选缓存，相同请求得到相同的 planId 与相同的行程。
 *
 * 外部调用 {@link #run(TripRequest)} 同步执行，或 {@link #submit(TripRequest)} 拿到 Future，
 * 取消 Future 会中断规划线程并取消尚未完成的拉取与叙述任务。
 */
@Component
@Slf4j
public class TripPlanOrchestrator {

    private static final String TRACE_ID = "traceId";

    private final BudgetAllocator budgetAllocator;
    private final ProviderAdapter providerAdapter;
    private final CandidateSelector candidateSelector;
    private final DayScheduler dayScheduler;
    private final ItineraryAssembler itineraryAssembler;
    private final NarrationBridge narrationBridge;
    private final PlannerProperties plannerProperties;
    private final ProviderProperties providerProperties;
    private final ExecutorService planningExecutor;
    private final ExecutorService upstreamExecutor;
    private final MetricsRecorder metricsRecorder;

    public TripPlanOrchestrator(BudgetAllocator budgetAllocator,
                                ProviderAdapter providerAdapter,
                                CandidateSelector candidateSelector,
                                DayScheduler dayScheduler,
                                ItineraryAssembler itineraryAssembler,
                                NarrationBridge narrationBridge,
                                PlannerProperties plannerProperties,
                                ProviderProperties providerProperties,
                                @Qualifier("planningExecutor") ExecutorService planningExecutor,
                                @Qualifier("upstreamExecutor") ExecutorService upstreamExecutor,
                                MetricsRecorder metricsRecorder) {
        this.budgetAllocator = budgetAllocator;
        this.providerAdapter = providerAdapter;
        this.candidateSelector = candidateSelector;
        this.dayScheduler = dayScheduler;
        this.itineraryAssembler = itineraryAssembler;
        this.narrationBridge = narrationBridge;
        this.plannerProperties = plannerProperties;
        this.providerProperties = providerProperties;
        this.planningExecutor = planningExecutor;
        this.upstreamExecutor = upstreamExecutor;
        this.metricsRecorder = metricsRecorder;
    }

    /**
     * 异步执行一次规划，取消返回的 Future 即取消规划。
     */
    public Future<PlanningOutcome> submit(TripRequest request) {
        return submit(request, PlanningTimeouts.from(plannerProperties));
    }

    public Future<PlanningOutcome> submit(TripRequest request, PlanningTimeouts timeouts) {
        return planningExecutor.submit(() -> run(request, timeouts));
    }

    public PlanningOutcome run(TripRequest request) {
        return run(request, PlanningTimeouts.from(plannerProperties));
    }

    /**
     * 对外主入口：执行一次完整的规划流水线。
     */
    public PlanningOutcome run(TripRequest request, PlanningTimeouts timeouts) {
        long startMs = System.currentTimeMillis();
        PlanContext ctx = new PlanContext();
        ctx.setRequest(request);
        ctx.setTimeouts(timeouts == null ? PlanningTimeouts.from(plannerProperties) : timeouts);
        ctx.setPlanId(request == null ? "invalid-request" : planIdOf(request));

        String previousTraceId = MDC.get(TRACE_ID);
        MDC.put(TRACE_ID, ctx.getPlanId());
        log.info("开始行程规划: destination={}, dates={}~{}, budget={}",
                request == null ? null : request.getDestination(),
                request == null ? null : request.getStartDate(),
                request == null ? null : request.getEndDate(),
                request == null ? null : request.getTotalBudget());

        PlanStage state = PlanStage.VALIDATE_REQUEST;
        PlanningOutcome outcome;
        try {
            while (state != PlanStage.DONE && state != PlanStage.ERROR) {
                ctx.setStage(state);
                checkCancelled();
                switch (state) {
                    case VALIDATE_REQUEST -> {
                        validate(request);
                        state = PlanStage.ALLOCATE_BUDGET;
                    }
                    case ALLOCATE_BUDGET -> {
                        AllocationResult result = budgetAllocator.allocate(request);
                        ctx.setAllocation(result.getAllocation());
                        ctx.getNotes().addAll(result.getNotes());
                        state = PlanStage.FETCH_CANDIDATES;
                    }
                    case FETCH_CANDIDATES -> {
                        fetchCandidates(ctx);
                        state = PlanStage.SELECT_CANDIDATES;
                    }
                    case SELECT_CANDIDATES -> {
                        SelectionResult selection = candidateSelector.select(
                                request, ctx.getAllocation(), ctx.getCandidates());
                        ctx.setSelection(selection);
                        ctx.getNotes().addAll(selection.getNotes());
                        state = PlanStage.SCHEDULE_DAYS;
                    }
                    case SCHEDULE_DAYS -> {
                        ScheduleResult schedule = dayScheduler.schedule(request, ctx.getAllocation(),
                                ctx.getSelection().top(Category.LODGING),
                                ctx.getSelection().get(Category.ACTIVITY),
                                ctx.getSelection().get(Category.MEAL));
                        ctx.setSchedule(schedule);
                        ctx.getNotes().addAll(schedule.getNotes());
                        state = PlanStage.ASSEMBLE;
                    }
                    case ASSEMBLE -> {
                        SelectionResult selection = ctx.getSelection();
                        ctx.setItinerary(itineraryAssembler.assemble(
                                ctx.getPlanId(),
                                request,
                                ctx.getAllocation(),
                                selection.top(Category.FLIGHT),
                                selection.top(Category.LODGING),
                                alternativeLodgings(selection),
                                ctx.getSchedule().getDays(),
                                ctx.getNotes()));
                        state = PlanStage.NARRATE;
                    }
                    case NARRATE -> {
                        ctx.setItinerary(narrationBridge.narrate(ctx.getItinerary(),
                                ctx.getTimeouts().getNarrationTimeout()));
                        state = PlanStage.DONE;
                    }
                    default -> throw PlanningException.of(ErrorCode.INTERNAL_ERROR, "unknown stage %s", state);
                }
            }
            checkCancelled();
            outcome = PlanningOutcome.done(ctx.getItinerary(), report(ctx));
        } catch (PlanningException e) {
            log.warn("行程规划失败: stage={}, code={}, message={}", ctx.getStage(), e.getErrorCode(), e.getMessage());
            outcome = PlanningOutcome.failed(e.getErrorCode(), e.getMessage(), ctx.getStage(), ctx.getNotes());
        } catch (Exception e) {
            log.error("TripPlanOrchestrator 执行异常: stage={}", ctx.getStage(), e);
            outcome = PlanningOutcome.failed(ErrorCode.INTERNAL_ERROR, ErrorCode.INTERNAL_ERROR.getMsg(),
                    ctx.getStage(), ctx.getNotes());
        }

        long elapsed = System.currentTimeMillis() - startMs;
        outcome.setElapsedMs(elapsed);
        String code = outcome.isSuccess() ? ErrorCode.SUCCESS.name() : outcome.getFailure().getCode().name();
        metricsRecorder.recordPlanningOutcome(outcome.getStatus(), code, elapsed);
        log.info("行程规划结束: status={}, code={}, notes={}, elapsedMs={}",
                outcome.getStatus(), code, outcome.getNotes().size(), elapsed);
        if (previousTraceId == null) {
            MDC.remove(TRACE_ID);
        } else {
            MDC.put(TRACE_ID, previousTraceId);
        }
        return outcome;
    }

    /**
     * 并发拉取所有需要的品类，共用一个截止时间；超时或失败的品类记为数据源不可用。
     */
    private void fetchCandidates(PlanContext ctx) {
        TripRequest request = ctx.getRequest();
        Duration timeout = ctx.getTimeouts().getProviderTimeout();
        Duration perRequest = Duration.ofMillis(Math.max(1,
                Math.min(providerProperties.getRequestTimeoutMs(), timeout.toMillis())));
        ProviderQuery query = ProviderQuery.from(request, providerProperties.getResultCap());
        String traceId = MDC.get(TRACE_ID);

        Map<Category, Future<ProviderFetchResult>> futures = new EnumMap<>(Category.class);
        for (Category category : Category.values()) {
            if (request.excludes(category)) {
                continue;
            }
            futures.put(category, upstreamExecutor.submit(() -> {
                MDC.put(TRACE_ID, traceId);
                try {
                    return providerAdapter.fetch(category, query, perRequest);
                } finally {
                    MDC.remove(TRACE_ID);
                }
            }));
        }

        long deadline = System.nanoTime() + timeout.toNanos();
        Map<Category, List<CandidateOption>> candidates = new EnumMap<>(Category.class);
        try {
            for (Map.Entry<Category, Future<ProviderFetchResult>> e : futures.entrySet()) {
                Category category = e.getKey();
                ProviderFetchResult result = await(category, e.getValue(), deadline);
                if (result.isProviderUnavailable()) {
                    log.warn("数据源不可用，按无数据处理: category={}, reason={}", category, result.getReason());
                    ctx.getNotes().add(PlanNote.of(category, ErrorCode.PROVIDER_UNAVAILABLE,
                            category.getKey() + " provider unavailable (" + result.getReason() + ")"));
                }
                candidates.put(category, result.getCandidates());
            }
        } catch (InterruptedException ex) {
            futures.values().forEach(f -> f.cancel(true));
            Thread.currentThread().interrupt();
            throw PlanningException.of(ErrorCode.PLANNING_CANCELLED, "cancelled while fetching candidates");
        }
        ctx.setCandidates(candidates);
    }

    private ProviderFetchResult await(Category category, Future<ProviderFetchResult> future, long deadline)
            throws InterruptedException {
        long remaining = Math.max(0, deadline - System.nanoTime());
        try {
            return future.get(remaining, TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            return ProviderFetchResult.unavailable(category, "timeout");
        } catch (ExecutionException e) {
            log.error("拉取候选项任务异常: category={}", category, e.getCause());
            return ProviderFetchResult.unavailable(category, "exception");
        }
    }

    private List<CandidateOption> alternativeLodgings(SelectionResult selection) {
        List<CandidateOption> lodgings = selection.get(Category.LODGING);
        if (lodgings.size() <= 1) {
            return Collections.emptyList();
        }
        int count = Math.max(0, plannerProperties.getSelection().getAlternativeLodgingCount());
        return lodgings.subList(1, Math.min(lodgings.size(), 1 + count));
    }

    /**
     * 请求校验：只检查引擎自身依赖的前提，其余由上层完成。
     */
    private void validate(TripRequest request) {
        if (request == null) {
            throw PlanningException.of(ErrorCode.INVALID_REQUEST, "request is required");
        }
        if (!StringUtils.hasText(request.getDestination())) {
            throw PlanningException.of(ErrorCode.INVALID_REQUEST, "destination is required");
        }
        if (!request.excludes(Category.FLIGHT) && !StringUtils.hasText(request.getOrigin())) {
            throw PlanningException.of(ErrorCode.INVALID_REQUEST, "origin is required when flights are planned");
        }
        if (request.getStartDate() == null || request.getEndDate() == null) {
            throw PlanningException.of(ErrorCode.INVALID_REQUEST, "start and end dates are required");
        }
        if (request.getEndDate().isBefore(request.getStartDate())) {
            throw PlanningException.of(ErrorCode.INVALID_REQUEST, "end date %s is before start date %s",
                    request.getEndDate(), request.getStartDate());
        }
        if (request.getTravelers() < 1) {
            throw PlanningException.of(ErrorCode.INVALID_REQUEST, "at least one traveler is required");
        }
        if (request.getTotalBudget() == null || request.getTotalBudget().signum() <= 0) {
            throw PlanningException.of(ErrorCode.INVALID_REQUEST, "total budget must be positive");
        }
    }

    private void checkCancelled() {
        if (Thread.currentThread().isInterrupted()) {
            throw PlanningException.of(ErrorCode.PLANNING_CANCELLED, "planning was cancelled");
        }
    }

    private String report(PlanContext ctx) {
        Itinerary itinerary = ctx.getItinerary();
        int unplanned = itinerary.unplannedDayIndexes().size();
        return String.format("%d days (%d unplanned), total %s of %s, narration %s, %d notes",
                itinerary.getDays().size(), unplanned, itinerary.getTotalCost(),
                ctx.getRequest().getTotalBudget(), itinerary.getNarrationSource(), itinerary.getNotes().size());
    }

    /**
     * 由请求内容派生稳定的 planId：兴趣、提示、排除品类按固定顺序参与计算。
     */
    public static String planIdOf(TripRequest request) {
        StringBuilder sb = new StringBuilder();
        sb.append(request.getOrigin()).append('|')
                .append(request.getDestination()).append('|')
                .append(request.getStartDate()).append('|')
                .append(request.getEndDate()).append('|')
                .append(request.getTravelers()).append('|')
                .append(request.getTotalBudget()).append('|')
                .append(request.normalizedInterests()).append('|');
        Map<String, String> hints = new TreeMap<>();
        request.getBudgetHints().forEach((c, v) -> hints.put(c.name(), v.stripTrailingZeros().toPlainString()));
        sb.append(hints).append('|');
        List<String> excluded = new ArrayList<>();
        request.getExcludedCategories().forEach(c -> excluded.add(c.name()));
        Collections.sort(excluded);
        sb.append(excluded);
        return UUID.nameUUIDFromBytes(sb.toString().getBytes(StandardCharsets.UTF_8)).toString();
    }

    /**
     * 单次规划的上下文。
     */
    @Data
    static class PlanContext {
        private TripRequest request;
        private PlanningTimeouts timeouts;
        private String planId;
        private PlanStage stage;
        private BudgetAllocation allocation;
        private Map<Category, List<CandidateOption>> candidates = new EnumMap<>(Category.class);
        private SelectionResult selection;
        private ScheduleResult schedule;
        private Itinerary itinerary;
        private List<PlanNote> notes = new ArrayList<>();
    }
}
