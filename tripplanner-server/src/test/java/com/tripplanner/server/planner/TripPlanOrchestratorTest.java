package com.tripplanner.server.planner;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tripplanner.common.properties.PlannerProperties;
import com.tripplanner.common.properties.ProviderProperties;
import com.tripplanner.common.result.ErrorCode;
import com.tripplanner.pojo.dto.TripRequest;
import com.tripplanner.pojo.enums.Category;
import com.tripplanner.pojo.enums.NarrationSource;
import com.tripplanner.pojo.enums.PlanStage;
import com.tripplanner.pojo.model.CandidateOption;
import com.tripplanner.pojo.model.Money;
import com.tripplanner.pojo.model.ScheduledSlot;
import com.tripplanner.pojo.vo.Itinerary;
import com.tripplanner.pojo.vo.ItineraryDay;
import com.tripplanner.pojo.vo.PlanningOutcome;
import com.tripplanner.server.metrics.MetricsRecorder;
import com.tripplanner.server.narration.ItineraryNarrator;
import com.tripplanner.server.narration.NarrationBridge;
import com.tripplanner.server.narration.NarrationRequest;
import com.tripplanner.server.narration.NarrationResult;
import com.tripplanner.server.provider.FlightOfferNormalizer;
import com.tripplanner.server.provider.HotelOfferNormalizer;
import com.tripplanner.server.provider.PlaceNormalizer;
import com.tripplanner.server.provider.ProviderAdapter;
import com.tripplanner.server.provider.UpstreamCallException;
import com.tripplanner.server.support.StubUpstreamSearch;
import com.tripplanner.server.utils.CacheClient;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.MDC;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.lenient;

/**
 * 编排器端到端测试：真实的拆分、筛选、排布、组装与叙述组件，上游与 Redis 用桩替代。
 */
@ExtendWith(MockitoExtension.class)
class TripPlanOrchestratorTest {

    private static final String FLIGHTS = "{\"data\": ["
            + "{\"id\": \"AF7\", \"price\": {\"total\": \"650.00\", \"currency\": \"USD\"},"
            + " \"itineraries\": [{\"duration\": \"PT7H\", \"segments\": [{\"carrierCode\": \"AF\", \"number\": \"7\"}]}]},"
            + "{\"id\": \"UA57\", \"price\": {\"total\": \"600.00\", \"currency\": \"USD\"},"
            + " \"itineraries\": [{\"duration\": \"PT9H\", \"segments\": [{\"carrierCode\": \"UA\", \"number\": \"57\"},"
            + "                                                   {\"carrierCode\": \"UA\", \"number\": \"9\"}]}]}"
            + "]}";

    private static final String HOTELS = "{\"data\": ["
            + "{\"hotel\": {\"hotelId\": \"H1\", \"name\": \"Hotel Canal\", \"rating\": \"4\","
            + " \"latitude\": 48.8566, \"longitude\": 2.3522},"
            + " \"offers\": [{\"price\": {\"total\": \"500.00\", \"currency\": \"USD\"}}]},"
            + "{\"hotel\": {\"hotelId\": \"H2\", \"name\": \"Hotel Opera\", \"rating\": \"3\","
            + " \"latitude\": 48.8719, \"longitude\": 2.3316},"
            + " \"offers\": [{\"price\": {\"total\": \"450.00\", \"currency\": \"USD\"}}]}"
            + "]}";

    private static final String NO_RESULTS = "{\"data\": []}";

    @Mock
    private StringRedisTemplate stringRedisTemplate;

    @Mock
    private ValueOperations<String, String> valueOperations;

    private final Map<String, String> redis = new ConcurrentHashMap<>();
    private final AtomicInteger narrations = new AtomicInteger();

    private ExecutorService executor;
    private ExecutorService runExecutor;
    private SimpleMeterRegistry meterRegistry;
    private PlannerProperties plannerProperties;
    private ProviderProperties providerProperties;

    private StubUpstreamSearch flights;
    private StubUpstreamSearch hotels;
    private StubUpstreamSearch sights;
    private StubUpstreamSearch restaurants;
    private ItineraryNarrator narrator;

    @BeforeEach
    void setUp() {
        lenient().when(stringRedisTemplate.opsForValue()).thenReturn(valueOperations);
        lenient().when(valueOperations.get(anyString())).thenAnswer(inv -> redis.get(inv.<String>getArgument(0)));
        lenient().doAnswer(inv -> {
            redis.put(inv.getArgument(0), inv.getArgument(1));
            return null;
        }).when(valueOperations).set(anyString(), anyString(), anyLong(), any(TimeUnit.class));

        executor = Executors.newFixedThreadPool(8);
        runExecutor = Executors.newFixedThreadPool(4);
        meterRegistry = new SimpleMeterRegistry();
        plannerProperties = new PlannerProperties();
        providerProperties = new ProviderProperties();
        providerProperties.setInitialBackoffMs(1);
        providerProperties.setMaxBackoffMs(2);

        flights = new StubUpstreamSearch("amadeus", Category.FLIGHT).respond(FLIGHTS);
        hotels = new StubUpstreamSearch("amadeus-hotels", Category.LODGING).respond(HOTELS);
        sights = new StubUpstreamSearch("google-places", Category.ACTIVITY).respond(places("sight", 8, "tourist_attraction"));
        restaurants = new StubUpstreamSearch("google-places", Category.MEAL).respond(places("food", 12, "restaurant"));
        narrator = req -> {
            narrations.incrementAndGet();
            Map<Integer, String> texts = new HashMap<>();
            for (NarrationRequest.DaySummary day : req.getDays()) {
                texts.put(day.getDayIndex(), "Narrated day " + (day.getDayIndex() + 1));
            }
            return new NarrationResult("Narrated trip to " + req.getDestination(), texts);
        };
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
        runExecutor.shutdownNow();
    }

    private static String places(String prefix, int count, String type) {
        StringBuilder sb = new StringBuilder("{\"results\": [");
        for (int i = 0; i < count; i++) {
            if (i > 0) {
                sb.append(',');
            }
            sb.append("{\"place_id\": \"").append(prefix).append('-').append(i).append("\",")
                    .append(" \"name\": \"").append(prefix).append(' ').append(i).append("\",")
                    .append(" \"rating\": ").append(4.0 + i * 0.05).append(',')
                    .append(" \"price_level\": 1,")
                    .append(" \"types\": [\"").append(type).append("\"],")
                    .append(" \"geometry\": {\"location\": {\"lat\": ").append(48.855 + i * 0.002)
                    .append(", \"lng\": 2.35}},")
                    .append(" \"opening_hours\": {\"open\": \"0700\", \"close\": \"2200\"}}");
        }
        return sb.append("]}").toString();
    }

    private TripPlanOrchestrator orchestrator() {
        MetricsRecorder metricsRecorder = new MetricsRecorder(meterRegistry);
        CacheClient cacheClient = new CacheClient(stringRedisTemplate, new ObjectMapper().findAndRegisterModules(),
                metricsRecorder);
        ProviderAdapter adapter = new ProviderAdapter(
                List.of(flights, hotels, sights, restaurants),
                List.of(new FlightOfferNormalizer(), new HotelOfferNormalizer(), new PlaceNormalizer(providerProperties)),
                cacheClient, providerProperties, metricsRecorder);
        TravelTimeEstimator travel = new TravelTimeEstimator(plannerProperties);
        return new TripPlanOrchestrator(
                new BudgetAllocator(plannerProperties),
                adapter,
                new CandidateSelector(plannerProperties),
                new DayScheduler(plannerProperties, travel),
                new ItineraryAssembler(),
                new NarrationBridge(narrator, executor, metricsRecorder),
                plannerProperties,
                providerProperties,
                runExecutor,
                executor,
                metricsRecorder);
    }

    private static TripRequest.TripRequestBuilder request() {
        return TripRequest.builder()
                .origin("NYC")
                .destination("Paris")
                .startDate(LocalDate.of(2026, 5, 1))
                .endDate(LocalDate.of(2026, 5, 3))
                .travelers(2)
                .totalBudget(Money.of(3000, "USD"))
                .interest("culture");
    }

    @Test
    void run_shouldProduceValidatedNarratedItinerary() {
        PlanningOutcome outcome = orchestrator().run(request().build());

        assertTrue(outcome.isSuccess(), () -> "unexpected failure: " + outcome.getFailure());
        Itinerary itinerary = outcome.getItinerary();
        assertEquals("AF7", itinerary.getFlight().getProviderId());
        assertEquals("H1", itinerary.getLodging().getProviderId());
        assertEquals(List.of("H2"), itinerary.getAlternativeLodgings().stream()
                .map(CandidateOption::getProviderId).collect(Collectors.toList()));
        assertEquals(3, itinerary.getDays().size());
        assertTrue(itinerary.unplannedDayIndexes().isEmpty());
        assertFalse(itinerary.getTotalCost().exceeds(itinerary.getRequest().getTotalBudget()));
        assertEquals(NarrationSource.AI, itinerary.getNarrationSource());
        assertEquals("Narrated day 1", itinerary.getDays().get(0).getNarrative());
        assertEquals(TripPlanOrchestrator.planIdOf(itinerary.getRequest()), itinerary.getPlanId());
        assertNull(MDC.get("traceId"));

        Set<String> used = new HashSet<>();
        for (ItineraryDay day : itinerary.getDays()) {
            for (ScheduledSlot slot : day.getSlots()) {
                assertTrue(used.add(slot.getOption().dedupKey()));
            }
        }
    }

    @Test
    void run_shouldBeIdempotent_andServeRepeatFromCache() {
        TripPlanOrchestrator orchestrator = orchestrator();

        PlanningOutcome first = orchestrator.run(request().build());
        PlanningOutcome second = orchestrator.run(request().build());

        assertTrue(first.isSuccess());
        assertEquals(first.getItinerary().getPlanId(), second.getItinerary().getPlanId());
        assertEquals(first.getItinerary().getDays(), second.getItinerary().getDays());
        assertEquals(first.getItinerary().getTotalCost(), second.getItinerary().getTotalCost());
        assertEquals(1, flights.calls());
        assertEquals(1, hotels.calls());
        assertEquals(1, sights.calls());
        assertEquals(1, restaurants.calls());
    }

    @Test
    void run_shouldFailBeforeScheduling_whenNoLodgingFound() {
        hotels = new StubUpstreamSearch("amadeus-hotels", Category.LODGING).respond(NO_RESULTS);

        PlanningOutcome outcome = orchestrator().run(request().build());

        assertFalse(outcome.isSuccess());
        assertEquals(ErrorCode.INSUFFICIENT_CORE_OPTIONS, outcome.getFailure().getCode());
        assertEquals(PlanStage.SELECT_CANDIDATES, outcome.getFailure().getStage());
        assertNull(outcome.getItinerary());
        assertEquals(0, narrations.get());
    }

    @Test
    void run_shouldFail_whenLodgingProviderIsDown() {
        hotels = new StubUpstreamSearch("amadeus-hotels", Category.LODGING)
                .fail(new UpstreamCallException("http_503", 503, "unavailable", true));

        PlanningOutcome outcome = orchestrator().run(request().build());

        assertEquals(ErrorCode.INSUFFICIENT_CORE_OPTIONS, outcome.getFailure().getCode());
        assertTrue(outcome.getNotes().stream().anyMatch(n ->
                n.getCategory() == Category.LODGING && n.getCode() == ErrorCode.PROVIDER_UNAVAILABLE));
        assertEquals(3, hotels.calls());
    }

    @Test
    void run_shouldDegradeGracefully_whenMealProviderIsDown() {
        restaurants = new StubUpstreamSearch("google-places", Category.MEAL)
                .fail(new UpstreamCallException("timeout", "timed out", null));

        PlanningOutcome outcome = orchestrator().run(request().build());

        assertTrue(outcome.isSuccess());
        assertTrue(outcome.getNotes().stream().anyMatch(n ->
                n.getCategory() == Category.MEAL && n.getCode() == ErrorCode.PROVIDER_UNAVAILABLE));
        assertTrue(outcome.getItinerary().getDays().stream()
                .flatMap(d -> d.getSlots().stream())
                .noneMatch(s -> s.getKind().isMeal()));
    }

    @Test
    void run_shouldMarkDaysUnplanned_whenActivitiesRunOut() {
        sights = new StubUpstreamSearch("google-places", Category.ACTIVITY).respond(places("sight", 2, "museum"));
        TripRequest request = request().endDate(LocalDate.of(2026, 5, 5)).build();

        PlanningOutcome outcome = orchestrator().run(request);

        assertTrue(outcome.isSuccess(), () -> "unexpected failure: " + outcome.getFailure());
        assertTrue(outcome.getItinerary().unplannedDayIndexes().size() >= 3);
        assertNotNull(outcome.getItinerary().getFlight());
        assertNotNull(outcome.getItinerary().getLodging());
        assertTrue(outcome.getNotes().stream().anyMatch(n -> n.getMessage().contains("unplanned")));
    }

    @Test
    void run_shouldRejectInfeasibleBudget_withoutCallingProviders() {
        plannerProperties.getBudget().getFlight().setFloorAmount(300);

        PlanningOutcome outcome = orchestrator().run(request()
                .totalBudget(Money.of(50, "USD")).build());

        assertEquals(ErrorCode.BUDGET_INFEASIBLE, outcome.getFailure().getCode());
        assertEquals(PlanStage.ALLOCATE_BUDGET, outcome.getFailure().getStage());
        assertEquals(0, flights.calls());
    }

    @Test
    void run_shouldRejectInvalidDates() {
        PlanningOutcome outcome = orchestrator().run(request().endDate(LocalDate.of(2026, 4, 30)).build());

        assertEquals(ErrorCode.INVALID_REQUEST, outcome.getFailure().getCode());
        assertEquals("FAILED", outcome.getStatus());
    }

    @Test
    void run_shouldSkipExcludedFlights() {
        PlanningOutcome outcome = orchestrator().run(request().origin(null).excludedCategory(Category.FLIGHT).build());

        assertTrue(outcome.isSuccess());
        assertNull(outcome.getItinerary().getFlight());
        assertEquals(0, flights.calls());
    }

    @Test
    void run_shouldHonourBudgetHint() {
        PlanningOutcome outcome = orchestrator().run(request()
                .budgetHint(Category.FLIGHT, new BigDecimal("620")).build());

        assertTrue(outcome.isSuccess());
        assertEquals(new BigDecimal("620.00"),
                outcome.getItinerary().getAllocation().amountFor(Category.FLIGHT).getAmount());
        assertEquals("UA57", outcome.getItinerary().getFlight().getProviderId());
    }

    @Test
    void run_shouldTreatSlowProviderAsUnavailable() {
        flights = new StubUpstreamSearch("amadeus", Category.FLIGHT).respond(FLIGHTS).delay(2000);
        PlanningTimeouts timeouts = PlanningTimeouts.builder()
                .providerTimeout(Duration.ofMillis(200))
                .narrationTimeout(Duration.ofSeconds(2))
                .build();

        PlanningOutcome outcome = orchestrator().run(request().build(), timeouts);

        assertEquals(ErrorCode.INSUFFICIENT_CORE_OPTIONS, outcome.getFailure().getCode());
        assertTrue(outcome.getNotes().stream().anyMatch(n ->
                n.getCategory() == Category.FLIGHT && n.getMessage().contains("timeout")));
    }

    @Test
    void run_shouldFallBackToTemplate_whenNarrationTimesOut() {
        CountDownLatch never = new CountDownLatch(1);
        narrator = req -> {
            try {
                never.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return null;
        };
        PlanningTimeouts timeouts = PlanningTimeouts.builder()
                .providerTimeout(Duration.ofSeconds(5))
                .narrationTimeout(Duration.ofMillis(100))
                .build();

        PlanningOutcome outcome = orchestrator().run(request().build(), timeouts);

        assertTrue(outcome.isSuccess());
        assertEquals(NarrationSource.FALLBACK, outcome.getItinerary().getNarrationSource());
        for (ItineraryDay day : outcome.getItinerary().getDays()) {
            assertTrue(day.getNarrative().startsWith("Day " + (day.getDayIndex() + 1)));
        }
    }

    @Test
    void submit_shouldReportCancellation_whenFutureIsCancelled() throws Exception {
        flights = new StubUpstreamSearch("amadeus", Category.FLIGHT).respond(FLIGHTS).delay(3000);
        TripPlanOrchestrator orchestrator = orchestrator();

        Future<PlanningOutcome> future = orchestrator.submit(request().build());
        Thread.sleep(200);
        assertTrue(future.cancel(true));

        long deadline = System.currentTimeMillis() + 3000;
        double cancelled = 0;
        while (System.currentTimeMillis() < deadline) {
            cancelled = meterRegistry.counter("tripplanner.planning.outcome",
                    "status", "FAILED", "code", ErrorCode.PLANNING_CANCELLED.name()).count();
            if (cancelled > 0) {
                break;
            }
            Thread.sleep(20);
        }
        assertEquals(1.0, cancelled);
        assertEquals(0, narrations.get());
    }

    @Test
    void concurrentRuns_shouldStayIndependent_whenOneRunTimesOut() throws Exception {
        flights = new StubUpstreamSearch("amadeus", Category.FLIGHT).respond(FLIGHTS).delay(800);
        TripPlanOrchestrator orchestrator = orchestrator();
        PlanningTimeouts impatient = PlanningTimeouts.builder()
                .providerTimeout(Duration.ofMillis(200))
                .narrationTimeout(Duration.ofSeconds(2))
                .build();
        PlanningTimeouts patient = PlanningTimeouts.builder()
                .providerTimeout(Duration.ofSeconds(5))
                .narrationTimeout(Duration.ofSeconds(2))
                .build();

        Future<PlanningOutcome> first = runExecutor.submit(() -> orchestrator.run(request().build(), impatient));
        Thread.sleep(50);
        Future<PlanningOutcome> second = runExecutor.submit(() -> orchestrator.run(request().build(), patient));

        PlanningOutcome timedOut = first.get(10, TimeUnit.SECONDS);
        PlanningOutcome completed = second.get(10, TimeUnit.SECONDS);

        assertEquals(ErrorCode.INSUFFICIENT_CORE_OPTIONS, timedOut.getFailure().getCode());
        assertTrue(completed.isSuccess(), () -> "second run failed: " + completed.getNotes());
        assertTrue(completed.getNotes().stream().noneMatch(n -> n.getCode() == ErrorCode.PROVIDER_UNAVAILABLE));
        assertEquals("AF7", completed.getItinerary().getFlight().getProviderId());
        assertEquals(2, flights.calls());
    }

    @Test
    void concurrentRuns_shouldStayIndependent_whenOneRunIsCancelled() throws Exception {
        flights = new StubUpstreamSearch("amadeus", Category.FLIGHT).respond(FLIGHTS).delay(800);
        TripPlanOrchestrator orchestrator = orchestrator();

        Future<PlanningOutcome> cancelled = orchestrator.submit(request().build());
        Thread.sleep(50);
        Future<PlanningOutcome> survivor = orchestrator.submit(request().build());
        Thread.sleep(100);
        assertTrue(cancelled.cancel(true));

        PlanningOutcome outcome = survivor.get(10, TimeUnit.SECONDS);

        assertTrue(outcome.isSuccess(), () -> "surviving run failed: " + outcome.getNotes());
        assertEquals(TripPlanOrchestrator.planIdOf(request().build()), outcome.getItinerary().getPlanId());
    }

    @Test
    void submit_shouldCompleteEveryRun_whenRunPoolIsSaturated() throws Exception {
        runExecutor.shutdownNow();
        runExecutor = Executors.newFixedThreadPool(2);
        TripPlanOrchestrator orchestrator = orchestrator();
        PlanningTimeouts timeouts = PlanningTimeouts.builder()
                .providerTimeout(Duration.ofSeconds(2))
                .narrationTimeout(Duration.ofSeconds(2))
                .build();

        List<Future<PlanningOutcome>> runs = List.of(
                orchestrator.submit(request().build(), timeouts),
                orchestrator.submit(request().destination("Rome").build(), timeouts),
                orchestrator.submit(request().destination("Lisbon").build(), timeouts));

        for (Future<PlanningOutcome> run : runs) {
            PlanningOutcome outcome = run.get(15, TimeUnit.SECONDS);
            assertTrue(outcome.isSuccess(), () -> "run failed: " + outcome.getNotes());
        }
        assertEquals(3, flights.calls());
    }
}
