package com.tripplanner.server.planner;

import com.tripplanner.common.properties.PlannerProperties;
import com.tripplanner.pojo.model.GeoPoint;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TravelTimeEstimatorTest {

    private final TravelTimeEstimator estimator = new TravelTimeEstimator(new PlannerProperties());

    private static final GeoPoint LOUVRE = GeoPoint.of(48.8606, 2.3376);

    @Test
    void minutesBetween_shouldOnlyChargeOverhead_whenLocationUnknown() {
        assertEquals(10, estimator.minutesBetween(null, LOUVRE));
        assertEquals(10, estimator.minutesBetween(LOUVRE, null));
        assertEquals(10, estimator.minutesBetween(LOUVRE, LOUVRE));
    }

    @Test
    void minutesBetween_shouldGrowWithDistance() {
        GeoPoint near = GeoPoint.of(48.8530, 2.3499);
        GeoPoint far = GeoPoint.of(48.8049, 2.1204);

        int toNear = estimator.minutesBetween(LOUVRE, near);
        int toFar = estimator.minutesBetween(LOUVRE, far);

        assertTrue(toNear > 10);
        assertTrue(toFar > toNear);
        assertEquals(toFar, estimator.minutesBetween(far, LOUVRE));
    }

    @Test
    void distanceKm_shouldMatchKnownDistance() {
        // Louvre -> Versailles, roughly 17 km
        double km = TravelTimeEstimator.distanceKm(LOUVRE, GeoPoint.of(48.8049, 2.1204));
        assertTrue(km > 16 && km < 18, "got " + km);
    }
}
