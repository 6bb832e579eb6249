package com.tripplanner.server.planner;

import com.tripplanner.common.properties.PlannerProperties;
import com.tripplanner.pojo.model.GeoPoint;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * 交通时间估算：球面距离 / 平均速度 + 固定换乘开销，向上取整到分钟。
 * <p>这是一个确定性的近似值（随距离单调不减），不调用任何实时路线服务。
 * 任一端坐标未知时只计固定开销。</p>
 */
@Component
@RequiredArgsConstructor
public class TravelTimeEstimator {

    private static final double EARTH_RADIUS_KM = 6371.0;

    private final PlannerProperties plannerProperties;

    public int minutesBetween(GeoPoint from, GeoPoint to) {
        PlannerProperties.Schedule cfg = plannerProperties.getSchedule();
        int overhead = Math.max(0, cfg.getTransferOverheadMinutes());
        if (from == null || to == null) {
            return overhead;
        }
        double km = distanceKm(from, to);
        double speed = cfg.getTravelSpeedKmh() <= 0 ? 25.0 : cfg.getTravelSpeedKmh();
        return overhead + (int) Math.ceil(km / speed * 60.0);
    }

    static double distanceKm(GeoPoint a, GeoPoint b) {
        double dLat = Math.toRadians(b.getLat() - a.getLat());
        double dLng = Math.toRadians(b.getLng() - a.getLng());
        double h = Math.sin(dLat / 2) * Math.sin(dLat / 2)
                + Math.cos(Math.toRadians(a.getLat())) * Math.cos(Math.toRadians(b.getLat()))
                * Math.sin(dLng / 2) * Math.sin(dLng / 2);
        return 2 * EARTH_RADIUS_KM * Math.asin(Math.min(1.0, Math.sqrt(h)));
    }
}
