package com.tripplanner.server.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.tripplanner.common.properties.ProviderProperties;
import com.tripplanner.pojo.dto.ProviderQuery;
import com.tripplanner.pojo.enums.Category;
import com.tripplanner.pojo.model.CandidateOption;
import com.tripplanner.pojo.model.GeoPoint;
import com.tripplanner.pojo.model.Money;
import com.tripplanner.pojo.model.OpeningHours;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * 景点/餐厅归一化（Google Places 风格），同时服务 ACTIVITY 与 MEAL：
 * <pre>
 * {"results": [{"place_id": "...", "name": "...", "rating": 4.6, "price_level": 2,
 *               "types": ["museum"],
 *               "geometry": {"location": {"lat": 48.86, "lng": 2.33}},
 *               "opening_hours": {"open": "0900", "close": "1800"}}]}
 * </pre>
 * Places 不给价格，按 price_level 估算人均价再乘以人数；类型映射为兴趣标签与预计时长。
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PlaceNormalizer extends AbstractPayloadNormalizer {

    private static final double DEFAULT_QUALITY = 0.5;

    private final ProviderProperties providerProperties;

    @Override
    public boolean supports(Category category) {
        return category.isPerSlot();
    }

    @Override
    public List<CandidateOption> normalize(Category category, String provider, JsonNode payload, ProviderQuery query)
            throws UpstreamCallException {
        JsonNode places = requireArray(payload, "results", provider);
        List<CandidateOption> result = new ArrayList<>();
        for (JsonNode place : places) {
            String id = text(place, "place_id");
            String name = text(place, "name");
            if (id == null || name == null) {
                continue;
            }

            List<String> types = new ArrayList<>();
            JsonNode typesNode = place.get("types");
            if (typesNode != null && typesNode.isArray()) {
                typesNode.forEach(t -> types.add(t.asText().trim().toLowerCase(Locale.ROOT)));
            }
            Set<String> tags = new LinkedHashSet<>(types);
            for (String type : types) {
                String tag = providerProperties.getTypeTags().get(type);
                if (tag != null) {
                    tags.add(tag);
                }
            }

            Double rating = number(place, "rating");
            CandidateOption.CandidateOptionBuilder builder = CandidateOption.builder()
                    .category(category)
                    .provider(provider)
                    .providerId(id)
                    .name(name)
                    .price(estimatePrice(place, query))
                    .location(location(place))
                    .openingHours(openingHours(place))
                    .durationMinutes(duration(types))
                    .tags(new ArrayList<>(tags))
                    .qualityScore(rating == null ? DEFAULT_QUALITY : clampScore(rating / 5.0));
            result.add(builder.build());
        }
        return result;
    }

    private Money estimatePrice(JsonNode place, ProviderQuery query) {
        List<Double> levels = providerProperties.getPoiPriceLevels();
        Double level = number(place, "price_level");
        double perPerson = providerProperties.getPoiDefaultPrice();
        if (level != null && !levels.isEmpty()) {
            int idx = (int) Math.max(0, Math.min(levels.size() - 1, Math.round(level)));
            perPerson = levels.get(idx);
        }
        BigDecimal total = BigDecimal.valueOf(perPerson).multiply(BigDecimal.valueOf(Math.max(1, query.getTravelers())));
        return Money.of(total, query.getCurrency());
    }

    private GeoPoint location(JsonNode place) {
        JsonNode geometry = place.get("geometry");
        JsonNode loc = geometry == null ? null : geometry.get("location");
        Double lat = number(loc, "lat");
        Double lng = number(loc, "lng");
        return lat != null && lng != null ? GeoPoint.of(lat, lng) : null;
    }

    /**
     * 营业时间缺失或无法解析（含跨午夜）时视为未知，不做时间窗约束。
     */
    private OpeningHours openingHours(JsonNode place) {
        JsonNode hours = place.get("opening_hours");
        if (hours == null) {
            return null;
        }
        LocalTime open = time(text(hours, "open"));
        LocalTime close = time(text(hours, "close"));
        if (open == null || close == null || !close.isAfter(open)) {
            return null;
        }
        return OpeningHours.of(open, close);
    }

    private Integer duration(List<String> types) {
        for (String type : types) {
            Integer minutes = providerProperties.getTypeDurations().get(type);
            if (minutes != null) {
                return minutes;
            }
        }
        return providerProperties.getDefaultDurationMinutes();
    }
}
