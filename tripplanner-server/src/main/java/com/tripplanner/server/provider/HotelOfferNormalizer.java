package com.tripplanner.server.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.tripplanner.pojo.dto.ProviderQuery;
import com.tripplanner.pojo.enums.Category;
import com.tripplanner.pojo.model.CandidateOption;
import com.tripplanner.pojo.model.GeoPoint;
import com.tripplanner.pojo.model.Money;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * 住宿报价归一化（Amadeus Hotel Offers 风格）：
 * <pre>
 * {"data": [{"hotel": {"hotelId": "HLPAR266", "name": "...", "rating": "4",
 *                      "latitude": 48.85, "longitude": 2.35, "amenities": ["WIFI"]},
 *            "offers": [{"price": {"total": "600.00", "currency": "EUR"}}]}]}
 * </pre>
 * total 为整段入住总价；只有 perNight 时按晚数折算。星级 / 5 作为质量分。
 */
@Component
@Slf4j
public class HotelOfferNormalizer extends AbstractPayloadNormalizer {

    private static final double DEFAULT_QUALITY = 0.6;

    @Override
    public boolean supports(Category category) {
        return category == Category.LODGING;
    }

    @Override
    public List<CandidateOption> normalize(Category category, String provider, JsonNode payload, ProviderQuery query)
            throws UpstreamCallException {
        JsonNode items = requireArray(payload, "data", provider);
        List<CandidateOption> result = new ArrayList<>();
        for (JsonNode item : items) {
            JsonNode hotel = item.get("hotel");
            String id = text(hotel, "hotelId");
            JsonNode offers = item.get("offers");
            if (id == null || offers == null || !offers.isArray() || offers.isEmpty()) {
                log.debug("跳过无报价的住宿: provider={}, id={}", provider, id);
                continue;
            }
            JsonNode price = offers.get(0).get("price");
            String currency = text(price, "currency");
            if (currency != null && !currency.equalsIgnoreCase(query.getCurrency())) {
                log.debug("跳过币种不一致的住宿报价: id={}, currency={}", id, currency);
                continue;
            }
            BigDecimal total = decimal(price, "total");
            if (total == null) {
                BigDecimal perNight = decimal(price, "perNight");
                total = perNight == null ? null : perNight.multiply(BigDecimal.valueOf(query.nights()));
            }
            if (total == null || total.signum() < 0) {
                continue;
            }

            Double rating = number(hotel, "rating");
            Double lat = number(hotel, "latitude");
            Double lng = number(hotel, "longitude");
            String name = text(hotel, "name");

            CandidateOption.CandidateOptionBuilder builder = CandidateOption.builder()
                    .category(Category.LODGING)
                    .provider(provider)
                    .providerId(id)
                    .name(name == null ? "Hotel " + id : name)
                    .price(Money.of(total, query.getCurrency()))
                    .location(lat != null && lng != null ? GeoPoint.of(lat, lng) : null)
                    .qualityScore(rating == null ? DEFAULT_QUALITY : clampScore(rating / 5.0));
            JsonNode amenities = hotel.get("amenities");
            if (amenities != null && amenities.isArray()) {
                for (JsonNode a : amenities) {
                    if (!a.asText().isBlank()) {
                        builder.tag(a.asText().trim().toLowerCase(Locale.ROOT));
                    }
                }
            }
            result.add(builder.build());
        }
        return result;
    }
}
