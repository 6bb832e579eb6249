package com.tripplanner.server.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.tripplanner.pojo.dto.ProviderQuery;
import com.tripplanner.pojo.enums.Category;
import com.tripplanner.pojo.model.CandidateOption;
import com.tripplanner.pojo.model.Money;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * 航班报价归一化（Amadeus Flight Offers 风格）：
 * <pre>
 * {"data": [{"id": "1",
 *            "price": {"total": "512.30", "currency": "USD"},
 *            "itineraries": [{"duration": "PT13H30M",
 *                             "segments": [{"carrierCode": "SQ", "number": "22"}]}]}]}
 * </pre>
 * price.total 为全部乘客的往返总价。经停越少质量分越高。
 */
@Component
@Slf4j
public class FlightOfferNormalizer extends AbstractPayloadNormalizer {

    @Override
    public boolean supports(Category category) {
        return category == Category.FLIGHT;
    }

    @Override
    public List<CandidateOption> normalize(Category category, String provider, JsonNode payload, ProviderQuery query)
            throws UpstreamCallException {
        JsonNode offers = requireArray(payload, "data", provider);
        List<CandidateOption> result = new ArrayList<>();
        for (JsonNode offer : offers) {
            String id = text(offer, "id");
            JsonNode priceNode = offer.get("price");
            BigDecimal total = decimal(priceNode, "total");
            String currency = text(priceNode, "currency");
            if (id == null || total == null || total.signum() < 0) {
                log.debug("跳过无效航班报价: provider={}, id={}", provider, id);
                continue;
            }
            if (currency != null && !currency.equalsIgnoreCase(query.getCurrency())) {
                log.debug("跳过币种不一致的航班报价: id={}, currency={}", id, currency);
                continue;
            }

            int segments = 0;
            int legs = 0;
            long minutes = 0;
            String label = null;
            JsonNode itineraries = offer.get("itineraries");
            if (itineraries != null && itineraries.isArray()) {
                for (JsonNode itinerary : itineraries) {
                    legs++;
                    minutes += parseMinutes(text(itinerary, "duration"));
                    JsonNode segs = itinerary.get("segments");
                    if (segs != null && segs.isArray()) {
                        segments += segs.size();
                        if (label == null && segs.size() > 0) {
                            String carrier = text(segs.get(0), "carrierCode");
                            String number = text(segs.get(0), "number");
                            if (carrier != null) {
                                label = carrier + (number == null ? "" : number);
                            }
                        }
                    }
                }
            }
            int stops = Math.max(0, segments - legs);

            CandidateOption.CandidateOptionBuilder builder = CandidateOption.builder()
                    .category(Category.FLIGHT)
                    .provider(provider)
                    .providerId(id)
                    .name(label == null ? "Flight " + id : "Flight " + label)
                    .price(Money.of(total, query.getCurrency()))
                    .durationMinutes(minutes > 0 ? (int) minutes : null)
                    .qualityScore(clampScore(1.0 - 0.25 * stops));
            if (stops == 0 && legs > 0) {
                builder.tag("nonstop");
            }
            result.add(builder.build());
        }
        return result;
    }

    private long parseMinutes(String isoDuration) {
        if (isoDuration == null) {
            return 0;
        }
        try {
            return Duration.parse(isoDuration).toMinutes();
        } catch (DateTimeParseException e) {
            return 0;
        }
    }
}
