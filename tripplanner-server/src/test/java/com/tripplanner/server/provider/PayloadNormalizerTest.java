package com.tripplanner.server.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tripplanner.common.properties.ProviderProperties;
import com.tripplanner.pojo.dto.ProviderQuery;
import com.tripplanner.pojo.enums.Category;
import com.tripplanner.pojo.model.CandidateOption;
import com.tripplanner.pojo.model.Money;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * 各数据源报文归一化的单元测试。
 */
class PayloadNormalizerTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private final ProviderQuery query = ProviderQuery.builder()
            .origin("NYC")
            .destination("Paris")
            .startDate(LocalDate.of(2026, 5, 1))
            .endDate(LocalDate.of(2026, 5, 4))
            .travelers(2)
            .currency("USD")
            .limit(40)
            .build();

    private JsonNode json(String s) throws Exception {
        return objectMapper.readTree(s);
    }

    @Test
    void flightOffers_shouldMapPriceStopsAndSkipForeignCurrency() throws Exception {
        JsonNode payload = json("{\"data\": ["
                + "{\"id\": \"1\", \"price\": {\"total\": \"512.30\", \"currency\": \"USD\"},"
                + " \"itineraries\": [{\"duration\": \"PT7H30M\", \"segments\": [{\"carrierCode\": \"AF\", \"number\": \"7\"}]},"
                + "                   {\"duration\": \"PT8H\", \"segments\": [{\"carrierCode\": \"AF\", \"number\": \"8\"}]}]},"
                + "{\"id\": \"2\", \"price\": {\"total\": \"380.00\", \"currency\": \"USD\"},"
                + " \"itineraries\": [{\"duration\": \"PT11H\", \"segments\": [{\"carrierCode\": \"TP\", \"number\": \"1\"},"
                + "                                                     {\"carrierCode\": \"TP\", \"number\": \"2\"}]}]},"
                + "{\"id\": \"3\", \"price\": {\"total\": \"300.00\", \"currency\": \"EUR\"}},"
                + "{\"id\": \"4\"}"
                + "]}");

        List<CandidateOption> options = new FlightOfferNormalizer()
                .normalize(Category.FLIGHT, "amadeus", payload, query);

        assertEquals(2, options.size());
        CandidateOption nonstop = options.get(0);
        assertEquals("Flight AF7", nonstop.getName());
        assertEquals(Money.of(512.30, "USD"), nonstop.getPrice());
        assertEquals(930, nonstop.getDurationMinutes());
        assertEquals(1.0, nonstop.getQualityScore(), 1e-9);
        assertTrue(nonstop.getTags().contains("nonstop"));

        CandidateOption oneStop = options.get(1);
        assertEquals(0.75, oneStop.getQualityScore(), 1e-9);
        assertTrue(oneStop.getTags().isEmpty());
    }

    @Test
    void flightOffers_shouldRejectPayloadWithoutDataArray() throws Exception {
        JsonNode payload = json("{\"errors\": [{\"code\": 38189}]}");

        UpstreamCallException e = assertThrows(UpstreamCallException.class, () ->
                new FlightOfferNormalizer().normalize(Category.FLIGHT, "amadeus", payload, query));
        assertEquals("malformed_payload", e.getErrorType());
        assertTrue(e.isRetriable());
    }

    @Test
    void hotelOffers_shouldUsePerNightTimesNights_whenTotalMissing() throws Exception {
        JsonNode payload = json("{\"data\": [{\"hotel\": {\"hotelId\": \"H9\", \"name\": \"Canal\","
                + " \"latitude\": 48.87, \"longitude\": 2.36, \"amenities\": [\"WIFI\", \"SPA\"]},"
                + " \"offers\": [{\"price\": {\"perNight\": \"120\", \"currency\": \"USD\"}}]}]}");

        CandidateOption hotel = new HotelOfferNormalizer()
                .normalize(Category.LODGING, "amadeus-hotels", payload, query).get(0);

        assertEquals(Money.of(360, "USD"), hotel.getPrice());
        assertEquals(48.87, hotel.getLocation().getLat(), 1e-9);
        assertEquals(List.of("wifi", "spa"), hotel.getTags());
        assertEquals(0.6, hotel.getQualityScore(), 1e-9);
    }

    @Test
    void places_shouldEstimatePriceMapTagsAndParseHours() throws Exception {
        ProviderProperties properties = new ProviderProperties();
        JsonNode payload = json("{\"results\": ["
                + "{\"place_id\": \"p1\", \"name\": \"Louvre\", \"rating\": 4.5, \"price_level\": 2,"
                + " \"types\": [\"museum\", \"point_of_interest\"],"
                + " \"geometry\": {\"location\": {\"lat\": 48.8606, \"lng\": 2.3376}},"
                + " \"opening_hours\": {\"open\": \"0900\", \"close\": \"18:00\"}},"
                + "{\"place_id\": \"p2\", \"name\": \"Late Bar\", \"types\": [\"bar\"],"
                + " \"opening_hours\": {\"open\": \"2000\", \"close\": \"0200\"}},"
                + "{\"name\": \"No id\"}"
                + "]}");

        List<CandidateOption> places = new PlaceNormalizer(properties)
                .normalize(Category.ACTIVITY, "google-places", payload, query);

        assertEquals(2, places.size());
        CandidateOption louvre = places.get(0);
        assertEquals(Category.ACTIVITY, louvre.getCategory());
        assertEquals(Money.of(70, "USD"), louvre.getPrice());
        assertTrue(louvre.getTags().contains("museum"));
        assertTrue(louvre.getTags().contains("culture"));
        assertEquals(LocalTime.of(9, 0), louvre.getOpeningHours().getOpen());
        assertEquals(LocalTime.of(18, 0), louvre.getOpeningHours().getClose());
        assertEquals(0.9, louvre.getQualityScore(), 1e-9);

        CandidateOption bar = places.get(1);
        assertNull(bar.getOpeningHours(), "overnight hours are treated as unknown");
        assertEquals(Money.of(40, "USD"), bar.getPrice());
    }
}
