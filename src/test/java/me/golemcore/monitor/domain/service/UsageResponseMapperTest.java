package me.golemcore.monitor.domain.service;

import me.golemcore.monitor.domain.exception.UsageDecodingException;
import me.golemcore.monitor.domain.model.UsageBucket;
import me.golemcore.monitor.domain.model.UsageResponse;
import me.golemcore.monitor.domain.model.UsageSnapshot;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class UsageResponseMapperTest {

    private static final Instant FETCHED_AT = Instant.parse("2026-02-01T10:00:00Z");

    private UsageResponseMapper mapper;

    @BeforeEach
    void setUp() {
        mapper = new UsageResponseMapper();
    }

    @Test
    void shouldConvertPercentToRatioAndParseResetTime() {
        UsageResponse response = UsageResponse.builder()
                .fiveHour(bucket(87.5, "2025-01-01T00:00:00Z"))
                .build();

        UsageSnapshot snapshot = mapper.map(response, FETCHED_AT);

        UsageBucket bucket = snapshot.findBucket("five_hour").orElseThrow();
        assertEquals(0.875, bucket.getUtilizationRatio(), 1e-9);
        assertEquals(Instant.parse("2025-01-01T00:00:00Z"), bucket.getResetAt());
        assertEquals("Current session", bucket.getTitle());
        assertEquals(FETCHED_AT, snapshot.getFetchedAt());
    }

    @Test
    void shouldExcludeIdleOptionalBucket() {
        UsageResponse response = UsageResponse.builder()
                .sevenDayOpus(bucket(0.0, null))
                .build();

        UsageSnapshot snapshot = mapper.map(response, FETCHED_AT);

        assertTrue(snapshot.isEmpty());
    }

    @Test
    void shouldIncludeIdleAlwaysShownBuckets() {
        UsageResponse response = UsageResponse.builder()
                .fiveHour(bucket(0.0, null))
                .sevenDay(bucket(0.0, null))
                .build();

        UsageSnapshot snapshot = mapper.map(response, FETCHED_AT);

        assertEquals(List.of("five_hour", "seven_day"), ids(snapshot));
    }

    @Test
    void shouldIncludeOptionalBucketWithKnownResetTime() {
        UsageResponse response = UsageResponse.builder()
                .sevenDaySonnet(bucket(0.0, "2026-02-03T00:00:00Z"))
                .build();

        UsageSnapshot snapshot = mapper.map(response, FETCHED_AT);

        assertEquals(List.of("seven_day_sonnet"), ids(snapshot));
    }

    @Test
    void shouldKeepFixedDisplayOrder() {
        UsageResponse response = UsageResponse.builder()
                .sevenDayOauthApps(bucket(5.0, null))
                .sevenDayOpus(bucket(10.0, null))
                .sevenDaySonnet(bucket(20.0, null))
                .sevenDay(bucket(30.0, null))
                .fiveHour(bucket(40.0, null))
                .build();

        UsageSnapshot snapshot = mapper.map(response, FETCHED_AT);

        assertEquals(List.of("five_hour", "seven_day", "seven_day_sonnet", "seven_day_opus", "seven_day_oauth_apps"),
                ids(snapshot));
    }

    @Test
    void shouldClampUtilizationToUnitRange() {
        UsageResponse response = UsageResponse.builder()
                .fiveHour(bucket(130.0, null))
                .sevenDay(bucket(-4.0, null))
                .build();

        UsageSnapshot snapshot = mapper.map(response, FETCHED_AT);

        assertEquals(1.0, snapshot.findBucket("five_hour").orElseThrow().getUtilizationRatio(), 1e-9);
        assertEquals(0.0, snapshot.findBucket("seven_day").orElseThrow().getUtilizationRatio(), 1e-9);
    }

    @Test
    void shouldTreatMalformedResetTimeAsUnknown() {
        UsageResponse response = UsageResponse.builder()
                .fiveHour(bucket(50.0, "next tuesday"))
                .build();

        UsageSnapshot snapshot = mapper.map(response, FETCHED_AT);

        assertNull(snapshot.findBucket("five_hour").orElseThrow().getResetAt());
    }

    @Test
    void shouldKeepIdleOptionalBucketWhenResetTimeIsPresentButMalformed() {
        UsageResponse response = UsageResponse.builder()
                .sevenDaySonnet(bucket(0.0, "soon"))
                .build();

        UsageSnapshot snapshot = mapper.map(response, FETCHED_AT);

        UsageBucket bucket = snapshot.findBucket("seven_day_sonnet").orElseThrow();
        assertEquals(0.0, bucket.getUtilizationRatio(), 1e-9);
        assertNull(bucket.getResetAt());
    }

    @Test
    void shouldParseDatesWithAndWithoutFractionalSeconds() {
        assertEquals(Instant.parse("2025-09-10T17:00:00Z"), UsageResponseMapper.parseDate("2025-09-10T17:00:00Z"));
        assertEquals(Instant.parse("2025-09-10T17:00:00.123456Z"),
                UsageResponseMapper.parseDate("2025-09-10T17:00:00.123456+00:00"));
        assertEquals(Instant.parse("2025-09-10T15:00:00Z"),
                UsageResponseMapper.parseDate("2025-09-10T17:00:00+02:00"));
        assertNull(UsageResponseMapper.parseDate("2025-13-45"));
        assertNull(UsageResponseMapper.parseDate(null));
    }

    @Test
    void shouldRejectBucketWithoutUtilization() {
        UsageResponse response = UsageResponse.builder()
                .fiveHour(bucket(null, "2025-01-01T00:00:00Z"))
                .build();

        assertThrows(UsageDecodingException.class, () -> mapper.map(response, FETCHED_AT));
    }

    private static UsageResponse.Bucket bucket(Double utilization, String resetsAt) {
        return UsageResponse.Bucket.builder()
                .utilization(utilization)
                .resetsAt(resetsAt)
                .build();
    }

    private static List<String> ids(UsageSnapshot snapshot) {
        return snapshot.getBuckets().stream().map(UsageBucket::getId).toList();
    }
}
