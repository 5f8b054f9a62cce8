package me.golemcore.monitor.adapter.inbound.web.dto;

import me.golemcore.monitor.domain.model.UsageBucket;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UsageBucketDto {
    private String id;
    private String title;
    private double utilizationRatio;
    private Instant resetAt;

    public static UsageBucketDto from(UsageBucket bucket) {
        return UsageBucketDto.builder()
                .id(bucket.getId())
                .title(bucket.getTitle())
                .utilizationRatio(bucket.getUtilizationRatio())
                .resetAt(bucket.getResetAt())
                .build();
    }
}
