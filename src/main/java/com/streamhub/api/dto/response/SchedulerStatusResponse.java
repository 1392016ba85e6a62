package com.streamhub.api.dto.response;

import com.streamhub.domain.enums.SchedulerState;
import java.time.Instant;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class SchedulerStatusResponse {

    private SchedulerState state;
    private Instant lastActivity;
    private Instant lastTickAt;
    private String lastError;

    /** When the cached summary was built, regardless of its age. */
    private Instant summaryCachedAt;
}
