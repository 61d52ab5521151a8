package com.optiondesk.api.dto.response;

import java.time.Instant;
import java.util.List;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class PreloaderStatusResponse {
    private boolean running;
    private boolean cycleInProgress;
    private List<String> symbols;
    private Instant lastCycleCompletedAt;
}
