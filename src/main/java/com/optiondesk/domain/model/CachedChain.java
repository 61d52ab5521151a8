package com.optiondesk.domain.model;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import lombok.Value;

/** Chain parameters of one underlying plus the time they were fetched. */
@Value
public class CachedChain {

    String underlying;
    List<ChainParams> params;
    Instant fetchedAt;

    public boolean isFresh(Instant now, Duration ttl) {
        return Duration.between(fetchedAt, now).compareTo(ttl) < 0;
    }
}
