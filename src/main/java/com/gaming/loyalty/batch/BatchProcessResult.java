package com.gaming.loyalty.batch;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * Summary of a batch run. Players that failed are listed in {@code errors} with the failure message.
 */
@Value
@Builder
public class BatchProcessResult {
    int playersRequested;
    int playersProcessed;
    int rewardsCreated;
    int rewardsApproved;
    int rewardsRejected;
    int rewardsIssued;
    int abuseSignalsRaised;
    @Singular
    Map<String, String> errors;
}
