package com.folautech.metric.aggregator;

import com.folautech.metric.exception.ErrorCode;
import com.folautech.metric.model.Reading;
import lombok.Value;

/**
 * A reading the aggregator could not classify, with the reason it was skipped.
 * {@code index} is the position in the evaluated batch; {@code reading} is null when the entry itself was null.
 */
@Value
public class RejectedReading {
    int index;
    Reading reading;
    ErrorCode errorCode;
    String reason;
}
