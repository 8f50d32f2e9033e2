package com.tradingagent.oms;

import com.tradingagent.domain.model.Position;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class SubmissionResult {

    public enum Status {
        OPENED,
        DUPLICATE,
        QUEUED,
        REJECTED
    }

    Status status;
    Position position;
    String message;

    public boolean isOpened() {
        return status == Status.OPENED;
    }

    static SubmissionResult of(Status status, String message) {
        return SubmissionResult.builder().status(status).message(message).build();
    }
}
