package com.company.energyanalytics.exception;

import java.time.Instant;

public class InvalidWindowException extends RuntimeException {
    public InvalidWindowException(Instant start, Instant end, long resolutionSeconds) {
        super("Invalid window [" + start + ", " + end + ") at resolution " + resolutionSeconds + "s");
    }
}
