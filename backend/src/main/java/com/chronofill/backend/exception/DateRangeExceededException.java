package com.chronofill.backend.exception;

public class DateRangeExceededException extends BackfillValidationException {
    public DateRangeExceededException(long requestedDays, int maxDays, String billingTier) {
        super("DATE_RANGE_EXCEEDED", "Date range of " + requestedDays + " days exceeds the maximum of "
                + maxDays + " days for billing tier '" + billingTier + "'");
    }
}
