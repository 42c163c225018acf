package com.chronofill.backend.service.plan;

public enum Materialization {
    VIEW(0.0),
    INCREMENTAL(2.0),
    TABLE(3.0);

    private final double secondsPerThousandRows;

    Materialization(double secondsPerThousandRows) {
        this.secondsPerThousandRows = secondsPerThousandRows;
    }

    public double getSecondsPerThousandRows() {
        return secondsPerThousandRows;
    }

    public boolean movesData() {
        return this != VIEW;
    }
}
