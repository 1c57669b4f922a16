package com.example.retrain.lifecycle;

public record HealthReport(boolean healthy, String detail) {

    public static HealthReport ok(String detail) {
        return new HealthReport(true, detail);
    }

    public static HealthReport failed(String detail) {
        return new HealthReport(false, detail);
    }
}
