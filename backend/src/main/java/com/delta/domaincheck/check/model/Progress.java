package com.delta.domaincheck.check.model;

public record Progress(int total, int completed, int failed, int remaining, int percentage) {

    public static Progress of(int total, int completed, int failed) {
        return new Progress(total, completed, failed, total - completed, percentage(completed, total));
    }

    public static Progress empty() {
        return of(0, 0, 0);
    }

    static int percentage(int part, int whole) {
        if (whole <= 0) {
            return 0;
        }
        return (int) Math.round(part * 100.0 / whole);
    }
}
