package com.jreinhal.cafefinder.search.result;

public final class Scores {

    private Scores() {
    }

    public static double clamp(double score) {
        if (Double.isNaN(score)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, score));
    }
}
