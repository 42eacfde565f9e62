package com.jreinhal.cafefinder.search.intent;

public record ScoredIntent(IntentType intent, double confidence) {
}
