package com.jreinhal.cafefinder.search.answer;

public record AnswerAction(String label, String url, String icon, boolean primary) {
}
