package com.jreinhal.cafefinder.search.answer;

import com.jreinhal.cafefinder.search.result.SearchResultType;

public record AnswerSource(String title, String url, SearchResultType type) {
}
