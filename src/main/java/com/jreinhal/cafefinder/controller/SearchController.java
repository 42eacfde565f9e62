package com.jreinhal.cafefinder.controller;

import com.jreinhal.cafefinder.search.IndexStatus;
import com.jreinhal.cafefinder.search.QuickSearchResponse;
import com.jreinhal.cafefinder.search.SearchContext;
import com.jreinhal.cafefinder.search.SearchEngine;
import com.jreinhal.cafefinder.search.SearchResponse;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST surface of the search engine.
 */
@RestController
@RequestMapping("/api/search")
public class SearchController {
    private static final Logger log = LoggerFactory.getLogger(SearchController.class);

    static final int MIN_QUICK_LIMIT = 1;
    static final int MAX_QUICK_LIMIT = 20;

    private final SearchEngine searchEngine;

    public SearchController(SearchEngine searchEngine) {
        this.searchEngine = searchEngine;
    }

    /**
     * Full search. A missing or blank query returns the empty envelope.
     */
    @GetMapping
    public SearchResponse search(@RequestParam(value = "q", required = false) String query,
            @RequestParam(value = "page", required = false) String page,
            @RequestParam(value = "resourceId", required = false) String resourceId,
            @RequestParam(value = "topics", required = false) List<String> topics) {
        SearchContext context = page == null && resourceId == null && topics == null
                ? null : new SearchContext(page, resourceId, topics);
        return this.searchEngine.search(query, context);
    }

    @GetMapping("/quick")
    public QuickSearchResponse quickSearch(@RequestParam(value = "q", required = false) String query,
            @RequestParam(value = "limit", defaultValue = "5") int limit) {
        int clamped = Math.max(MIN_QUICK_LIMIT, Math.min(MAX_QUICK_LIMIT, limit));
        return this.searchEngine.quickSearch(query, clamped);
    }

    @GetMapping("/status")
    public IndexStatus status() {
        return this.searchEngine.status();
    }

    @PostMapping("/reindex")
    public IndexStatus reindex() {
        log.info("Reindex requested");
        return this.searchEngine.reindex();
    }
}
