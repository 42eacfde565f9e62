package com.jreinhal.cafefinder.search;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "cafefinder.search")
public class SearchProperties {
    /**
     * Cap on results returned per category by a full search.
     */
    private int maxResultsPerType = 10;

    /**
     * Default per-category cap for quick search.
     */
    private int quickSearchLimit = 5;

    /**
     * Whether full searches attempt to build a direct answer.
     */
    private boolean answerSynthesis = true;

    /**
     * How long the derived tool index is reused before being rebuilt from the resource corpus.
     */
    private long toolIndexCacheTtlSeconds = 300;

    /**
     * Build indexes once the application is ready instead of on the first search.
     */
    private boolean initializeOnStartup = true;

    public int getMaxResultsPerType() {
        return maxResultsPerType;
    }

    public void setMaxResultsPerType(int maxResultsPerType) {
        this.maxResultsPerType = maxResultsPerType;
    }

    public int getQuickSearchLimit() {
        return quickSearchLimit;
    }

    public void setQuickSearchLimit(int quickSearchLimit) {
        this.quickSearchLimit = quickSearchLimit;
    }

    public boolean isAnswerSynthesis() {
        return answerSynthesis;
    }

    public void setAnswerSynthesis(boolean answerSynthesis) {
        this.answerSynthesis = answerSynthesis;
    }

    public long getToolIndexCacheTtlSeconds() {
        return toolIndexCacheTtlSeconds;
    }

    public void setToolIndexCacheTtlSeconds(long toolIndexCacheTtlSeconds) {
        this.toolIndexCacheTtlSeconds = toolIndexCacheTtlSeconds;
    }

    public boolean isInitializeOnStartup() {
        return initializeOnStartup;
    }

    public void setInitializeOnStartup(boolean initializeOnStartup) {
        this.initializeOnStartup = initializeOnStartup;
    }
}
