package com.jreinhal.cafefinder.dictionary;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "cafefinder.synonyms")
public class SynonymProperties {
    /**
     * Master toggle for synonym expansion of query tokens. Canonical lookups keep working when off.
     */
    private boolean enabled = true;

    /**
     * Extra synonyms merged over the built-in vocabulary, keyed by canonical term.
     *
     * Example:
     * cafefinder.synonyms.entries.jira[0]=tickets
     */
    private Map<String, List<String>> entries = new LinkedHashMap<>();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public Map<String, List<String>> getEntries() {
        return entries;
    }

    public void setEntries(Map<String, List<String>> entries) {
        this.entries = entries;
    }
}
