package com.jreinhal.cafefinder.search.index;

import com.jreinhal.cafefinder.corpus.CorpusSnapshot;
import com.jreinhal.cafefinder.model.Competitor;
import com.jreinhal.cafefinder.model.Discussion;
import com.jreinhal.cafefinder.model.Faq;
import com.jreinhal.cafefinder.model.LopSession;
import com.jreinhal.cafefinder.model.Person;
import com.jreinhal.cafefinder.model.PulseSignal;
import com.jreinhal.cafefinder.model.Resource;
import com.jreinhal.cafefinder.search.result.SearchResultType;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * One immutable generation of prebuilt indexes. Replaced wholesale on rebuild.
 */
final class IndexSet {
    final FuzzyIndex<Person> people;
    final FuzzyIndex<Resource> resources;
    final FuzzyIndex<Faq> faqs;
    final FuzzyIndex<Discussion> discussions;
    final FuzzyIndex<LopSession> lopSessions;
    final FuzzyIndex<PulseSignal> pulseSignals;
    final FuzzyIndex<Competitor> competitors;
    final List<Resource> tools;
    private final Map<String, Person> peopleById;

    private IndexSet(CorpusSnapshot corpus) {
        List<Resource> active = corpus.resources().stream().filter(r -> !r.archived()).toList();
        this.people = new FuzzyIndex<>(corpus.people(), IndexProfiles.PEOPLE);
        this.resources = new FuzzyIndex<>(active, IndexProfiles.RESOURCES);
        this.faqs = new FuzzyIndex<>(corpus.faqs(), IndexProfiles.FAQS);
        this.discussions = new FuzzyIndex<>(corpus.discussions(), IndexProfiles.DISCUSSIONS);
        this.lopSessions = new FuzzyIndex<>(corpus.lopSessions(), IndexProfiles.LOP_SESSIONS);
        this.pulseSignals = new FuzzyIndex<>(corpus.pulseSignals(), IndexProfiles.PULSE_SIGNALS);
        this.competitors = new FuzzyIndex<>(corpus.competitors(), IndexProfiles.COMPETITORS);
        this.tools = active.stream().filter(Resource::isTool).toList();
        Map<String, Person> byId = new HashMap<>();
        for (Person person : corpus.people()) {
            if (person.id() != null) {
                byId.putIfAbsent(person.id(), person);
            }
        }
        this.peopleById = Collections.unmodifiableMap(byId);
    }

    static IndexSet build(CorpusSnapshot corpus) {
        return new IndexSet(corpus);
    }

    Optional<Person> person(String id) {
        return id == null ? Optional.empty() : Optional.ofNullable(this.peopleById.get(id));
    }

    Map<SearchResultType, Integer> sizes() {
        Map<SearchResultType, Integer> sizes = new EnumMap<>(SearchResultType.class);
        sizes.put(SearchResultType.PERSON, this.people.size());
        sizes.put(SearchResultType.TOOL, this.tools.size());
        sizes.put(SearchResultType.FAQ, this.faqs.size());
        sizes.put(SearchResultType.RESOURCE, this.resources.size());
        sizes.put(SearchResultType.DISCUSSION, this.discussions.size());
        sizes.put(SearchResultType.LOP_SESSION, this.lopSessions.size());
        sizes.put(SearchResultType.PULSE_SIGNAL, this.pulseSignals.size());
        sizes.put(SearchResultType.COMPETITOR, this.competitors.size());
        return sizes;
    }
}
