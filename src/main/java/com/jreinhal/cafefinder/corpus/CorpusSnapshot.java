package com.jreinhal.cafefinder.corpus;

import com.jreinhal.cafefinder.model.Competitor;
import com.jreinhal.cafefinder.model.Discussion;
import com.jreinhal.cafefinder.model.Faq;
import com.jreinhal.cafefinder.model.LopSession;
import com.jreinhal.cafefinder.model.Person;
import com.jreinhal.cafefinder.model.PulseSignal;
import com.jreinhal.cafefinder.model.Resource;
import java.util.List;

public record CorpusSnapshot(
        List<Person> people,
        List<Resource> resources,
        List<Faq> faqs,
        List<Discussion> discussions,
        List<LopSession> lopSessions,
        List<PulseSignal> pulseSignals,
        List<Competitor> competitors) {

    public CorpusSnapshot {
        people = people == null ? List.of() : List.copyOf(people);
        resources = resources == null ? List.of() : List.copyOf(resources);
        faqs = faqs == null ? List.of() : List.copyOf(faqs);
        discussions = discussions == null ? List.of() : List.copyOf(discussions);
        lopSessions = lopSessions == null ? List.of() : List.copyOf(lopSessions);
        pulseSignals = pulseSignals == null ? List.of() : List.copyOf(pulseSignals);
        competitors = competitors == null ? List.of() : List.copyOf(competitors);
    }

    public static CorpusSnapshot empty() {
        return new CorpusSnapshot(List.of(), List.of(), List.of(), List.of(), List.of(), List.of(), List.of());
    }
}
