package com.jreinhal.cafefinder.corpus;

import com.jreinhal.cafefinder.model.Competitor;
import com.jreinhal.cafefinder.model.Discussion;
import com.jreinhal.cafefinder.model.Faq;
import com.jreinhal.cafefinder.model.LopSession;
import com.jreinhal.cafefinder.model.Person;
import com.jreinhal.cafefinder.model.PulseSignal;
import com.jreinhal.cafefinder.model.Resource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Pulls every corpus category into one consistent snapshot.
 */
@Component
public class CorpusCatalog {
    private static final Logger log = LoggerFactory.getLogger(CorpusCatalog.class);

    private final CorpusProvider<Person> people;
    private final CorpusProvider<Resource> resources;
    private final CorpusProvider<Faq> faqs;
    private final CorpusProvider<Discussion> discussions;
    private final CorpusProvider<LopSession> lopSessions;
    private final CorpusProvider<PulseSignal> pulseSignals;
    private final CorpusProvider<Competitor> competitors;

    public CorpusCatalog(CorpusProvider<Person> people,
                         CorpusProvider<Resource> resources,
                         CorpusProvider<Faq> faqs,
                         CorpusProvider<Discussion> discussions,
                         CorpusProvider<LopSession> lopSessions,
                         CorpusProvider<PulseSignal> pulseSignals,
                         CorpusProvider<Competitor> competitors) {
        this.people = people;
        this.resources = resources;
        this.faqs = faqs;
        this.discussions = discussions;
        this.lopSessions = lopSessions;
        this.pulseSignals = pulseSignals;
        this.competitors = competitors;
    }

    public CorpusSnapshot snapshot() {
        CorpusSnapshot snapshot = new CorpusSnapshot(
                this.people.listCurrent(),
                this.resources.listCurrent(),
                this.faqs.listCurrent(),
                this.discussions.listCurrent(),
                this.lopSessions.listCurrent(),
                this.pulseSignals.listCurrent(),
                this.competitors.listCurrent());
        log.info("Corpus snapshot: {} people, {} resources, {} faqs, {} discussions, {} lop sessions, {} signals, {} competitors",
                snapshot.people().size(), snapshot.resources().size(), snapshot.faqs().size(),
                snapshot.discussions().size(), snapshot.lopSessions().size(), snapshot.pulseSignals().size(),
                snapshot.competitors().size());
        return snapshot;
    }
}
