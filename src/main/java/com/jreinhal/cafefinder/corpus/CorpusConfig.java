package com.jreinhal.cafefinder.corpus;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.jreinhal.cafefinder.model.Competitor;
import com.jreinhal.cafefinder.model.Discussion;
import com.jreinhal.cafefinder.model.Faq;
import com.jreinhal.cafefinder.model.LopSession;
import com.jreinhal.cafefinder.model.Person;
import com.jreinhal.cafefinder.model.PulseSignal;
import com.jreinhal.cafefinder.model.Resource;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;

/**
 * JSON-file corpus providers under {@code cafefinder.corpus.location}.
 */
@Configuration
public class CorpusConfig {

    private final ResourceLoader resourceLoader;
    private final ObjectMapper objectMapper;
    private final String baseLocation;

    public CorpusConfig(ResourceLoader resourceLoader, ObjectMapper objectMapper,
                        @Value("${cafefinder.corpus.location:classpath:corpus/}") String baseLocation) {
        this.resourceLoader = resourceLoader;
        this.objectMapper = objectMapper;
        this.baseLocation = baseLocation.endsWith("/") ? baseLocation : baseLocation + "/";
    }

    @Bean
    public CorpusProvider<Person> peopleCorpus() {
        return this.json("people.json", Person.class);
    }

    @Bean
    public CorpusProvider<Resource> resourceCorpus() {
        return this.json("resources.json", Resource.class);
    }

    @Bean
    public CorpusProvider<Faq> faqCorpus() {
        return this.json("faqs.json", Faq.class);
    }

    @Bean
    public CorpusProvider<Discussion> discussionCorpus() {
        return this.json("discussions.json", Discussion.class);
    }

    @Bean
    public CorpusProvider<LopSession> lopSessionCorpus() {
        return this.json("lop-sessions.json", LopSession.class);
    }

    @Bean
    public CorpusProvider<PulseSignal> pulseSignalCorpus() {
        return this.json("pulse-signals.json", PulseSignal.class);
    }

    @Bean
    public CorpusProvider<Competitor> competitorCorpus() {
        return this.json("competitors.json", Competitor.class);
    }

    private <T> JsonCorpusProvider<T> json(String file, Class<T> type) {
        return new JsonCorpusProvider<>(this.resourceLoader, this.baseLocation + file, this.objectMapper, type);
    }
}
