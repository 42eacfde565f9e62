package com.jreinhal.cafefinder.search.index;

import com.jreinhal.cafefinder.model.Competitor;
import com.jreinhal.cafefinder.model.Discussion;
import com.jreinhal.cafefinder.model.Faq;
import com.jreinhal.cafefinder.model.LopSession;
import com.jreinhal.cafefinder.model.Person;
import com.jreinhal.cafefinder.model.PulseSignal;
import com.jreinhal.cafefinder.model.Resource;
import java.util.List;

/**
 * Field weights and match thresholds per corpus category.
 */
public final class IndexProfiles {

    public static final IndexOptions<Person> PEOPLE = new IndexOptions<>(List.of(
            IndexField.text("displayName", 3, Person::displayName),
            IndexField.text("email", 1, Person::email),
            IndexField.text("title", 2, Person::title),
            IndexField.text("team", 1.5, Person::team),
            IndexField.list("expertiseAreas", 2.5, Person::expertiseAreas),
            IndexField.text("location", 0.5, Person::location)), 0.4);

    public static final IndexOptions<Resource> RESOURCES = new IndexOptions<>(List.of(
            IndexField.text("title", 3, Resource::title),
            IndexField.text("description", 2, Resource::description),
            IndexField.text("pillar", 1, Resource::pillar),
            IndexField.text("category", 1.5, Resource::category),
            IndexField.list("tags", 2, Resource::tags)), 0.4);

    public static final IndexOptions<Faq> FAQS = new IndexOptions<>(List.of(
            IndexField.text("question", 4, Faq::question),
            IndexField.list("alternateQuestions", 3, Faq::alternateQuestions),
            IndexField.text("answerSummary", 2, Faq::answerSummary),
            IndexField.text("category", 1, Faq::category),
            IndexField.list("tags", 2, Faq::tags)), 0.3);

    public static final IndexOptions<Discussion> DISCUSSIONS = new IndexOptions<>(List.of(
            IndexField.text("title", 3, Discussion::title),
            IndexField.text("body", 2, Discussion::body),
            IndexField.text("authorName", 1, Discussion::authorName)), 0.4);

    public static final IndexOptions<LopSession> LOP_SESSIONS = new IndexOptions<>(List.of(
            IndexField.text("title", 4, LopSession::title),
            IndexField.text("description", 2, LopSession::description),
            IndexField.list("tags", 3, LopSession::tags)), 0.4);

    public static final IndexOptions<PulseSignal> PULSE_SIGNALS = new IndexOptions<>(List.of(
            IndexField.text("title", 4, PulseSignal::title),
            IndexField.text("summary", 3, PulseSignal::summary),
            IndexField.list("companies", 2.5, PulseSignal::companies),
            IndexField.list("topics", 2, PulseSignal::topics),
            IndexField.text("domain", 1, PulseSignal::domain)), 0.35);

    public static final IndexOptions<Competitor> COMPETITORS = new IndexOptions<>(List.of(
            IndexField.text("name", 4, Competitor::name),
            IndexField.text("category", 2, Competitor::category),
            IndexField.text("description", 2, Competitor::description),
            IndexField.list("markets", 1.5, Competitor::markets)), 0.3);

    public static final IndexOptions<Resource> TOOLS = new IndexOptions<>(List.of(
            IndexField.text("title", 3, Resource::title),
            IndexField.text("description", 2, Resource::description),
            IndexField.list("tags", 2, Resource::tags)), 0.3);

    private IndexProfiles() {
    }
}
