package com.jreinhal.cafefinder.search.answer;

import com.jreinhal.cafefinder.search.SearchQuery;
import com.jreinhal.cafefinder.search.intent.IntentType;
import com.jreinhal.cafefinder.search.result.FaqResult;
import com.jreinhal.cafefinder.search.result.LopSessionResult;
import com.jreinhal.cafefinder.search.result.PersonResult;
import com.jreinhal.cafefinder.search.result.SearchResultType;
import com.jreinhal.cafefinder.search.result.ToolResult;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Fixed answer templates, one per answer type.
 */
public final class AnswerTemplates {
    static final String NO_LINK = "#";
    private static final DateTimeFormatter SESSION_DATE = DateTimeFormatter.ofPattern("MMMM d, yyyy", Locale.US);

    private AnswerTemplates() {
    }

    public static SynthesizedAnswer person(PersonResult person) {
        List<AnswerAction> actions = List.of(
                new AnswerAction("Start Chat", orNoLink(person.teamsDeepLink()), "message", true),
                new AnswerAction("View Profile", "/profile/" + person.id(), "user", false),
                new AnswerAction("Email", "mailto:" + person.email(), "mail", false));
        return new SynthesizedAnswer(AnswerType.PERSON_CARD, 0.95,
                "Here is the contact information for " + person.name() + ".",
                null, null, actions, List.of(), person);
    }

    public static SynthesizedAnswer tool(SearchQuery query, ToolResult tool) {
        String text = tool.name() + ": " + tool.description();
        List<AnswerAction> actions = new ArrayList<>();
        if (query.intent().primary() == IntentType.TOOL_ACCESS) {
            text = "You can request access to " + tool.name() + " through the Identity Portal.";
            actions.add(new AnswerAction("Request Access", orNoLink(tool.requestUrl()), "key", true));
            if (tool.guideUrl() != null && !tool.guideUrl().isBlank()) {
                actions.add(new AnswerAction("Access Guide", tool.guideUrl(), "book", false));
            }
        }
        else {
            actions.add(new AnswerAction("Launch Tool", orNoLink(tool.accessUrl()), "external-link", true));
            if (ToolResult.UNAVAILABLE.equals(tool.status())) {
                text = tool.name() + " is currently undergoing maintenance.";
            }
        }
        return new SynthesizedAnswer(AnswerType.TOOL_CARD, 0.9, text, null, null, actions, List.of(), tool);
    }

    public static SynthesizedAnswer faq(FaqResult faq) {
        String url = "/support/faq/" + faq.id();
        String text = faq.answerSummary().isBlank() ? faq.answer() : faq.answerSummary();
        return new SynthesizedAnswer(AnswerType.INSTANT_ANSWER, 0.85, text, null, null,
                List.of(new AnswerAction("Read Full FAQ", url, "help-circle", false)),
                List.of(new AnswerSource(faq.question(), url, SearchResultType.FAQ)),
                null);
    }

    public static SynthesizedAnswer concept(FaqResult faq) {
        return new SynthesizedAnswer(AnswerType.CONCEPT_EXPLANATION, 0.9, faq.answer(), null, faq.tags(),
                List.of(),
                List.of(new AnswerSource(faq.question(), "/library/concept/" + faq.id(), SearchResultType.FAQ)),
                null);
    }

    public static SynthesizedAnswer lopSession(SearchQuery query, LopSessionResult session) {
        String text = "Searching for LOP sessions about \"" + query.normalized() + "\".";
        if (query.intent().primary() == IntentType.LOP_NEXT) {
            String when = session.sessionDate() == null ? "a date to be announced" : SESSION_DATE.format(session.sessionDate());
            text = "The next Love of Product session is \"" + session.title() + "\" on " + when + ".";
        }
        List<AnswerAction> actions = List.of(
                new AnswerAction("Watch Recording", orNoLink(session.videoUrl()), "video", true),
                new AnswerAction("View Slides", orNoLink(session.slidesUrl()), "presentation", false));
        return new SynthesizedAnswer(AnswerType.LOP_SESSION, 0.95, text, null, null, actions, List.of(), session);
    }

    public static SynthesizedAnswer zeroResults(SearchQuery query) {
        String topic = URLEncoder.encode(query.raw(), StandardCharsets.UTF_8).replace("+", "%20");
        List<AnswerAction> actions = List.of(
                new AnswerAction("Start a Discussion", "/discuss/new?topic=" + topic, "message-square", true),
                new AnswerAction("Browse Resource Library", "/library", "book-open", false));
        List<String> steps = List.of(
                "Try checking your spelling",
                "Try simpler keywords",
                "Browse by category in the Library");
        return new SynthesizedAnswer(AnswerType.ZERO_RESULTS, 1.0,
                "I couldn't find any exact matches for \"" + query.raw() + "\".",
                steps, null, actions, List.of(), null);
    }

    private static String orNoLink(String url) {
        return url == null || url.isBlank() ? NO_LINK : url;
    }
}
