package com.jreinhal.cafefinder.search.intent;

import static com.jreinhal.cafefinder.search.intent.IntentPattern.keyword;
import static com.jreinhal.cafefinder.search.intent.IntentPattern.phrase;
import static com.jreinhal.cafefinder.search.intent.IntentPattern.regex;

import com.jreinhal.cafefinder.dictionary.DomainVocabulary;
import java.util.ArrayList;
import java.util.List;

/**
 * The fixed, ordered intent catalog. Order breaks score ties, so more specific intents come first
 * where two definitions commonly saturate together (tool access before plain tool lookup).
 */
public final class IntentCatalog {

    public static final List<IntentDefinition> DEFINITIONS = List.of(
            new IntentDefinition(IntentType.FIND_PERSON,
                    List.of(
                            regex("who (?:is|knows|can help)"),
                            regex("contact (?:info|information|details)"),
                            regex("(?:find|reach|talk to|message|email)\\s+(?:someone|person|expert)"),
                            regex("expert (?:in|on|for|about)"),
                            regex("(?:slack|teams|email) (?:for|of)")),
                    List.of("who", "contact", "expert", "person", "email", "slack", "teams", "reach out", "talk to"),
                    ExpectedResultType.ENTITY_CARD, 0.85),
            new IntentDefinition(IntentType.TOOL_ACCESS,
                    List.of(
                            regex("(?:get|request|need|want)\\s+(?:\\w+\\s+)?access"),
                            regex("how (?:do i|to|can i)\\s+(?:get|request)\\s+\\w+"),
                            regex("access (?:to|for)\\s+\\w+"),
                            regex("\\w+\\s+access request"),
                            regex("request\\s+\\w+\\s+(?:access|permission)")),
                    List.of("access", "permission", "request", "login", "account"),
                    ExpectedResultType.ACTIONABLE_ANSWER, 0.90),
            new IntentDefinition(IntentType.FIND_TOOL,
                    toolPatterns(),
                    List.copyOf(DomainVocabulary.TOOLS.keySet()),
                    ExpectedResultType.ENTITY_CARD, 0.90),
            new IntentDefinition(IntentType.FIND_FAQ,
                    List.of(
                            regex("how (?:do|does|can|should|would|to)\\b"),
                            regex("what (?:is|are|does|do)\\b"),
                            regex("when (?:do|does|should|is)\\b"),
                            regex("where (?:do|does|can|is)\\b"),
                            regex("why (?:do|does|is|are)\\b"),
                            regex("\\bcan i\\s+"),
                            regex("\\bis there\\s+")),
                    List.of("how", "what", "when", "where", "why", "faq", "question"),
                    ExpectedResultType.DIRECT_ANSWER, 0.75),
            new IntentDefinition(IntentType.EXPLAIN_CONCEPT,
                    List.of(
                            regex("what is (?:a |an |the )?\\w+"),
                            regex("(?:explain|define|meaning of)\\s+"),
                            regex("what does\\s+\\w+\\s+mean"),
                            phrase("tell me about ")),
                    List.of("what is", "explain", "define", "meaning", "understand", "about"),
                    ExpectedResultType.DIRECT_ANSWER, 0.85),
            new IntentDefinition(IntentType.LEARN_PROCESS,
                    List.of(
                            regex("how does\\s+.+\\s+work"),
                            regex("process (?:for|of)\\s+"),
                            regex("steps (?:for|to)\\s+"),
                            regex("procedure (?:for|to)\\s+")),
                    List.of("process", "steps", "procedure", "workflow", "how does"),
                    ExpectedResultType.DIRECT_ANSWER, 0.80),
            new IntentDefinition(IntentType.COMPARE,
                    List.of(
                            regex("\\w+\\s+(?:vs\\.?|versus|or)\\s+\\w+"),
                            phrase("difference between "),
                            regex("\\bcompare\\s+"),
                            regex("\\w+\\s+compared to\\s+\\w+")),
                    List.of("vs", "versus", "compare", "difference", "between"),
                    ExpectedResultType.DIRECT_ANSWER, 0.85),
            new IntentDefinition(IntentType.FIND_RESOURCE,
                    List.of(
                            regex("(?:find|search|look for|show)\\s+(?:a |the )?\\w+"),
                            regex("\\w+\\s+(?:template|guide|document|doc|checklist)s?\\b")),
                    List.of("find", "search", "document", "template", "guide", "resource", "file"),
                    ExpectedResultType.RESOURCE_LIST, 0.70),
            new IntentDefinition(IntentType.FIND_TEAM,
                    List.of(
                            regex("(?:who|which team)\\s+(?:works on|owns|manages)"),
                            regex("\\w+\\s+team\\b"),
                            regex("team (?:for|of)\\s+")),
                    teamKeywords(),
                    ExpectedResultType.ENTITY_CARD, 0.80),
            new IntentDefinition(IntentType.START_DISCUSSION,
                    List.of(
                            regex("(?:ask|discuss|question about)\\s+"),
                            phrase("i have a question"),
                            phrase("need help with")),
                    List.of("ask", "discuss", "question", "help with"),
                    ExpectedResultType.ACTIONABLE_ANSWER, 0.75),
            new IntentDefinition(IntentType.CONTACT_EXPERT,
                    List.of(
                            regex("talk to (?:someone|expert|person)"),
                            phrase("reach out to"),
                            phrase("who can help")),
                    List.of("talk to", "reach out", "contact", "help", "expert"),
                    ExpectedResultType.ENTITY_CARD, 0.80),
            new IntentDefinition(IntentType.NAVIGATE,
                    List.of(
                            regex("\\bgo to\\s+"),
                            regex("\\bopen\\s+"),
                            phrase("show me "),
                            phrase("take me to ")),
                    List.of("go", "open", "show", "navigate", "take me"),
                    ExpectedResultType.NAVIGATION, 0.85),
            new IntentDefinition(IntentType.LOP_NEXT,
                    List.of(
                            phrase("next lop"),
                            regex("upcoming (?:lop|product talk|session)"),
                            regex("when is (?:the )?(?:next )?lop")),
                    List.of("next lop", "upcoming lop", "when lop"),
                    ExpectedResultType.ENTITY_CARD, 0.90),
            new IntentDefinition(IntentType.LOP_FIND,
                    List.of(
                            regex("lop (?:about|on|for)\\s+"),
                            regex("product talk (?:about|on)\\s+"),
                            regex("session (?:about|on)\\s+")),
                    List.of("lop", "product talk", "session", "presentation"),
                    ExpectedResultType.RESOURCE_LIST, 0.85),
            new IntentDefinition(IntentType.LOP_SPEAKER,
                    List.of(
                            regex("who (?:spoke|presented|talked) (?:about|on)"),
                            regex("\\w+(?:'s| 's) lop"),
                            regex("lop by\\s+\\w+")),
                    List.of("spoke", "presented", "speaker", "by"),
                    ExpectedResultType.ENTITY_CARD, 0.80),
            new IntentDefinition(IntentType.BROWSE,
                    List.of(regex("(?:all|list|browse|show)\\s+(?:the )?\\w+s?\\b")),
                    List.of("all", "list", "browse", "show"),
                    ExpectedResultType.RESOURCE_LIST, 0.70),
            new IntentDefinition(IntentType.RECENT,
                    List.of(
                            regex("(?:recent|new|latest|fresh)\\s+"),
                            phrase("what's new")),
                    List.of("recent", "new", "latest", "fresh"),
                    ExpectedResultType.RESOURCE_LIST, 0.75),
            new IntentDefinition(IntentType.POPULAR,
                    List.of(regex("(?:popular|top|trending|most used)\\s+")),
                    List.of("popular", "top", "trending", "most used", "best"),
                    ExpectedResultType.RESOURCE_LIST, 0.75));

    private IntentCatalog() {
    }

    /**
     * Navigation phrasing plus a bare mention of any known tool.
     */
    private static List<IntentPattern> toolPatterns() {
        List<IntentPattern> patterns = new ArrayList<>();
        patterns.add(regex("(?:where is|open|launch|go to)\\s+\\w+"));
        patterns.add(regex("link to\\s+\\w+"));
        DomainVocabulary.TOOLS.keySet().forEach(tool -> patterns.add(keyword(tool)));
        return patterns;
    }

    private static List<String> teamKeywords() {
        List<String> keywords = new ArrayList<>(DomainVocabulary.TEAMS.keySet());
        keywords.addAll(List.of("team", "group", "department"));
        return keywords;
    }
}
