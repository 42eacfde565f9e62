package com.jreinhal.cafefinder.dictionary;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Canonical concepts of the Café knowledge hub and their aliases.
 *
 * <p>Tables are insertion ordered. Iteration order matters: entity extraction scans
 * them in declaration order and the merged synonym view lets later tables replace a
 * canonical key declared by an earlier one.</p>
 */
public final class DomainVocabulary {

    public static final Map<String, List<String>> TOOLS = ordered(
            "jira", List.of("atlassian", "issue tracker", "ticket system", "bug tracker", "issue management"),
            "confluence", List.of("atlassian", "wiki", "documentation", "docs", "knowledge base"),
            "smartsheet", List.of("spreadsheet", "project tracker", "timeline", "gantt"),
            "slack", List.of("messaging", "chat", "im", "instant message"),
            "teams", List.of("microsoft teams", "ms teams", "video call", "meeting"),
            "outlook", List.of("email", "mail", "calendar", "microsoft outlook"),
            "sharepoint", List.of("microsoft sharepoint", "file storage", "document library"),
            "figma", List.of("design", "prototype", "mockup", "ui design", "wireframe"),
            "miro", List.of("whiteboard", "brainstorm", "diagram", "flowchart"),
            "notion", List.of("notes", "wiki", "documentation", "workspace"),
            "github", List.of("git", "code", "repository", "repo", "source control", "version control"),
            "azure", List.of("azure devops", "ado", "microsoft azure", "cloud"),
            "servicenow", List.of("itsm", "it service", "service desk", "snow"));

    public static final Map<String, List<String>> TOPICS = ordered(
            "cob", List.of("coordination of benefits", "coordination", "multiple coverage", "dual coverage"),
            "rcm", List.of("revenue cycle management", "revenue cycle", "billing", "collections"),
            "claims", List.of("claim processing", "claim adjudication", "claims management"),
            "eligibility", List.of("member eligibility", "coverage verification", "enrollment"),
            "enrollment", List.of("member enrollment", "signup", "registration", "onboarding"),
            "compliance", List.of("regulatory", "regulation", "audit", "hipaa", "cms"),
            "hipaa", List.of("privacy", "security", "phi", "protected health information"),
            "medicare", List.of("cms", "government program", "senior", "part a", "part b", "part d"),
            "medicaid", List.of("state program", "magi", "low income"),
            "subrogation", List.of("recovery", "third party liability", "tpl", "accident"),
            "eob", List.of("explanation of benefits", "benefit explanation", "member statement"),
            "era", List.of("electronic remittance advice", "remittance", "835"),
            "edi", List.of("electronic data interchange", "837", "270", "271", "x12"),
            "npi", List.of("national provider identifier", "provider id", "provider number"),
            "prd", List.of("product requirements", "product spec", "requirements document", "spec"),
            "okr", List.of("objectives key results", "objectives", "goals", "kpi"),
            "lop", List.of("love of product", "product talk", "presentation", "session"));

    public static final Map<String, List<String>> ACTIONS = ordered(
            "access", List.of("get access", "permission", "login", "account", "request access"),
            "request", List.of("submit", "apply", "ask for", "get"),
            "find", List.of("search", "look for", "locate", "discover", "where is"),
            "learn", List.of("understand", "study", "know about", "read about"),
            "contact", List.of("reach out", "message", "email", "talk to", "connect with"),
            "help", List.of("assist", "support", "guidance", "how to"),
            "create", List.of("make", "new", "add", "start", "build"),
            "update", List.of("edit", "modify", "change", "revise"),
            "delete", List.of("remove", "cancel", "revoke"),
            "approve", List.of("accept", "sign off", "confirm", "authorize"),
            "review", List.of("check", "look at", "examine", "assess"));

    public static final Map<String, List<String>> RESOURCE_TYPES = ordered(
            "template", List.of("boilerplate", "starter", "example", "sample"),
            "guide", List.of("how to", "tutorial", "walkthrough", "instructions", "documentation"),
            "faq", List.of("frequently asked", "common questions", "q&a", "questions"),
            "video", List.of("recording", "watch", "tutorial video", "demo"),
            "presentation", List.of("slides", "deck", "ppt", "powerpoint", "keynote"),
            "document", List.of("doc", "file", "paper", "article"),
            "checklist", List.of("list", "steps", "procedure", "process"),
            "playbook", List.of("runbook", "handbook", "manual", "guide"));

    public static final Map<String, List<String>> TEAMS = ordered(
            "platform", List.of("platform team", "infrastructure", "core platform", "engineering"),
            "rcm", List.of("revenue cycle", "rcm team", "billing team"),
            "analytics", List.of("data", "data team", "bi", "business intelligence", "reporting"),
            "product", List.of("product team", "pm", "product management"),
            "design", List.of("ux", "ui", "design team", "user experience"),
            "engineering", List.of("development", "dev", "developers", "software"),
            "it", List.of("information technology", "tech support", "helpdesk", "it support"),
            "hr", List.of("human resources", "people team", "people ops"),
            "legal", List.of("compliance", "legal team", "counsel"));

    /** Surface keyword to canonical resource type. */
    public static final Map<String, String> RESOURCE_TYPE_KEYWORDS = keywords(
            "template", "template", "templates", "template",
            "guide", "guide", "guides", "guide",
            "document", "document", "documents", "document", "doc", "document", "docs", "document",
            "faq", "faq", "faqs", "faq",
            "video", "video", "videos", "video",
            "presentation", "presentation", "presentations", "presentation",
            "slides", "presentation", "deck", "presentation",
            "checklist", "checklist", "checklists", "checklist",
            "playbook", "playbook", "playbooks", "playbook", "runbook", "playbook");

    public static final Map<String, String> ACTION_KEYWORDS = keywords(
            "access", "access", "request", "request",
            "find", "find", "search", "find", "get", "get",
            "learn", "learn", "understand", "learn",
            "contact", "contact", "message", "contact", "email", "contact",
            "create", "create", "new", "create", "add", "create",
            "update", "update", "edit", "update", "modify", "update",
            "delete", "delete", "remove", "delete",
            "approve", "approve", "review", "review");

    public static final Map<String, String> PILLAR_KEYWORDS = keywords(
            "product craft", "product-craft", "product-craft", "product-craft", "craft", "product-craft",
            "healthcare", "healthcare-domain", "healthcare domain", "healthcare-domain",
            "healthcare-domain", "healthcare-domain", "domain", "healthcare-domain",
            "playbook", "internal-playbook", "internal playbook", "internal-playbook",
            "internal-playbook", "internal-playbook", "internal", "internal-playbook");

    private DomainVocabulary() {
    }

    private static Map<String, List<String>> ordered(Object... pairs) {
        Map<String, List<String>> map = new LinkedHashMap<>();
        for (int i = 0; i < pairs.length; i += 2) {
            @SuppressWarnings("unchecked")
            List<String> aliases = (List<String>) pairs[i + 1];
            map.put((String) pairs[i], aliases);
        }
        return Collections.unmodifiableMap(map);
    }

    private static Map<String, String> keywords(String... pairs) {
        Map<String, String> map = new LinkedHashMap<>();
        for (int i = 0; i < pairs.length; i += 2) {
            map.put(pairs[i], pairs[i + 1]);
        }
        return Collections.unmodifiableMap(map);
    }
}
