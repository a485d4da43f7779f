package com.siteaudit.scan.audit;

import com.siteaudit.scan.http.PoliteHttpClient;
import com.siteaudit.scan.model.AccessibilityEvidence;
import com.siteaudit.scan.model.AccessibilityEvidence.AccessibilityViolation;
import com.siteaudit.scan.model.AccessibilityEvidence.Severity;
import com.siteaudit.scan.model.HttpFetchResult;
import com.siteaudit.scan.model.Pillar;
import com.siteaudit.scan.model.PillarResult;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Static markup checks over the served HTML. Scoring starts from the pass rate of applicable
 * rules and subtracts per-node penalties by severity.
 */
@Component
public class AccessibilityAuditor implements PageAuditor {
    private static final Logger log = LoggerFactory.getLogger(AccessibilityAuditor.class);
    private static final Set<String> UNLABELLED_INPUT_TYPES = Set.of("hidden", "submit", "button", "image", "reset");

    private final PoliteHttpClient httpClient;

    public AccessibilityAuditor(PoliteHttpClient httpClient) {
        this.httpClient = httpClient;
    }

    @Override
    public Pillar pillar() {
        return Pillar.ACCESSIBILITY;
    }

    @Override
    public PillarResult audit(String url) {
        HttpFetchResult fetch = httpClient.get(url, PoliteHttpClient.HTML_ACCEPT);
        if (!fetch.isSuccessful() || fetch.body() == null) {
            log.debug("accessibility fetch failed url={} status={} errorCode={}", url, fetch.statusCode(), fetch.errorCode());
            return PillarResult.failed("page fetch failed: " + fetch.failureReason());
        }
        return evaluate(Jsoup.parse(fetch.body(), fetch.finalUrlOrRequested()));
    }

    static PillarResult evaluate(Document doc) {
        List<AccessibilityViolation> violations = new ArrayList<>();
        int passes = 0;

        List<RuleOutcome> outcomes = List.of(
            check("html-has-lang", Severity.SERIOUS, "<html> element must have a lang attribute",
                true, doc.select("html").attr("lang").isBlank() ? 1 : 0),
            check("document-title", Severity.SERIOUS, "Documents must have a <title> element",
                true, doc.title().isBlank() ? 1 : 0),
            check("image-alt", Severity.CRITICAL, "Images must have alternate text",
                !doc.select("img").isEmpty(), doc.select("img:not([alt])").size()),
            check("label", Severity.CRITICAL, "Form elements must have labels",
                !formControls(doc).isEmpty(), countUnlabelled(doc)),
            check("button-name", Severity.CRITICAL, "Buttons must have discernible text",
                !doc.select("button, input[type=submit], input[type=button]").isEmpty(), countUnnamedButtons(doc)),
            check("link-name", Severity.SERIOUS, "Links must have discernible text",
                !doc.select("a[href]").isEmpty(), countUnnamedLinks(doc)),
            check("frame-title", Severity.SERIOUS, "Frames must have a title attribute",
                !doc.select("iframe").isEmpty(), doc.select("iframe:not([title]), iframe[title=\"\"]").size()),
            check("meta-viewport", Severity.MODERATE, "Zooming and scaling must not be disabled",
                !doc.select("meta[name=viewport]").isEmpty(), countZoomBlocking(doc))
        );

        for (RuleOutcome outcome : outcomes) {
            if (!outcome.applicable()) {
                continue;
            }
            if (outcome.failingNodes() == 0) {
                passes++;
            } else {
                violations.add(new AccessibilityViolation(
                    outcome.id(), outcome.severity(), outcome.description(), outcome.failingNodes()
                ));
            }
        }

        int criticalNodes = 0;
        int penalty = 0;
        for (AccessibilityViolation violation : violations) {
            switch (violation.impact()) {
                case CRITICAL -> {
                    criticalNodes += violation.nodes();
                    penalty += violation.nodes() * 5;
                }
                case SERIOUS -> penalty += violation.nodes() * 3;
                case MODERATE, MINOR -> penalty += violation.nodes();
            }
        }
        int totalChecks = passes + violations.size();
        int score = totalChecks > 0 ? (int) Math.round(passes * 100.0 / totalChecks) : 100;
        score = Math.max(score - penalty, passes > 0 ? 10 : 0);
        return PillarResult.of(score, new AccessibilityEvidence(violations, passes, criticalNodes));
    }

    private static RuleOutcome check(String id, Severity severity, String description, boolean applicable, int failingNodes) {
        return new RuleOutcome(id, severity, description, applicable, failingNodes);
    }

    private static Elements formControls(Document doc) {
        Elements controls = new Elements();
        for (Element element : doc.select("input, select, textarea")) {
            String type = element.attr("type").toLowerCase(Locale.ROOT);
            if (!element.tagName().equals("input") || !UNLABELLED_INPUT_TYPES.contains(type)) {
                controls.add(element);
            }
        }
        return controls;
    }

    private static int countUnlabelled(Document doc) {
        int count = 0;
        for (Element control : formControls(doc)) {
            boolean labelled = hasAccessibleNameAttribute(control)
                || control.closest("label") != null
                || (!control.id().isBlank() && !doc.select("label[for=" + cssEscape(control.id()) + "]").isEmpty());
            if (!labelled) {
                count++;
            }
        }
        return count;
    }

    private static int countUnnamedButtons(Document doc) {
        int count = 0;
        for (Element button : doc.select("button")) {
            if (button.text().isBlank() && !hasAccessibleNameAttribute(button) && button.select("img[alt]:not([alt=\"\"])").isEmpty()) {
                count++;
            }
        }
        for (Element input : doc.select("input[type=submit], input[type=button]")) {
            if (input.attr("value").isBlank() && !hasAccessibleNameAttribute(input)) {
                count++;
            }
        }
        return count;
    }

    private static int countUnnamedLinks(Document doc) {
        int count = 0;
        for (Element link : doc.select("a[href]")) {
            if (link.text().isBlank()
                && !hasAccessibleNameAttribute(link)
                && link.select("img[alt]:not([alt=\"\"])").isEmpty()) {
                count++;
            }
        }
        return count;
    }

    private static int countZoomBlocking(Document doc) {
        String content = doc.select("meta[name=viewport]").attr("content").toLowerCase(Locale.ROOT).replace(" ", "");
        return content.contains("user-scalable=no") || content.contains("maximum-scale=1.0") || content.contains("maximum-scale=1,")
            || content.endsWith("maximum-scale=1") ? 1 : 0;
    }

    private static boolean hasAccessibleNameAttribute(Element element) {
        return !element.attr("aria-label").isBlank()
            || !element.attr("aria-labelledby").isBlank()
            || !element.attr("title").isBlank();
    }

    private static String cssEscape(String id) {
        return "\"" + id.replace("\"", "\\\"") + "\"";
    }

    private record RuleOutcome(String id, Severity severity, String description, boolean applicable, int failingNodes) {
    }
}
