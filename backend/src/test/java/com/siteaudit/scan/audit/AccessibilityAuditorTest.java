package com.siteaudit.scan.audit;

import com.siteaudit.scan.model.AccessibilityEvidence;
import com.siteaudit.scan.model.AccessibilityEvidence.AccessibilityViolation;
import com.siteaudit.scan.model.PillarResult;
import org.jsoup.Jsoup;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class AccessibilityAuditorTest {

    @Test
    void cleanPageScoresFull() {
        PillarResult result = AccessibilityAuditor.evaluate(Jsoup.parse("""
            <html lang="en"><head><title>Home</title></head>
            <body>
              <a href="/rooms">Rooms</a>
              <img src="/hero.jpg" alt="Lobby">
              <label for="email">Email</label><input id="email" type="email">
              <button>Subscribe</button>
            </body></html>
            """));

        assertThat(result.score()).isEqualTo(100);
        assertThat(result.error()).isFalse();
        assertThat(((AccessibilityEvidence) result.evidence()).violations()).isEmpty();
    }

    @Test
    void passRateIsReducedBySeverityPenalties() {
        PillarResult result = AccessibilityAuditor.evaluate(Jsoup.parse("""
            <html><head><title>Home</title></head>
            <body>
              <img src="/a.jpg"><img src="/b.jpg"><img src="/c.jpg" alt="C">
            </body></html>
            """));

        AccessibilityEvidence evidence = (AccessibilityEvidence) result.evidence();
        assertThat(evidence.violations()).extracting(AccessibilityViolation::id)
            .containsExactly("html-has-lang", "image-alt");
        assertThat(evidence.passes()).isEqualTo(1);
        assertThat(evidence.criticalViolations()).isEqualTo(2);
        // 1 of 3 rules pass (33), minus 3 for the serious node and 10 for two critical nodes
        assertThat(result.score()).isEqualTo(20);
    }

    @Test
    void scoreFloorsAtTenWhileAnyRulePasses() {
        StringBuilder images = new StringBuilder();
        for (int i = 0; i < 30; i++) {
            images.append("<img src=\"/").append(i).append(".jpg\">");
        }
        PillarResult result = AccessibilityAuditor.evaluate(Jsoup.parse(
            "<html lang=\"en\"><head><title>Gallery</title></head><body>" + images + "</body></html>"
        ));

        assertThat(result.score()).isEqualTo(10);
    }

    @Test
    void detectsUnlabelledControlsAndZoomBlocking() {
        PillarResult result = AccessibilityAuditor.evaluate(Jsoup.parse("""
            <html lang="en"><head>
              <title>Book</title>
              <meta name="viewport" content="width=device-width, user-scalable=no">
            </head>
            <body>
              <input type="text" name="guest">
              <label>Nights <input type="number" name="nights"></label>
              <input type="hidden" name="token">
              <button></button>
              <a href="/next"></a>
            </body></html>
            """));

        AccessibilityEvidence evidence = (AccessibilityEvidence) result.evidence();
        assertThat(evidence.violations()).extracting(AccessibilityViolation::id)
            .containsExactly("label", "button-name", "link-name", "meta-viewport");
        assertThat(evidence.violations()).filteredOn(v -> v.id().equals("label"))
            .extracting(AccessibilityViolation::nodes).containsExactly(1);
        assertThat(evidence.findings()).hasSize(4);
    }
}
