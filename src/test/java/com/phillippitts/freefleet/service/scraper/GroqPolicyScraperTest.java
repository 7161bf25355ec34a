package com.phillippitts.freefleet.service.scraper;

import com.phillippitts.freefleet.domain.ScrapedPolicy;
import com.phillippitts.freefleet.service.persistence.AuditEvent;
import com.phillippitts.freefleet.service.persistence.AuditLog;
import com.phillippitts.freefleet.service.persistence.JsonFileStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class GroqPolicyScraperTest {

    @TempDir
    Path tempDir;

    private AuditLog auditLog;
    private MockRestServiceServer server;
    private GroqPolicyScraper scraper;

    @BeforeEach
    void setUp() {
        auditLog = new AuditLog(new JsonFileStore(tempDir));
        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        scraper = new GroqPolicyScraper(builder.build(), auditLog);
    }

    @Test
    void shouldExtractFamilyModelsFromPricingPage() {
        ScrapedPolicy policy = scraper.parse("""
                <h2>Free tier</h2><p>Start for $0 with rate limits.</p>
                <td>llama3-70b-8192</td><td>mixtral-8x7b-32768</td>
                <td>gemma2-9b-it</td><td>whisper-large-v3</td><td>llama3-70b-8192</td>
                """);

        assertThat(policy.providerId()).isEqualTo("groq");
        assertThat(policy.freeTierActive()).isTrue();
        assertThat(policy.freeModels()).containsExactly("llama3-70b-8192", "mixtral-8x7b-32768", "gemma2-9b-it");
    }

    @Test
    void shouldReportInactiveTierWithoutZeroPrice() {
        ScrapedPolicy policy = scraper.parse("Free trial available. llama3-8b-8192 costs 0.05 USD per million tokens");

        assertThat(policy.freeTierActive()).isFalse();
        assertThat(policy.freeModels()).containsExactly("llama3-8b-8192");
    }

    @Test
    void shouldFetchLivePage() {
        server.expect(requestTo(GroqPolicyScraper.POLICY_URL))
                .andRespond(withSuccess("Free: $0 for gemma2-9b-it", MediaType.TEXT_HTML));

        ScrapedPolicy policy = scraper.scrape();

        server.verify();
        assertThat(policy.confirmsFree("gemma2-9b-it")).isTrue();
    }

    @Test
    void shouldFallBackAndAuditWhenPageUnavailable() {
        server.expect(requestTo(GroqPolicyScraper.POLICY_URL)).andRespond(withServerError());

        ScrapedPolicy policy = scraper.scrape();

        assertThat(policy.freeTierActive()).isTrue();
        assertThat(policy.freeModels()).isEqualTo(GroqPolicyScraper.FALLBACK_MODELS);
        assertThat(auditLog.recent(AuditEvent.Type.SCRAPER_FAILED, 10))
                .singleElement()
                .satisfies(e -> assertThat(e.details()).containsEntry("providerId", "groq"));
    }
}
