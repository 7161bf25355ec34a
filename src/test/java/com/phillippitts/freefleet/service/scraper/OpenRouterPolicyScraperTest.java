package com.phillippitts.freefleet.service.scraper;

import com.phillippitts.freefleet.domain.ScrapedPolicy;
import com.phillippitts.freefleet.service.persistence.AuditLog;
import com.phillippitts.freefleet.service.persistence.JsonFileStore;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class OpenRouterPolicyScraperTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldListModelsPricedAtZero() {
        RestClient.Builder builder = RestClient.builder();
        MockRestServiceServer server = MockRestServiceServer.bindTo(builder).build();
        OpenRouterPolicyScraper scraper =
                new OpenRouterPolicyScraper(builder.build(), new AuditLog(new JsonFileStore(tempDir)));
        server.expect(requestTo(OpenRouterPolicyScraper.CATALOG_URL)).andRespond(withSuccess("""
                {"data": [
                  {"id": "qwen/qwen3-coder:free", "pricing": {"prompt": "0", "completion": "0"}},
                  {"id": "openai/gpt-4o", "pricing": {"prompt": "0.0000025", "completion": "0.00001"}},
                  {"id": "half/free", "pricing": {"prompt": "0", "completion": "0.1"}}
                ]}
                """, MediaType.APPLICATION_JSON));

        ScrapedPolicy policy = scraper.scrape();

        assertThat(policy.freeTierActive()).isTrue();
        assertThat(policy.freeModels()).containsExactly("qwen/qwen3-coder:free");
    }

    @Test
    void shouldFallBackOnMalformedCatalog() {
        RestClient.Builder builder = RestClient.builder();
        MockRestServiceServer server = MockRestServiceServer.bindTo(builder).build();
        AuditLog auditLog = new AuditLog(new JsonFileStore(tempDir));
        OpenRouterPolicyScraper scraper = new OpenRouterPolicyScraper(builder.build(), auditLog);
        server.expect(requestTo(OpenRouterPolicyScraper.CATALOG_URL))
                .andRespond(withSuccess("{\"unexpected\": true}", MediaType.APPLICATION_JSON));

        ScrapedPolicy policy = scraper.scrape();

        assertThat(policy.freeModels()).isEqualTo(OpenRouterPolicyScraper.FALLBACK_MODELS);
        assertThat(auditLog.recent(null, 5)).hasSize(1);
    }
}
