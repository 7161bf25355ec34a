package com.phillippitts.freefleet.service.oracle;

import com.phillippitts.freefleet.exception.ProviderFetchException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class CommunityAllowListClientTest {

    private static final String URL = "https://raw.example/free-models.json";

    private MockRestServiceServer server;
    private CommunityAllowListClient client;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        client = new CommunityAllowListClient(builder.build(), URL);
    }

    @Test
    void shouldParseDefinitions() {
        server.expect(requestTo(URL)).andRespond(withSuccess("""
                {"version": "3", "lastUpdated": "2026-09-30", "models": ["groq/a", "", "openrouter/b:free"]}
                """, MediaType.APPLICATION_JSON));

        CommunityDefinitions definitions = client.fetch();

        assertThat(definitions.version()).isEqualTo("3");
        assertThat(definitions.models()).containsExactly("groq/a", "openrouter/b:free");
    }

    @Test
    void shouldRejectDocumentWithoutModelsArray() {
        server.expect(requestTo(URL)).andRespond(withSuccess("{\"version\": \"3\"}", MediaType.APPLICATION_JSON));

        assertThatThrownBy(client::fetch)
                .isInstanceOf(ProviderFetchException.class)
                .hasMessageContaining("expected models array");
    }

    @Test
    void shouldWrapHttpErrors() {
        server.expect(requestTo(URL)).andRespond(withStatus(HttpStatus.NOT_FOUND));

        assertThatThrownBy(client::fetch).isInstanceOf(ProviderFetchException.class);
    }
}
