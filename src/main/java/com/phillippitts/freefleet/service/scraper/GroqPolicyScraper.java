package com.phillippitts.freefleet.service.scraper;

import com.phillippitts.freefleet.domain.ScrapedPolicy;
import com.phillippitts.freefleet.service.persistence.AuditLog;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads Groq's pricing page. The free tier counts as active when the page mentions
 * "free" together with a zero price; model ids are the hyphenated tokens naming a
 * llama, mixtral or gemma family.
 */
@Component
public class GroqPolicyScraper extends AbstractPolicyScraper {

    static final String POLICY_URL = "https://groq.com/pricing/";
    static final List<String> FALLBACK_MODELS = List.of(
            "llama-3.3-70b-versatile", "llama-3.1-8b-instant", "mixtral-8x7b-32768", "gemma2-9b-it");

    private static final Pattern MODEL_TOKEN = Pattern.compile("[\\w-]+-[\\w-]+-[\\w-]+");
    private static final List<String> FAMILIES = List.of("llama", "mixtral", "gemma");

    private final RestClient restClient;

    @Autowired
    public GroqPolicyScraper(RestClient.Builder restClientBuilder, AuditLog auditLog) {
        this(restClientBuilder.build(), auditLog);
    }

    GroqPolicyScraper(RestClient restClient, AuditLog auditLog) {
        super("groq", POLICY_URL, auditLog);
        this.restClient = restClient;
    }

    @Override
    protected ScrapedPolicy doScrape() {
        String page = restClient.get().uri(policyUrl()).retrieve().body(String.class);
        return parse(page == null ? "" : page);
    }

    ScrapedPolicy parse(String page) {
        boolean active = page.toLowerCase(Locale.ROOT).contains("free")
                && (page.contains("$0") || page.contains("0/mo"));

        Set<String> models = new LinkedHashSet<>();
        Matcher m = MODEL_TOKEN.matcher(page);
        while (m.find()) {
            String token = m.group().toLowerCase(Locale.ROOT);
            if (FAMILIES.stream().anyMatch(token::contains)) {
                models.add(token);
            }
        }
        return new ScrapedPolicy(providerId(), Instant.now(), active, List.copyOf(models));
    }

    @Override
    protected List<String> fallbackFreeModels() {
        return FALLBACK_MODELS;
    }
}
