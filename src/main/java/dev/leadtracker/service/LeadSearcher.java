package dev.leadtracker.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.leadtracker.ai.Completion;
import dev.leadtracker.ai.JsonExtractor;
import dev.leadtracker.ai.TextCompletionClient;
import dev.leadtracker.entity.SearchQuery;
import dev.leadtracker.model.Lead;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs one search query through the text-completion client and parses the leads.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LeadSearcher {

    private static final List<String> REQUIRED_FIELDS = List.of("company", "title", "link");
    private static final List<String> SEARCH_TOOLS =
            List.of(TextCompletionClient.WEB_SEARCH, TextCompletionClient.WEB_FETCH);

    private final TextCompletionClient completionClient;
    private final ObjectMapper objectMapper;

    /**
     * Leads found by one query, and whether the search itself failed.
     */
    public record SearchOutcome(List<Lead> leads, boolean failed) {

        static SearchOutcome failure() {
            return new SearchOutcome(List.of(), true);
        }
    }

    /**
     * Search for one query. Never errors: a failed call or an unparsable answer is a
     * failed outcome with no leads.
     */
    public Mono<SearchOutcome> search(SearchQuery query, Duration timeout) {
        return completionClient.complete(IngestionPrompts.search(query.getQueryText()), timeout, SEARCH_TOOLS)
                .map(completion -> parse(query, completion))
                .onErrorResume(e -> {
                    log.warn("Search failed for query {}: {}", query.getQueryId(), e.getMessage());
                    return Mono.just(SearchOutcome.failure());
                });
    }

    SearchOutcome parse(SearchQuery query, Completion completion) {
        if (!completion.success()) {
            log.warn("Search failed for query {}: {}", query.getQueryId(), completion.text());
            return SearchOutcome.failure();
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(JsonExtractor.array(completion.text()).orElse(""));
        } catch (JsonProcessingException e) {
            log.warn("Could not parse search answer for query {} as JSON", query.getQueryId());
            return SearchOutcome.failure();
        }
        if (root == null || !root.isArray()) {
            log.warn("Search answer for query {} holds no JSON array", query.getQueryId());
            return SearchOutcome.failure();
        }

        List<Lead> leads = new ArrayList<>();
        for (JsonNode node : root) {
            if (!hasRequiredFields(node)) {
                log.debug("Dropping incomplete lead: {}", node);
                continue;
            }
            try {
                Lead lead = objectMapper.treeToValue(node, Lead.class);
                lead.setLink(lead.getLink().trim());
                lead.setQueryIds(new ArrayList<>(List.of(query.getQueryId())));
                leads.add(lead);
                log.info("  Found: {} at {}", lead.getTitle(), lead.getCompany());
            } catch (JsonProcessingException e) {
                log.debug("Dropping malformed lead {}: {}", node, e.getOriginalMessage());
            }
        }
        return new SearchOutcome(leads, false);
    }

    private boolean hasRequiredFields(JsonNode node) {
        if (!node.isObject()) {
            return false;
        }
        return REQUIRED_FIELDS.stream().allMatch(field -> {
            JsonNode value = node.get(field);
            return value != null && value.isValueNode() && !value.isNull() && !value.asText().isBlank();
        });
    }
}
