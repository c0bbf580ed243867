package dev.leadtracker.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.leadtracker.ai.Completion;
import dev.leadtracker.ai.JsonExtractor;
import dev.leadtracker.ai.TextCompletionClient;
import dev.leadtracker.config.IngestionProperties;
import dev.leadtracker.config.UserProfile;
import dev.leadtracker.model.Lead;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Asks the model, in one batched call, which leads suit the user's background.
 * <p>
 * Any failure keeps every lead.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SuitabilityFilter {

    private final TextCompletionClient completionClient;
    private final UserProfile userProfile;
    private final IngestionProperties properties;
    private final ObjectMapper objectMapper;

    /**
     * @param failedOpen true when the call or its answer was unusable and everything was kept
     * @param skipped    true when no call was made because there is no background to judge against
     */
    public record FilterOutcome(List<Lead> kept, List<Lead> rejected, boolean failedOpen, boolean skipped) {

        static FilterOutcome keepAll(List<Lead> leads, boolean failedOpen, boolean skipped) {
            return new FilterOutcome(leads, List.of(), failedOpen, skipped);
        }
    }

    public Mono<FilterOutcome> filter(List<Lead> leads) {
        if (leads.isEmpty()) {
            return Mono.just(FilterOutcome.keepAll(List.of(), false, true));
        }
        if (!userProfile.hasBackground()) {
            log.info("No background in profile - keeping all {} leads", leads.size());
            return Mono.just(FilterOutcome.keepAll(leads, false, true));
        }

        String prompt;
        try {
            prompt = IngestionPrompts.filter(userProfile.getBackground(), summarize(leads));
        } catch (JsonProcessingException e) {
            log.warn("Could not summarize leads for filtering, keeping all: {}", e.getOriginalMessage());
            return Mono.just(FilterOutcome.keepAll(leads, true, false));
        }

        return completionClient.complete(prompt, properties.getFilterTimeout())
                .map(completion -> select(leads, completion))
                .onErrorResume(e -> {
                    log.warn("Suitability filter failed, keeping all {} leads: {}", leads.size(), e.getMessage());
                    return Mono.just(FilterOutcome.keepAll(leads, true, false));
                });
    }

    FilterOutcome select(List<Lead> leads, Completion completion) {
        if (!completion.success()) {
            log.warn("Suitability filter failed, keeping all {} leads: {}", leads.size(), completion.text());
            return FilterOutcome.keepAll(leads, true, false);
        }

        Optional<Set<Integer>> indices = parseIndices(completion.text(), leads.size());
        if (indices.isEmpty()) {
            log.warn("Suitability filter answer unparsable, keeping all {} leads", leads.size());
            return FilterOutcome.keepAll(leads, true, false);
        }

        List<Lead> kept = new ArrayList<>();
        List<Lead> rejected = new ArrayList<>();
        for (int i = 0; i < leads.size(); i++) {
            (indices.get().contains(i) ? kept : rejected).add(leads.get(i));
        }
        log.info("Suitability filter kept {} of {} leads", kept.size(), leads.size());
        return new FilterOutcome(kept, rejected, false, false);
    }

    /**
     * In-range indices from the first JSON array in the answer. Empty when there is no array.
     */
    private Optional<Set<Integer>> parseIndices(String text, int size) {
        Optional<String> array = JsonExtractor.array(text);
        if (array.isEmpty()) {
            return Optional.empty();
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(array.get());
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
        if (!root.isArray()) {
            return Optional.empty();
        }

        Set<Integer> indices = new TreeSet<>();
        for (JsonNode node : root) {
            if (node.canConvertToInt()) {
                int index = node.asInt();
                if (index >= 0 && index < size) {
                    indices.add(index);
                } else {
                    log.debug("Ignoring out-of-range filter index {}", index);
                }
            }
        }
        return Optional.of(indices);
    }

    private String summarize(List<Lead> leads) throws JsonProcessingException {
        List<Map<String, Object>> summary = new ArrayList<>(leads.size());
        for (int i = 0; i < leads.size(); i++) {
            Lead lead = leads.get(i);
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("index", i);
            row.put("company", lead.getCompany());
            row.put("title", lead.getTitle());
            row.put("location", lead.getLocation() == null ? "" : lead.getLocation());
            row.put("description", lead.getDescription() == null ? "" : lead.getDescription());
            summary.add(row);
        }
        return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(summary);
    }
}
