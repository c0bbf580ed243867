package dev.leadtracker.service;

import dev.leadtracker.model.Lead;
import dev.leadtracker.store.JobStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reduces candidate leads to those worth processing: one per link, none already stored.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LeadDeduplicator {

    private final JobStore jobStore;

    public record DedupeResult(List<Lead> fresh, int missingLink, int batchDuplicates, int alreadyStored) {
    }

    /**
     * Drop leads without a link, merge leads sharing a link and drop links the store
     * already holds.
     * <p>
     * The first lead seen for a link is kept; query ids of later duplicates are
     * merged into it.
     *
     * @param candidates leads in discovery order: recovered first, then newly searched
     */
    public DedupeResult dedupe(List<Lead> candidates) {
        if (candidates.isEmpty()) {
            return new DedupeResult(List.of(), 0, 0, 0);
        }

        int missingLink = 0;
        int batchDuplicates = 0;
        Map<String, Lead> byLink = new LinkedHashMap<>();
        for (Lead lead : candidates) {
            if (!lead.hasLink()) {
                missingLink++;
                continue;
            }
            String link = lead.getLink().trim();
            Lead first = byLink.get(link);
            if (first == null) {
                lead.setLink(link);
                byLink.put(link, lead);
            } else {
                first.mergeQueryIds(lead.getQueryIds());
                batchDuplicates++;
            }
        }

        List<Lead> fresh = new ArrayList<>(byLink.size());
        int alreadyStored = 0;
        for (Lead lead : byLink.values()) {
            if (jobStore.hasLink(lead.getLink())) {
                alreadyStored++;
            } else {
                fresh.add(lead);
            }
        }

        log.info("Deduplication: {} candidates, {} without link, {} duplicates, {} already stored, {} new",
                candidates.size(), missingLink, batchDuplicates, alreadyStored, fresh.size());

        return new DedupeResult(fresh, missingLink, batchDuplicates, alreadyStored);
    }
}
