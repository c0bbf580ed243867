package dev.leadtracker.store;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Fields supplied when a job is first added. Id, status and dateFound are assigned by the store.
 */
@Value
@Builder
public class NewJob {

    String company;
    String title;
    String link;

    @Builder.Default
    String location = "";

    @Builder.Default
    String description = "";

    @Builder.Default
    String fullDescription = "";

    String addressee;

    @Builder.Default
    List<Integer> queryIds = List.of();
}
