package dev.leadtracker.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * A raw job-posting candidate returned by a search call, before dedup,
 * enrichment and filtering. Same shape as the JSON the search prompt asks for,
 * which is also what the recovery log stores.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class Lead {

    private String company;
    private String title;
    private String link;
    private String location;
    private String description;
    private String addressee;

    @JsonProperty("full_description")
    private String fullDescription;

    @Builder.Default
    @JsonProperty("query_ids")
    private List<Integer> queryIds = new ArrayList<>();

    public boolean hasLink() {
        return link != null && !link.isBlank();
    }

    /**
     * Add query ids not already present, keeping first-seen order.
     */
    public void mergeQueryIds(List<Integer> other) {
        if (other == null) {
            return;
        }
        if (queryIds == null) {
            queryIds = new ArrayList<>();
        }
        for (Integer id : other) {
            if (id != null && !queryIds.contains(id)) {
                queryIds.add(id);
            }
        }
    }
}
