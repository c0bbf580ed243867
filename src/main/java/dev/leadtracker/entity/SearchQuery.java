package dev.leadtracker.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.LocalDateTime;

/**
 * A persisted search string. Never deleted: removal only sets {@code removed},
 * so ids stay unique for the user's whole history.
 */
@Data
@Entity
@Builder
@NoArgsConstructor
@AllArgsConstructor
@IdClass(SearchQuery.Key.class)
@Table(name = "search_queries")
public class SearchQuery {

    @Id
    @Column(nullable = false)
    private String username;

    @Id
    @Column(name = "query_id", nullable = false)
    private Integer queryId;

    @Column(name = "query", nullable = false, length = 2048)
    private String queryText;

    @Column(nullable = false)
    private boolean removed;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Key implements Serializable {
        private String username;
        private Integer queryId;
    }
}
