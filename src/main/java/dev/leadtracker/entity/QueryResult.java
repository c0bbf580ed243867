package dev.leadtracker.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * One append-only row of a query's run history: how many potential leads a run
 * attributed to the query (negative rows record leads later judged unsuitable).
 */
@Data
@Entity
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table(name = "search_query_results", indexes = {
        @Index(name = "idx_search_query_results", columnList = "username, query_id")
})
public class QueryResult {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String username;

    @Column(name = "query_id", nullable = false)
    private Integer queryId;

    @Column(nullable = false)
    private LocalDateTime timestamp;

    @Column(name = "potential_leads", nullable = false)
    private int potentialLeads;
}
