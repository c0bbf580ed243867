package dev.leadtracker.repository;

import dev.leadtracker.entity.QueryResult;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Append-only log of per-run lead counts.
 */
@Repository
public interface QueryResultRepository extends JpaRepository<QueryResult, Long> {

    List<QueryResult> findByUsernameAndQueryIdOrderByTimestamp(String username, Integer queryId);

    @Query("SELECT COALESCE(SUM(r.potentialLeads), 0) FROM QueryResult r "
            + "WHERE r.username = :username AND r.queryId = :queryId")
    long sumPotentialLeads(String username, Integer queryId);
}
