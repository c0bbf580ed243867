package dev.leadtracker.repository;

import dev.leadtracker.entity.SearchQuery;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

/**
 * Repository for a user's search queries, removed ones included.
 */
@Repository
public interface SearchQueryRepository extends JpaRepository<SearchQuery, SearchQuery.Key> {

    List<SearchQuery> findByUsernameOrderByQueryId(String username);

    List<SearchQuery> findByUsernameAndRemovedFalseOrderByQueryId(String username);

    List<SearchQuery> findByUsernameAndQueryIdIn(String username, Collection<Integer> queryIds);

    long countByUsernameAndRemovedFalse(String username);

    /**
     * Highest id ever issued to the user, counting removed queries; 0 when none.
     */
    @Query("SELECT COALESCE(MAX(q.queryId), 0) FROM SearchQuery q WHERE q.username = :username")
    int findMaxQueryId(String username);
}
