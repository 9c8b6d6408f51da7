package ru.tigran.employeeinsights.repository;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;
import ru.tigran.employeeinsights.model.KeywordAggregate;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface KeywordAggregateRepository extends JpaRepository<KeywordAggregate, Long> {

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("delete from KeywordAggregate")
    int deleteAllRows();

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query(value = "TRUNCATE TABLE keyword_aggregates RESTART IDENTITY", nativeQuery = true)
    void truncate();

    List<KeywordAggregate> findAllByOrderByTotalCountDescKeywordAsc();

    List<KeywordAggregate> findAllByOrderByTotalCountDescKeywordAsc(Pageable pageable);

    List<KeywordAggregate> findByPositivePercentageGreaterThanOrderByPositivePercentageDescTotalCountDesc(
            double threshold, Pageable pageable);

    List<KeywordAggregate> findByNegativePercentageGreaterThanOrderByNegativePercentageDescTotalCountDesc(
            double threshold, Pageable pageable);

    List<KeywordAggregate> findByKeywordContainingIgnoreCaseOrderByTotalCountDesc(String word);

    Optional<KeywordAggregate> findByKeyword(String keyword);

    List<KeywordAggregate> findByKeywordIn(Collection<String> keywords);
}
