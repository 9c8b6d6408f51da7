package ru.tigran.employeeinsights.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;
import ru.tigran.employeeinsights.dto.MonthlySentimentCount;
import ru.tigran.employeeinsights.dto.Sentiment;
import ru.tigran.employeeinsights.model.FeedbackRecord;

import java.util.List;

@Repository
public interface FeedbackRecordRepository extends JpaRepository<FeedbackRecord, Long>,
        JpaSpecificationExecutor<FeedbackRecord>, FeedbackRecordRepositoryCustom {

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query(value = "TRUNCATE TABLE feedback_records RESTART IDENTITY", nativeQuery = true)
    void truncate();

    long countBySentiment(Sentiment sentiment);

    @Query("select count(distinct f.employeeName) from FeedbackRecord f")
    long countDistinctEmployees();

    @Query("""
            select new ru.tigran.employeeinsights.dto.MonthlySentimentCount(
                extract(year from f.eventDate), extract(month from f.eventDate), f.sentiment, count(f))
            from FeedbackRecord f
            group by extract(year from f.eventDate), extract(month from f.eventDate), f.sentiment
            """)
    List<MonthlySentimentCount> countByMonthAndSentiment();
}
