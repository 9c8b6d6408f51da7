package ru.tigran.employeeinsights.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import ru.tigran.employeeinsights.model.Bookmark;

import java.util.List;
import java.util.Optional;

@Repository
public interface BookmarkRepository extends JpaRepository<Bookmark, Long> {
    boolean existsByInsightIdAndInsightTitle(Long insightId, String insightTitle);

    Optional<Bookmark> findByInsightIdAndInsightTitle(Long insightId, String insightTitle);

    List<Bookmark> findAllByOrderByCreatedAtDescIdDesc();
}
