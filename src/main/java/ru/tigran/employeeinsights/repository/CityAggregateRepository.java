package ru.tigran.employeeinsights.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;
import ru.tigran.employeeinsights.model.CityAggregate;

import java.util.List;
import java.util.Optional;

@Repository
public interface CityAggregateRepository extends JpaRepository<CityAggregate, Long> {

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("delete from CityAggregate")
    int deleteAllRows();

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query(value = "TRUNCATE TABLE city_aggregates RESTART IDENTITY", nativeQuery = true)
    void truncate();

    List<CityAggregate> findAllByOrderByTotalCountDescCityAsc();

    Optional<CityAggregate> findFirstByCityIgnoreCaseOrderByTotalCountDesc(String city);
}
