package ru.tigran.employeeinsights.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.dao.DataAccessException;
import ru.tigran.employeeinsights.repository.CityAggregateRepository;
import ru.tigran.employeeinsights.repository.FeedbackRecordRepository;
import ru.tigran.employeeinsights.repository.KeywordAggregateRepository;

/**
 * Конфигурация health checks
 */
@Slf4j
@Configuration
public class HealthCheckConfig {

    /**
     * Агрегаты пусты при непустой таблице фактов: предыдущий refresh упал, его нужно перезапустить.
     * Доступен как /actuator/health/aggregates
     */
    @Bean
    public HealthIndicator aggregatesHealthIndicator(
            FeedbackRecordRepository feedbackRecordRepository,
            KeywordAggregateRepository keywordAggregateRepository,
            CityAggregateRepository cityAggregateRepository
    ) {
        return () -> {
            try {
                long records = feedbackRecordRepository.count();
                long keywords = keywordAggregateRepository.count();
                long cities = cityAggregateRepository.count();

                Health.Builder builder = records > 0 && (keywords == 0 || cities == 0)
                        ? Health.outOfService().withDetail("action", "re-run the aggregate refresh")
                        : Health.up();
                return builder
                        .withDetail("feedbackRecords", records)
                        .withDetail("keywordAggregates", keywords)
                        .withDetail("cityAggregates", cities)
                        .build();
            } catch (DataAccessException e) {
                log.warn("Aggregates health check failed: {}", e.getMessage());
                return Health.down(e).build();
            }
        };
    }
}
