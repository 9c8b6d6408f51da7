package ru.tigran.employeeinsights.service;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import ru.tigran.employeeinsights.dto.CityInsightView;
import ru.tigran.employeeinsights.exception.ErrorCode;
import ru.tigran.employeeinsights.exception.ResourceNotFoundException;
import ru.tigran.employeeinsights.repository.CityAggregateRepository;

import java.util.List;

@Service
public class CityInsightService {

    private final CityAggregateRepository cityAggregateRepository;

    public CityInsightService(CityAggregateRepository cityAggregateRepository) {
        this.cityAggregateRepository = cityAggregateRepository;
    }

    @Transactional(readOnly = true)
    public List<CityInsightView> getCitySummaries() {
        return cityAggregateRepository.findAllByOrderByTotalCountDescCityAsc().stream()
                .map(CityInsightView::from)
                .toList();
    }

    @Transactional(readOnly = true)
    public CityInsightView getCitySummary(String city) {
        return cityAggregateRepository.findFirstByCityIgnoreCaseOrderByTotalCountDesc(city.trim())
                .map(CityInsightView::from)
                .orElseThrow(() -> new ResourceNotFoundException(
                        "No summary for city: " + city,
                        ErrorCode.CITY_NOT_FOUND.getCode()
                ));
    }
}
