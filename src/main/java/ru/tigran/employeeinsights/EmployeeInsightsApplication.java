package ru.tigran.employeeinsights;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class EmployeeInsightsApplication {

    public static void main(String[] args) {
        SpringApplication.run(EmployeeInsightsApplication.class, args);
    }
}
