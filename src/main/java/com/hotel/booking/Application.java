package com.hotel.booking;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * -@SpringBootApplication is a convenience annotation that combines:
 * =========
 * --@Configuration: Tags the class as a source of bean definitions
 * --WithoutIT: Spring won't recognize this class as a configuration source;
 * no [@Bean] methods would work.
 * =========
 * --@EnableAutoConfiguration: Enables Spring Boot's auto-configuration
 * mechanism (embedded Tomcat, Jackson, Resilience4j registry)
 * --WithoutIT: Every one of those would need manual configuration.
 * =========
 * --@ComponentScan: Enables component scanning in com.hotel.booking and
 * sub-packages
 * --WithoutIT: [@Service] and [@Component] classes such as the orchestrator,
 * the cache store and the in-memory provider won't be discovered.
 */
@SpringBootApplication
public class Application {

    public static void main(String[] args) {
        SpringApplication.run(Application.class, args);
    }
}
