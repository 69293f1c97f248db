package tech.noetzold.coverage_api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CoverageApiApplication {

    public static void main(String[] args) {
        SpringApplication.run(CoverageApiApplication.class, args);
    }
}
