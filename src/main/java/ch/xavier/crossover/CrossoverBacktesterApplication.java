package ch.xavier.crossover;

import ch.xavier.crossover.config.BacktestProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(BacktestProperties.class)
public class CrossoverBacktesterApplication {

    public static void main(String[] args) {
        System.setProperty("java.awt.headless", "true");
        SpringApplication.run(CrossoverBacktesterApplication.class, args);
    }
}
