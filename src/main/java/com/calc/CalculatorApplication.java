package com.calc;

import com.calc.console.Calculator;
import com.calc.spring.EnableCalculator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;

/**
 * Interactive calculator application.
 */
@SpringBootApplication
@EnableCalculator
public class CalculatorApplication {

    private static final Logger log = LoggerFactory.getLogger(CalculatorApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(CalculatorApplication.class, args);
    }

    @Bean
    public CommandLineRunner repl(ObjectProvider<Calculator> calculators) {
        return args -> {
            Calculator calculator = calculators.getIfAvailable();
            if (calculator == null) {
                log.info("Calculator is disabled, not starting the loop");
                return;
            }
            int evaluated = calculator.run();
            log.info("Calculator stopped after {} expressions", evaluated);
        };
    }
}
