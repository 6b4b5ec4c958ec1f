package com.calc.adapter.spring;

import com.calc.console.Calculator;
import com.calc.console.Console;
import com.calc.console.TerminalConsole;
import com.calc.core.ExpressionCalculator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring Boot auto-configuration for the calculator.
 */
@Configuration
@ConditionalOnProperty(prefix = "calculator", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(CalculatorProperties.class)
public class CalculatorAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(CalculatorAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public ExpressionCalculator expressionCalculator() {
        return new ExpressionCalculator();
    }

    @Bean
    @ConditionalOnMissingBean
    public Console console() {
        return new TerminalConsole();
    }

    @Bean
    @ConditionalOnMissingBean
    public Calculator calculator(Console console, ExpressionCalculator expressionCalculator,
                                 CalculatorProperties properties) {
        log.info("Creating Calculator with exit command '{}'", properties.getExitCommand());
        return new Calculator(console, expressionCalculator,
                properties.getBanner(), properties.getPrompt(), properties.getExitCommand());
    }
}
