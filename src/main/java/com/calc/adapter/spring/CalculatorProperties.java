package com.calc.adapter.spring;

import com.calc.console.Calculator;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Spring Boot configuration properties for the calculator.
 */
@ConfigurationProperties(prefix = "calculator")
public class CalculatorProperties {

    /**
     * Whether the calculator beans are created.
     */
    private boolean enabled = true;

    /**
     * Line printed once when the loop starts.
     */
    private String banner = Calculator.DEFAULT_BANNER;

    /**
     * Prompt printed before each input line.
     */
    private String prompt = Calculator.DEFAULT_PROMPT;

    /**
     * Input that stops the loop, compared case-insensitively.
     */
    private String exitCommand = Calculator.DEFAULT_EXIT_COMMAND;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getBanner() {
        return banner;
    }

    public void setBanner(String banner) {
        this.banner = banner;
    }

    public String getPrompt() {
        return prompt;
    }

    public void setPrompt(String prompt) {
        this.prompt = prompt;
    }

    public String getExitCommand() {
        return exitCommand;
    }

    public void setExitCommand(String exitCommand) {
        this.exitCommand = exitCommand;
    }
}
