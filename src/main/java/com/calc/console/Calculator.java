package com.calc.console;

import com.calc.core.ExpressionCalculator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

/**
 * Read, evaluate and print loop.
 * <p>
 * Prints the banner, then reads one expression per prompt until the exit
 * command or end of input.
 */
public class Calculator {

    private static final Logger log = LoggerFactory.getLogger(Calculator.class);

    public static final String DEFAULT_BANNER = "### Calculator ver. 1.0 ###";
    public static final String DEFAULT_PROMPT = ">>> ";
    public static final String DEFAULT_EXIT_COMMAND = "EXIT";

    private final Console console;
    private final ExpressionCalculator calculator;
    private final String banner;
    private final String prompt;
    private final String exitCommand;

    public Calculator(Console console, ExpressionCalculator calculator) {
        this(console, calculator, DEFAULT_BANNER, DEFAULT_PROMPT, DEFAULT_EXIT_COMMAND);
    }

    public Calculator(Console console, ExpressionCalculator calculator,
                      String banner, String prompt, String exitCommand) {
        this.console = console;
        this.calculator = calculator;
        this.banner = banner;
        this.prompt = prompt;
        this.exitCommand = exitCommand;
    }

    /**
     * Run until the exit command is entered.
     *
     * @return number of lines evaluated
     */
    public int run() {
        console.println(banner);
        int evaluated = 0;

        while (true) {
            console.print(prompt);
            String line = console.readLine();
            if (line == null) {
                log.debug("End of input after {} expressions", evaluated);
                return evaluated;
            }

            String input = line.toUpperCase(Locale.ROOT);
            if (input.equalsIgnoreCase(exitCommand)) {
                log.debug("Exit command received after {} expressions", evaluated);
                return evaluated;
            }

            console.println(calculator.calculate(input));
            evaluated++;
        }
    }
}
