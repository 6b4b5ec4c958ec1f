package com.calc.console;

/**
 * Line-oriented text input and output used by the {@link Calculator} loop.
 */
public interface Console {

    /**
     * @return the next input line, trimmed, or null at end of input
     */
    String readLine();

    void print(String text);

    void println(String text);
}
