package dev.autoresume.selection;

/**
 * Line-oriented terminal used by the selection checkpoint.
 */
public interface SelectionConsole {

    void println(String line);

    /**
     * Print the prompt and block for one line of input.
     *
     * @return the line without its terminator, or {@code null} at end of input
     */
    String readLine(String prompt);
}
