package org.netpreserve.sitemirror.ui;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.Reader;
import java.util.Locale;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Asks a yes/no question on the terminal. Anything but "y" or "yes" (including end of input) is a no.
 */
public class ConfirmationPrompt {
    private final BufferedReader in;
    private final PrintStream out;

    public ConfirmationPrompt(Reader in, PrintStream out) {
        this.in = in instanceof BufferedReader buffered ? buffered : new BufferedReader(in);
        this.out = out;
    }

    public static ConfirmationPrompt console() {
        return new ConfirmationPrompt(new InputStreamReader(System.in, UTF_8), System.out);
    }

    public boolean confirm(String question) throws IOException {
        out.print(question + " [y/N] ");
        out.flush();
        String answer = in.readLine();
        if (answer == null) {
            out.println();
            return false;
        }
        answer = answer.trim().toLowerCase(Locale.ROOT);
        return answer.equals("y") || answer.equals("yes");
    }
}
