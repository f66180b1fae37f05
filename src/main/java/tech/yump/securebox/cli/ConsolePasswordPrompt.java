package tech.yump.securebox.cli;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.Console;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * Reads the password from the terminal without echo. Falls back to a plain line from standard input
 * when no console is attached (pipes, CI).
 */
@Slf4j
@Component
public class ConsolePasswordPrompt implements PasswordPrompt {

    private BufferedReader stdin;

    @Override
    public char[] readPassword(String prompt) {
        Console console = System.console();
        if (console != null) {
            char[] password = console.readPassword("%s", prompt);
            return password == null ? new char[0] : password;
        }

        log.debug("No console attached, reading password from standard input.");
        System.err.print(prompt);
        System.err.flush();
        try {
            if (stdin == null) {
                stdin = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
            }
            String line = stdin.readLine();
            return line == null ? new char[0] : line.toCharArray();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read password from standard input.", e);
        }
    }
}
