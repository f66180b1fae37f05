package tech.yump.securebox.cli;

/**
 * Reads a master password from the user. Callers wipe the returned array when done.
 */
public interface PasswordPrompt {

    char[] readPassword(String prompt);
}
