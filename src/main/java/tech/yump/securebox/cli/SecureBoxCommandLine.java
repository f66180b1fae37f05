package tech.yump.securebox.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import tech.yump.securebox.SecureBoxApplication;
import tech.yump.securebox.backup.CloudCredentials;
import tech.yump.securebox.backup.CloudToken;
import tech.yump.securebox.config.SecureBoxProperties;
import tech.yump.securebox.core.Container;
import tech.yump.securebox.core.IntegrityReport;
import tech.yump.securebox.core.Outcome;
import tech.yump.securebox.core.RecoveredVault;
import tech.yump.securebox.core.Vault;
import tech.yump.securebox.core.VaultError;
import tech.yump.securebox.core.VaultService;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Set;

/**
 * Command-line front end. Exactly one command option per invocation; each maps to one vault
 * operation. Opening a vault that does not exist yet creates it after asking for the password twice.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "securebox.cli.enabled", havingValue = "true", matchIfMissing = true)
public class SecureBoxCommandLine implements ApplicationRunner, ExitCodeGenerator {

    static final String PASSWORD_PROMPT = "Enter your master password: ";
    static final String CONFIRM_PROMPT = "Repeat the master password: ";
    static final String NEW_PASSWORD_PROMPT = "Enter the new master password: ";
    static final String CONFIRM_NEW_PASSWORD_PROMPT = "Repeat the new master password: ";

    private static final List<String> COMMANDS = List.of(
            "create", "list", "view", "edit", "delete", "verify-integrity", "recover",
            "upload", "download", "delete-backup", "change-password", "regenerate-keys",
            "set-credentials", "sign-out", "print-paths", "version", "help");

    private static final Set<String> MUTATING = Set.of(
            "create", "edit", "delete", "change-password", "regenerate-keys", "set-credentials", "sign-out");

    private final VaultService vaultService;
    private final PasswordPrompt passwordPrompt;
    private final SecureBoxProperties properties;
    private final ObjectMapper objectMapper;

    private int exitCode = 0;

    @Override
    public void run(ApplicationArguments args) {
        exitCode = execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    int execute(ApplicationArguments args) {
        List<String> commands = COMMANDS.stream().filter(args::containsOption).toList();
        if (commands.size() != 1) {
            printUsage(System.err);
            return error(commands.isEmpty() ? "no command given." : "only one command at a time: " + commands);
        }
        String command = commands.get(0);

        try {
            return switch (command) {
                case "help" -> {
                    printUsage(System.out);
                    yield 0;
                }
                case "version" -> {
                    System.out.println("SecureBox " + SecureBoxApplication.VERSION);
                    yield 0;
                }
                case "print-paths" -> printPaths();
                case "view" -> view(args);
                case "recover" -> recover();
                default -> withVault(command, args);
            };
        } catch (UsageException e) {
            return error(e.getMessage());
        }
    }

    private int withVault(String command, ApplicationArguments args) {
        Request request = parseRequest(command, args);
        Path path = properties.storage().vaultPath();

        char[] password = passwordPrompt.readPassword(PASSWORD_PROMPT);
        try {
            Outcome<Vault> opened;
            if (!vaultService.exists(path)) {
                char[] confirmation = passwordPrompt.readPassword(CONFIRM_PROMPT);
                try {
                    if (!Arrays.equals(password, confirmation)) {
                        return error("passwords do not match.");
                    }
                } finally {
                    Arrays.fill(confirmation, '\0');
                }
                opened = vaultService.create(password, path);
                if (opened.isSuccess()) {
                    System.out.println("New vault created at " + path);
                }
            } else {
                opened = vaultService.open(password, path);
            }
            if (opened.isFailure()) {
                return error(opened.error());
            }

            try (Vault vault = opened.value()) {
                int result = dispatch(command, request, vault);
                if (result == 0 && MUTATING.contains(command) && properties.backup().autoUpload()) {
                    autoUpload(vault);
                }
                return result;
            }
        } finally {
            Arrays.fill(password, '\0');
        }
    }

    private int dispatch(String command, Request request, Vault vault) {
        switch (command) {
            case "create": {
                Outcome<Container> created = vault.addContainer(request.name(), request.text());
                return report(created, "Container " + (created.isSuccess() ? created.value().getId() : "") + " created");
            }
            case "list": {
                List<Container> containers = vault.listContainers();
                if (containers.isEmpty()) {
                    System.out.println("No containers.");
                }
                containers.forEach(container -> System.out.println(container.getId() + ". " + container.getName()));
                return 0;
            }
            case "edit":
                return report(vault.updateContainer(request.id(), request.name(), request.text()), "Container updated");
            case "delete":
                return report(vault.removeContainer(request.id()), "Container deleted");
            case "verify-integrity":
                return verifyIntegrity(vault);
            case "upload":
                return report(vault.uploadBackup(), "Vault uploaded as " + vault.remoteName());
            case "download":
                return report(vault.downloadBackup(), "Vault downloaded");
            case "delete-backup":
                return report(vault.deleteBackup(), "Backup deleted");
            case "change-password":
                return changePassword(vault);
            case "regenerate-keys":
                return report(vault.regenerateKeys(), "Keys regenerated");
            case "set-credentials":
                return report(vault.setCloudCredentials(request.credentials(), request.token()), "Credentials set");
            case "sign-out":
                return report(vault.signOut(), "Signed out");
            default:
                throw new UsageException("unknown command: " + command);
        }
    }

    private int view(ApplicationArguments args) {
        int id = parseId(args, "view");
        char[] password = passwordPrompt.readPassword(PASSWORD_PROMPT);
        try {
            Outcome<Container> fetched = vaultService.fetchContainer(password, properties.storage().vaultPath(), id);
            if (fetched.isFailure()) {
                return error(fetched.error());
            }
            Container container = fetched.value();
            System.out.println(container.getId() + ". " + container.getName());
            System.out.println(container.getData());
            return 0;
        } finally {
            Arrays.fill(password, '\0');
        }
    }

    private int recover() {
        Path path = properties.storage().vaultPath();
        char[] password = passwordPrompt.readPassword(PASSWORD_PROMPT);
        try {
            Outcome<RecoveredVault> recovered = vaultService.recover(password, path);
            if (recovered.isFailure()) {
                return error(recovered.error());
            }
            try (Vault vault = recovered.value().vault()) {
                printReport(recovered.value().report());
                System.out.println("Recovered containers:");
                vault.listContainers().forEach(container -> System.out.println(container.getId() + ". " + container.getName()));
                return recovered.value().report().passed() ? 0 : 1;
            }
        } finally {
            Arrays.fill(password, '\0');
        }
    }

    private int verifyIntegrity(Vault vault) {
        Outcome<IntegrityReport> verified = vault.verifyIntegrity();
        if (verified.isFailure()) {
            return error(verified.error());
        }
        IntegrityReport report = verified.value();
        if (report.passed()) {
            System.out.println("Integrity verified");
            return 0;
        }
        printReport(report);
        return error("integrity check failed.");
    }

    private int changePassword(Vault vault) {
        char[] newPassword = passwordPrompt.readPassword(NEW_PASSWORD_PROMPT);
        char[] confirmation = passwordPrompt.readPassword(CONFIRM_NEW_PASSWORD_PROMPT);
        try {
            if (!Arrays.equals(newPassword, confirmation)) {
                return error("passwords do not match.");
            }
            return report(vault.changeMasterPassword(newPassword), "Master password changed");
        } finally {
            Arrays.fill(newPassword, '\0');
            Arrays.fill(confirmation, '\0');
        }
    }

    private int printPaths() {
        System.out.println("Save file: " + properties.storage().vaultPath());
        System.out.println("Config file: " + (properties.configFile() != null ? properties.configFile() : "(none)"));
        return 0;
    }

    private void autoUpload(Vault vault) {
        Outcome<Void> uploaded = vault.uploadBackup();
        if (uploaded.isFailure()) {
            System.err.println("Error: Could not upload vault to the cloud: " + uploaded.error().message());
        } else {
            System.out.println("Vault uploaded as " + vault.remoteName());
        }
    }

    private Request parseRequest(String command, ApplicationArguments args) {
        String name = optionValue(args, "name");
        String text = optionValue(args, "text");
        switch (command) {
            case "create":
                if (name == null || text == null) {
                    throw new UsageException("--create requires --name and --text.");
                }
                if (name.isEmpty()) {
                    throw new UsageException("name cannot be empty.");
                }
                return new Request(null, name, text, null, null);
            case "edit":
                if (text == null && (name == null || name.isEmpty())) {
                    throw new UsageException("--edit requires --name or --text.");
                }
                return new Request(parseId(args, "edit"), name == null || name.isEmpty() ? null : name, text, null, null);
            case "delete":
                return new Request(parseId(args, "delete"), null, null, null, null);
            case "set-credentials":
                return new Request(null, null, null, readCredentials(args), readToken(args));
            default:
                return new Request(null, null, null, null, null);
        }
    }

    private CloudCredentials readCredentials(ApplicationArguments args) {
        String file = optionValue(args, "set-credentials");
        if (file == null || file.isBlank()) {
            throw new UsageException("--set-credentials requires a FILE.");
        }
        try {
            return objectMapper.readValue(Files.readAllBytes(Path.of(file)), CloudCredentials.class);
        } catch (IOException e) {
            log.debug("Failed to read credentials file {}", file, e);
            throw new UsageException("could not read credentials from " + file + ": " + e.getMessage());
        } catch (IllegalArgumentException e) {
            throw new UsageException("invalid credentials in " + file + ": " + e.getMessage());
        }
    }

    private CloudToken readToken(ApplicationArguments args) {
        String file = optionValue(args, "token");
        if (file == null) {
            return null;
        }
        try {
            return new CloudToken(Files.readString(Path.of(file), StandardCharsets.UTF_8).trim());
        } catch (IOException e) {
            throw new UsageException("could not read token from " + file + ": " + e.getMessage());
        } catch (IllegalArgumentException e) {
            throw new UsageException("invalid token in " + file + ": " + e.getMessage());
        }
    }

    private static int parseId(ApplicationArguments args, String option) {
        String value = optionValue(args, option);
        if (value == null) {
            throw new UsageException("--" + option + " requires a CONTAINER_ID.");
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new UsageException(option + " argument must be a number.");
        }
    }

    private static String optionValue(ApplicationArguments args, String option) {
        List<String> values = args.getOptionValues(option);
        return values == null || values.isEmpty() ? null : values.get(values.size() - 1);
    }

    private static void printReport(IntegrityReport report) {
        System.out.println("Header: " + (report.headerVerified() ? "verified" : "FAILED"));
        report.containers().values().forEach(check ->
                System.out.println("Container " + check.id() + ": " + check.status()));
    }

    private static int report(Outcome<?> outcome, String successMessage) {
        if (outcome.isFailure()) {
            return error(outcome.error());
        }
        System.out.println(successMessage);
        return 0;
    }

    private static int error(VaultError error) {
        return error(error.message());
    }

    private static int error(String message) {
        System.err.println("Error: " + message);
        return 1;
    }

    private static void printUsage(PrintStream out) {
        out.println("SecureBox " + SecureBoxApplication.VERSION + ": a local password manager.");
        out.println();
        out.println("Usage: securebox <command> [options]");
        out.println();
        out.println("Commands:");
        out.println("  --create --name=NAME --text=TEXT   create a new container");
        out.println("  --list                             list container ids and names");
        out.println("  --view=ID                          view container contents (full vault integrity not verified)");
        out.println("  --edit=ID [--name=] [--text=]      edit a container");
        out.println("  --delete=ID                        delete a container");
        out.println("  --verify-integrity                 verify the integrity of the whole vault");
        out.println("  --recover                          open a damaged vault and report what still verifies");
        out.println("  --upload                           upload the vault backup (see --set-credentials)");
        out.println("  --download                         replace the local vault with the backup (keeps <file>.old)");
        out.println("  --delete-backup                    delete the remote backup");
        out.println("  --change-password                  change the master password");
        out.println("  --regenerate-keys                  regenerate salt, IV and all derived keys");
        out.println("  --set-credentials=FILE [--token=FILE]  store backup credentials (JSON) and session token");
        out.println("  --sign-out                         remove the stored session token (credentials stay)");
        out.println("  --print-paths                      print the save file and configuration file paths");
        out.println("  --version                          print version and exit");
        out.println("  --help                             print this help and exit");
    }

    private record Request(Integer id, String name, String text, CloudCredentials credentials, CloudToken token) {
    }

    static class UsageException extends RuntimeException {
        UsageException(String message) {
            super(message);
        }
    }
}
