package tech.yump.securebox.config;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.env.EnvironmentPostProcessor;
import org.springframework.core.env.ConfigurableEnvironment;

/**
 * Activates the {@value #PROFILE} profile when the file audit backend is selected.
 * {@code logback-spring.xml} only attaches the audit file appender under that profile, and logging
 * is configured before any bean exists, so the profile has to be set while the environment is
 * prepared.
 */
public class AuditFileProfileActivator implements EnvironmentPostProcessor {

    public static final String PROFILE = "audit-file";
    static final String BACKEND_PROPERTY = "securebox.audit.backend";

    @Override
    public void postProcessEnvironment(ConfigurableEnvironment environment, SpringApplication application) {
        String backend = environment.getProperty(BACKEND_PROPERTY);
        if (backend == null || !backend.trim().equalsIgnoreCase("file")) {
            return;
        }
        for (String active : environment.getActiveProfiles()) {
            if (PROFILE.equals(active)) {
                return;
            }
        }
        environment.addActiveProfile(PROFILE);
    }
}
