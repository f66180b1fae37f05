package tech.yump.securebox.backup;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Temporary session token used together with {@link CloudCredentials}. Kept in the hidden token
 * container and cleared on sign-out.
 */
public record CloudToken(@JsonProperty("sessionToken") String sessionToken) {

  public CloudToken {
    if (sessionToken == null || sessionToken.isBlank()) {
      throw new IllegalArgumentException("Session token must not be blank.");
    }
  }

  @Override
  public String toString() {
    return "CloudToken[sessionToken=******]";
  }
}
