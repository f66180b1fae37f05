package tech.yump.securebox.core;

import java.util.Objects;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * A named secret record, plaintext in memory. The setters only touch this object; the owning
 * {@link Vault} re-encrypts and persists on {@link Vault#updateContainer}.
 */
@Getter
@EqualsAndHashCode
public class Container {

  /** Hidden container holding the cloud backup credentials. */
  public static final int CREDENTIALS_ID = -1;
  /** Hidden container holding the cloud session token. */
  public static final int TOKEN_ID = -2;

  private final int id;
  private String name;
  private String data;

  public Container(int id, String name, String data) {
    this.id = id;
    this.name = Objects.requireNonNull(name, "name");
    this.data = Objects.requireNonNull(data, "data");
  }

  public void setName(String name) {
    this.name = Objects.requireNonNull(name, "name");
  }

  public void setData(String data) {
    this.data = Objects.requireNonNull(data, "data");
  }

  /**
   * Hidden containers are part of the vault file but never listed or returned to callers.
   */
  public boolean isHidden() {
    return id < 0;
  }

  public Container copy() {
    return new Container(id, name, data);
  }

  @Override
  public String toString() {
    return "Container{id=" + id + ", name.length=" + name.length() + ", data.length=" + data.length() + "}";
  }
}
