package io.syncbridge.workflow;

/**
 * Thrown when a {@code {{token}}} in a step template cannot be resolved.
 */
public class TemplateResolutionException extends RuntimeException {
  private final String token;

  public TemplateResolutionException(String token) {
    super("Unresolved template token: {{" + token + "}}");
    this.token = token;
  }

  public String token() {
    return token;
  }
}
