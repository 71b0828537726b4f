package raman.tools;

/**
 * Thrown when a provenance segment cannot be turned back into a transformer: the tag names no
 * known transformer, or the key/value lines do not match that transformer's configuration.
 */
public class ConfigParseException extends ProcessingException {

  private static final long serialVersionUID = 1274468127311998516L;

  public ConfigParseException(String message) {
    super(message);
  }

  public ConfigParseException(String message, Throwable cause) {
    super(message, cause);
  }
}
