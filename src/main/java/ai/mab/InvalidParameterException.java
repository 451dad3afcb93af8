package ai.mab;

import com.google.common.base.Strings;

/**
 * Thrown at construction or call time when a parameter is out of its valid
 * range.
 */
public class InvalidParameterException extends IllegalArgumentException {
  private static final long serialVersionUID = -3316405962711920183L;

  public InvalidParameterException(final String message) {
    super(message);
  }

  public static void check(final boolean condition, final String template, final Object... args) {
    if (!condition) {
      throw new InvalidParameterException(Strings.lenientFormat(template, args));
    }
  }
}
