package eventreactor;

import java.util.Objects;

/**
 * Canonical naming for event types and processors.
 *
 * <p>Every registered and queried name goes through {@link #canonicalize(String)}, which
 * produces lower snake case. Word boundaries are camel-case humps, digits followed by an
 * upper-case letter, and the separators {@code '-'}, {@code '.'} and whitespace:
 *
 * <pre>{@code
 * canonicalize("TermsAccepted")  // terms_accepted
 * canonicalize("TERMS_ACCEPTED") // terms_accepted
 * canonicalize("terms-accepted") // terms_accepted
 * canonicalize("HTTPCallMade")   // http_call_made
 * }</pre>
 */
public final class EventTypes {

  private EventTypes() {
  }

  /**
   * Returns the lower-snake-case form of a type or processor name.
   *
   * @param name the name to canonicalize
   * @return the canonical name
   * @throws NullPointerException     if name is null
   * @throws IllegalArgumentException if name has no letters or digits
   */
  public static String canonicalize(String name) {
    Objects.requireNonNull(name, "name");
    String trimmed = name.trim();
    StringBuilder sb = new StringBuilder(trimmed.length() + 4);
    for (int i = 0; i < trimmed.length(); i++) {
      char c = trimmed.charAt(i);
      if (isSeparator(c)) {
        appendSeparator(sb);
      } else if (Character.isUpperCase(c)) {
        if (i > 0 && startsWord(trimmed, i)) {
          appendSeparator(sb);
        }
        sb.append(Character.toLowerCase(c));
      } else {
        sb.append(c);
      }
    }
    int end = sb.length();
    while (end > 0 && sb.charAt(end - 1) == '_') {
      end--;
    }
    if (end == 0) {
      throw new IllegalArgumentException("Name must contain letters or digits: '" + name + "'");
    }
    return sb.substring(0, end);
  }

  /**
   * Returns {@code true} if {@link #canonicalize(String)} accepts the name, that is, it is
   * non-null and has at least one character that is not a separator.
   *
   * @param name the name to check, may be {@code null}
   * @return whether the name has a canonical form
   */
  public static boolean isValidName(String name) {
    if (name == null) {
      return false;
    }
    for (int i = 0; i < name.length(); i++) {
      if (!isSeparator(name.charAt(i))) {
        return true;
      }
    }
    return false;
  }

  /**
   * Returns the canonical name derived from a class's simple name.
   *
   * @param type the class
   * @return the canonical name
   * @throws IllegalArgumentException for anonymous classes
   */
  public static String canonicalize(Class<?> type) {
    Objects.requireNonNull(type, "type");
    String simpleName = type.getSimpleName();
    if (simpleName.isEmpty()) {
      throw new IllegalArgumentException("Cannot derive a name from anonymous class " + type.getName());
    }
    return canonicalize(simpleName);
  }

  /**
   * Returns {@code true} if both names have the same canonical form.
   *
   * @param left  first name
   * @param right second name
   * @return whether the names denote the same type
   */
  public static boolean sameType(String left, String right) {
    return canonicalize(left).equals(canonicalize(right));
  }

  private static boolean startsWord(String s, int i) {
    char prev = s.charAt(i - 1);
    if (Character.isLowerCase(prev) || Character.isDigit(prev)) {
      return true;
    }
    // "HTTPCall": the 'C' starts a word because a lower-case letter follows it
    return Character.isUpperCase(prev)
        && i + 1 < s.length()
        && Character.isLowerCase(s.charAt(i + 1));
  }

  private static boolean isSeparator(char c) {
    return c == '_' || c == '-' || c == '.' || Character.isWhitespace(c);
  }

  private static void appendSeparator(StringBuilder sb) {
    if (sb.length() > 0 && sb.charAt(sb.length() - 1) != '_') {
      sb.append('_');
    }
  }
}
