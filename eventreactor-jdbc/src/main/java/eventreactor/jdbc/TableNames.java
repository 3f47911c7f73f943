package eventreactor.jdbc;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Names of the events and tracker tables. They are spliced into SQL, so only plain
 * unquoted identifiers that fit PostgreSQL's 63 character limit are accepted.
 */
final class TableNames {
  static final String EVENTS = "events";
  static final String TRACKER = "tracker";

  private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]{0,62}");

  private TableNames() {
  }

  static String events(String name) {
    return checked("events", name);
  }

  static String tracker(String name) {
    return checked("tracker", name);
  }

  private static String checked(String table, String name) {
    Objects.requireNonNull(name, table + " table name");
    if (!IDENTIFIER.matcher(name).matches()) {
      throw new IllegalArgumentException(
          "Invalid " + table + " table name '" + name + "': expected an unquoted SQL identifier");
    }
    return name;
  }
}
