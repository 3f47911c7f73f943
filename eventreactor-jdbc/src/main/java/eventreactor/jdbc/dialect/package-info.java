/**
 * Built-in SQL dialects, registered for URL detection through {@code META-INF/services}.
 */
package eventreactor.jdbc.dialect;
