/**
 * Extension points of the JDBC module: connection sourcing, transaction participation
 * and SQL dialects.
 */
package eventreactor.jdbc.spi;
