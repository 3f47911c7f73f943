/**
 * JDBC persistence for reactors: {@link eventreactor.jdbc.JdbcEventStore} for the event
 * stream and {@link eventreactor.jdbc.JdbcTracker} for reactor positions.
 *
 * <p>Table definitions ship as classpath resources {@code schema/h2.sql},
 * {@code schema/postgresql.sql} and {@code schema/mysql.sql}. Both components can join a
 * thread-bound transaction started by {@link eventreactor.jdbc.tx.JdbcTransactionManager}.
 */
package eventreactor.jdbc;
