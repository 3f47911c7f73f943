/**
 * Thread-bound JDBC transactions for callers without a transaction framework.
 */
package eventreactor.jdbc.tx;
