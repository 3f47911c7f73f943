/**
 * In-memory event store and tracker, used by tests and single-process setups.
 */
package eventreactor.memory;
