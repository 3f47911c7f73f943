/**
 * Single-reactor dispatch loop.
 *
 * @see eventreactor.poller.ReactorPoller
 */
package eventreactor.poller;
