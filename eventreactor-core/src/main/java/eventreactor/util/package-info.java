/**
 * Internal utilities: thread naming for background loops and the JSON body codec.
 */
package eventreactor.util;
