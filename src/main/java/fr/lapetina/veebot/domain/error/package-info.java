/**
 * Error taxonomy of the bot.
 *
 * <p>{@link fr.lapetina.veebot.domain.error.ErrorKind} is the closed set of failures.
 * Each kind is classified as a user error (expected, caused by input) or an internal
 * error (bot or infrastructure failure).
 *
 * <h2>Logging</h2>
 * <p>{@link fr.lapetina.veebot.domain.error.VeebotException#of} logs every error once with
 * its correlation id. Internal errors are logged with their call stack, user errors
 * without it.
 *
 * <h2>Thread Safety</h2>
 * <p>Kinds are immutable records and exceptions are not shared between commands, so
 * nothing in this package needs synchronization.
 */
package fr.lapetina.veebot.domain.error;
