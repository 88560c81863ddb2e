/**
 * Veebot core - error taxonomy and outbound HTTP/JSON client of the Veebot chat bot.
 *
 * <p>Every fallible operation of the bot fails with a
 * {@link fr.lapetina.veebot.domain.error.VeebotException} carrying one
 * {@link fr.lapetina.veebot.domain.error.ErrorKind}. The exception is logged once where it
 * is created and rendered as a chat reply by the command layer.
 *
 * <h2>Key Components</h2>
 * <ul>
 *   <li>{@link fr.lapetina.veebot.VeebotContext} - Wires the shared services from YAML configuration</li>
 *   <li>{@link fr.lapetina.veebot.infrastructure.http.HttpJsonClient} - GET requests with JSON responses</li>
 *   <li>{@link fr.lapetina.veebot.command.CommandRunner} - Turns handler failures into chat replies</li>
 * </ul>
 *
 * @see fr.lapetina.veebot.domain.error.VeebotException
 */
package fr.lapetina.veebot;
