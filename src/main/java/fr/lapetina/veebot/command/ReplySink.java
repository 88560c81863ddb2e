package fr.lapetina.veebot.command;

import fr.lapetina.veebot.domain.error.ErrorMessage;

/**
 * Destination of the error replies, usually the channel the command came from.
 */
@FunctionalInterface
public interface ReplySink {

    void send(ErrorMessage message);
}
