package fr.lapetina.veebot.command;

import fr.lapetina.veebot.domain.error.ErrorKind;
import fr.lapetina.veebot.domain.error.VeebotException;

import java.util.Arrays;
import java.util.List;
import java.util.function.Function;

/**
 * Cursor over the whitespace separated arguments of a command.
 * Not thread-safe, one instance per command invocation.
 */
public final class CommandArgs {

    private final List<String> args;
    private int position;

    public CommandArgs(String raw) {
        String trimmed = raw == null ? "" : raw.trim();
        this.args = trimmed.isEmpty() ? List.of() : Arrays.asList(trimmed.split("\\s+"));
    }

    public int remaining() {
        return args.size() - position;
    }

    public boolean isEmpty() {
        return remaining() == 0;
    }

    /**
     * Next argument as is, empty string if there is none left.
     */
    public String next() {
        return position < args.size() ? args.get(position++) : "";
    }

    /**
     * Parses the next argument as an integer.
     *
     * @throws VeebotException with {@link ErrorKind.ParseInt} if it is missing or not a number
     */
    public int nextInt() {
        String arg = next();
        try {
            return Integer.parseInt(arg);
        } catch (NumberFormatException e) {
            throw VeebotException.parseInt(arg, e);
        }
    }

    /**
     * Parses the next argument with a parser that reports failures as {@link VeebotException}.
     *
     * @throws VeebotException with {@link ErrorKind.ParseArg} wrapping the parser's error
     */
    public <T> T next(Function<String, T> parser) {
        String arg = next();
        try {
            return parser.apply(arg);
        } catch (VeebotException e) {
            throw VeebotException.parseArg(arg, e);
        }
    }

    /**
     * All remaining arguments joined with a single space.
     */
    public String rest() {
        String rest = String.join(" ", args.subList(position, args.size()));
        position = args.size();
        return rest;
    }

    /**
     * Parses all remaining arguments at once, for parsers that take the whole tail
     * (search queries, tag lists).
     *
     * @throws VeebotException with {@link ErrorKind.ParseArg} wrapping the parser's error
     */
    public <T> T rest(Function<String, T> parser) {
        String rest = rest();
        try {
            return parser.apply(rest);
        } catch (VeebotException e) {
            throw VeebotException.parseArg(rest, e);
        }
    }
}
