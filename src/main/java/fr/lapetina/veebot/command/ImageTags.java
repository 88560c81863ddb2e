package fr.lapetina.veebot.command;

import fr.lapetina.veebot.domain.error.ErrorKind;
import fr.lapetina.veebot.domain.error.VeebotException;

import java.util.Arrays;
import java.util.List;

/**
 * Parser for space separated image search tags.
 */
public final class ImageTags {

    private ImageTags() {
    }

    /**
     * Splits the input into tags on whitespace.
     *
     * @throws VeebotException with {@link ErrorKind.CommaInImageTag} if the input contains a comma
     */
    public static List<String> parse(String input) {
        if (input.contains(",")) {
            throw VeebotException.of(new ErrorKind.CommaInImageTag(input));
        }
        return Arrays.stream(input.trim().split("\\s+"))
                .filter(tag -> !tag.isEmpty())
                .toList();
    }
}
