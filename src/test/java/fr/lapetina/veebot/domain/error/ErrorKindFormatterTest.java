package fr.lapetina.veebot.domain.error;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.ConnectException;
import java.net.URI;

import static org.assertj.core.api.Assertions.assertThat;

class ErrorKindFormatterTest {

    @Test
    @DisplayName("should print only the variant name for kinds without payload")
    void shouldPrintUnitVariant() {
        assertThat(ErrorKindFormatter.compact(new ErrorKind.NoActiveTrack())).isEqualTo("NoActiveTrack");
        assertThat(ErrorKindFormatter.pretty(new ErrorKind.UserNotInGuild())).isEqualTo("UserNotInGuild");
    }

    @Test
    @DisplayName("should print missing optional payload as None")
    void shouldPrintNone() {
        assertThat(ErrorKindFormatter.compact(new ErrorKind.JoinVoiceChannel(null)))
                .isEqualTo("JoinVoiceChannel { channelName: None }");
        assertThat(ErrorKindFormatter.compact(new ErrorKind.TrackIndexOutOfBounds(4, new IndexRange(0, 2))))
                .isEqualTo("TrackIndexOutOfBounds { index: 4, available: IndexRange { start: 0, end: 2 } }");
    }

    @Test
    @DisplayName("should quote and escape string payloads")
    void shouldEscapeStrings() {
        String dump = ErrorKindFormatter.compact(new ErrorKind.GetRequest(502, "line \"one\"\nline\\two\u0007"));

        assertThat(dump).isEqualTo("GetRequest { status: 502, body: \"line \\\"one\\\"\\nline\\\\two\\u{7}\" }");
    }

    @Test
    @DisplayName("should expand throwable causes")
    void shouldExpandCauses() {
        ErrorKind kind = new ErrorKind.SendRequest(new IOException("send failed", new ConnectException("refused")));

        assertThat(ErrorKindFormatter.compact(kind)).isEqualTo(
                "SendRequest { error: IOException { message: \"send failed\", "
                        + "cause: ConnectException { message: \"refused\" } } }");
    }

    @Test
    @DisplayName("should indent nested structures in pretty form")
    void shouldIndentNested() {
        ErrorKind kind = new ErrorKind.UnexpectedJsonShape(new IOException("bad json"));

        assertThat(ErrorKindFormatter.pretty(kind)).isEqualTo(
                "UnexpectedJsonShape {\n"
                        + "    error: IOException {\n"
                        + "        message: \"bad json\",\n"
                        + "    },\n"
                        + "}");
    }

    @Test
    @DisplayName("should quote URL payloads")
    void shouldQuoteUrls() {
        ErrorKind kind = new ErrorKind.YtInferVideoId(URI.create("https://example.com/watch?v=x"));

        assertThat(ErrorKindFormatter.compact(kind))
                .isEqualTo("YtInferVideoId { url: \"https://example.com/watch?v=x\" }");
    }

    @Test
    @DisplayName("should expand the nested error of an argument failure")
    void shouldExpandNestedError() {
        VeebotException nested = VeebotException.of(new ErrorKind.CommaInImageTag("a,b"));

        assertThat(ErrorKindFormatter.compact(new ErrorKind.ParseArg("a,b", nested))).isEqualTo(
                "ParseArg { argument: \"a,b\", error: VeebotException { id: \"" + nested.id()
                        + "\", kind: CommaInImageTag { input: \"a,b\" } } }");
    }
}
