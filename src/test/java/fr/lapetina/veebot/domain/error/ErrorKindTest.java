package fr.lapetina.veebot.domain.error;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.ConnectException;
import java.net.URI;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ErrorKindTest {

    static List<ErrorKind> userKinds() {
        return List.of(
                new ErrorKind.TrackIndexOutOfBounds(7, new IndexRange(0, 3)),
                new ErrorKind.NoActiveTrack(),
                new ErrorKind.UserNotInGuild(),
                new ErrorKind.ParseInt("abc", new NumberFormatException("For input string: \"abc\"")),
                new ErrorKind.ParseArg("a,b", VeebotException.of(new ErrorKind.CommaInImageTag("a,b"))),
                new ErrorKind.CommaInImageTag("cats,dogs"),
                new ErrorKind.UserNotInVoiceChannel()
        );
    }

    static List<ErrorKind> internalKinds() {
        return List.of(
                new ErrorKind.JoinVoiceChannel("General"),
                new ErrorKind.AudioStart(new IllegalStateException("no opus encoder")),
                new ErrorKind.UnknownDiscord(new IOException("gateway closed")),
                new ErrorKind.SendRequest(new ConnectException("Connection refused")),
                new ErrorKind.GetRequest(404, "not found"),
                new ErrorKind.UnexpectedJsonShape(new IOException("Unexpected character")),
                new ErrorKind.YtVidNotFound("never gonna give you up"),
                new ErrorKind.YtInferVideoId(URI.create("https://example.com/video"))
        );
    }

    @Nested
    @DisplayName("classification")
    class ClassificationTests {

        @Test
        @DisplayName("should classify input failures as user errors")
        void shouldClassifyUserErrors() {
            assertThat(userKinds())
                    .extracting(ErrorKind::classification)
                    .containsOnly(Classification.USER);
        }

        @Test
        @DisplayName("should classify infrastructure failures as internal errors")
        void shouldClassifyInternalErrors() {
            assertThat(internalKinds())
                    .extracting(ErrorKind::classification)
                    .containsOnly(Classification.INTERNAL);
        }

        @Test
        @DisplayName("should classify equal kinds the same way every time")
        void shouldBeDeterministic() {
            ErrorKind first = new ErrorKind.GetRequest(500, "boom");
            ErrorKind second = new ErrorKind.GetRequest(500, "boom");

            assertThat(first).isEqualTo(second);
            assertThat(first.classification()).isEqualTo(second.classification());
            assertThat(first.classification()).isEqualTo(first.classification());
        }

        @Test
        @DisplayName("should capture context only for internal kinds")
        void shouldCaptureOnlyInternal() {
            assertThat(userKinds()).noneMatch(VeebotException::shouldCapture);
            assertThat(internalKinds()).allMatch(VeebotException::shouldCapture);
        }
    }

    @Nested
    @DisplayName("titles")
    class Titles {

        @Test
        @DisplayName("should title every parse and validation failure as invalid argument")
        void shouldTitleInvalidArguments() {
            assertThat(List.of(
                    new ErrorKind.TrackIndexOutOfBounds(1, null),
                    new ErrorKind.ParseInt("x", new NumberFormatException("x")),
                    new ErrorKind.CommaInImageTag("a,b")
            )).extracting(ErrorKind::title).containsOnly("Invalid argument error");
        }

        @Test
        @DisplayName("should title request and response failures")
        void shouldTitleHttpErrors() {
            assertThat(new ErrorKind.GetRequest(500, "").title()).isEqualTo("HTTP error");
            assertThat(new ErrorKind.UnexpectedJsonShape(new IOException()).title()).isEqualTo("HTTP error");
            assertThat(new ErrorKind.SendRequest(new IOException()).title()).isEqualTo("Send request error");
            assertThat(new ErrorKind.YtVidNotFound("q").title()).isEqualTo("YouTube error");
            assertThat(new ErrorKind.YtInferVideoId(URI.create("https://a.b")).title()).isEqualTo("Bad YouTube URL");
        }

        @Test
        @DisplayName("should title context failures")
        void shouldTitleContextErrors() {
            assertThat(new ErrorKind.NoActiveTrack().title()).isEqualTo("Invalid command error");
            assertThat(new ErrorKind.UserNotInGuild().title()).isEqualTo("Not in a guild error");
            assertThat(new ErrorKind.UserNotInVoiceChannel().title()).isEqualTo("Not in a voice channel error");
            assertThat(new ErrorKind.JoinVoiceChannel(null).title()).isEqualTo("Permissions error");
            assertThat(new ErrorKind.AudioStart(new IOException()).title()).isEqualTo("Internal error");
            assertThat(new ErrorKind.UnknownDiscord(new IOException()).title()).isEqualTo("Internal error");
        }
    }

    @Nested
    @DisplayName("messages")
    class Messages {

        @Test
        @DisplayName("should show the available range of an out of bounds index")
        void shouldShowAvailableRange() {
            assertThat(new ErrorKind.TrackIndexOutOfBounds(7, new IndexRange(0, 3)).message())
                    .isEqualTo("Given track index `7` is out of bounds, available range: 0..3");
            assertThat(new ErrorKind.TrackIndexOutOfBounds(0, null).message())
                    .isEqualTo("Given track index `0` is out of bounds, available range: none");
        }

        @Test
        @DisplayName("should show status and body of a failed GET request")
        void shouldShowStatusAndBody() {
            assertThat(new ErrorKind.GetRequest(404, "not found").message())
                    .isEqualTo("GET request has failed (http status code: 404):\nnot found");
        }

        @Test
        @DisplayName("should fall back to a placeholder for an unknown channel name")
        void shouldUsePlaceholderChannelName() {
            assertThat(new ErrorKind.JoinVoiceChannel(null).message())
                    .isEqualTo("I cannot join the voice channel <unknown channel name>");
            assertThat(new ErrorKind.JoinVoiceChannel("General").message())
                    .isEqualTo("I cannot join the voice channel General");
        }

        @Test
        @DisplayName("should include the nested error message of an argument failure")
        void shouldIncludeNestedMessage() {
            VeebotException nested = VeebotException.of(new ErrorKind.CommaInImageTag("a,b"));

            assertThat(new ErrorKind.ParseArg("a,b", nested).message()).isEqualTo(
                    "Parsing the arguments finished with an error: "
                            + "The specified image tags contain a comma (which is prohibited): a,b");
        }

        @Test
        @DisplayName("should include the parse failure of an integer argument")
        void shouldIncludeParseFailure() {
            NumberFormatException cause = new NumberFormatException("For input string: \"abc\"");

            assertThat(new ErrorKind.ParseInt("abc", cause).message())
                    .isEqualTo("Failed to parse an integer: For input string: \"abc\"");
            assertThat(new ErrorKind.ParseInt("abc", cause).cause()).isSameAs(cause);
        }

        @Test
        @DisplayName("should have a message for every kind")
        void shouldHaveMessageForEveryKind() {
            assertThat(userKinds()).allSatisfy(kind -> assertThat(kind.message()).isNotBlank());
            assertThat(internalKinds()).allSatisfy(kind -> assertThat(kind.message()).isNotBlank());
        }
    }

    @Nested
    @DisplayName("debug fields")
    class DebugFields {

        @Test
        @DisplayName("should list the payload in declaration order")
        void shouldListPayloadInOrder() {
            assertThat(new ErrorKind.GetRequest(404, "not found").debugFields()).containsExactly(
                    new ErrorKind.DebugField("status", 404),
                    new ErrorKind.DebugField("body", "not found"));
            assertThat(new ErrorKind.TrackIndexOutOfBounds(3, null).debugFields()).containsExactly(
                    new ErrorKind.DebugField("index", 3),
                    new ErrorKind.DebugField("available", null));
        }

        @Test
        @DisplayName("should list nothing for kinds without payload")
        void shouldListNothingForUnitKinds() {
            assertThat(new ErrorKind.NoActiveTrack().debugFields()).isEmpty();
            assertThat(new ErrorKind.UserNotInGuild().debugFields()).isEmpty();
            assertThat(new ErrorKind.UserNotInVoiceChannel().debugFields()).isEmpty();
        }

        @Test
        @DisplayName("should give every field of every kind a distinct name")
        void shouldNameEveryField() {
            List<ErrorKind> kinds = new ArrayList<>(userKinds());
            kinds.addAll(internalKinds());

            assertThat(kinds).allSatisfy(kind -> assertThat(kind.debugFields())
                    .extracting(ErrorKind.DebugField::name)
                    .doesNotHaveDuplicates()
                    .allSatisfy(name -> assertThat(name).isNotBlank()));
        }
    }
}
