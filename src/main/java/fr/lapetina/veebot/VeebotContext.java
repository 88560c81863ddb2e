package fr.lapetina.veebot;

import fr.lapetina.veebot.command.CommandRunner;
import fr.lapetina.veebot.infrastructure.config.ConfigLoader;
import fr.lapetina.veebot.infrastructure.config.VeebotConfig;
import fr.lapetina.veebot.infrastructure.http.HttpJsonClient;
import fr.lapetina.veebot.infrastructure.youtube.YouTubeClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Factory for the shared services of the bot, wired from configuration.
 * This is the entry point for command handlers to obtain their collaborators.
 *
 * <p>Usage:
 * <pre>{@code
 * try (VeebotContext context = VeebotContext.create("veebot.yaml")) {
 *     context.getCommandRunner().run("play",
 *             () -> context.getYouTubeClient().findVideo("never gonna give you up"),
 *             reply -> channel.send(reply.title(), reply.body()));
 * }
 * }</pre>
 */
public class VeebotContext implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(VeebotContext.class);

    private final VeebotConfig config;
    private final HttpJsonClient httpClient;
    private final YouTubeClient youTubeClient;
    private final CommandRunner commandRunner;

    protected VeebotContext(VeebotConfig config) {
        this.config = config;
        this.httpClient = new HttpJsonClient(config.getHttp());
        this.youTubeClient = new YouTubeClient(httpClient, config.getYoutube());
        this.commandRunner = new CommandRunner();

        log.info("Veebot context initialized: userAgent={}, connectTimeoutMs={}, requestTimeoutMs={}",
                config.getHttp().getUserAgent(),
                config.getHttp().getConnectTimeoutMs(),
                config.getHttp().getRequestTimeoutMs());
    }

    /**
     * Creates a context from a configuration file (file system or classpath).
     */
    public static VeebotContext create(String configPath) {
        log.info("Initializing Veebot context from config: {}", configPath);
        return new VeebotContext(new ConfigLoader(configPath).load());
    }

    /**
     * Creates a context from the default {@code veebot.yaml} resource.
     */
    public static VeebotContext create() {
        return create(ConfigLoader.DEFAULT_CONFIG);
    }

    public static VeebotContext create(VeebotConfig config) {
        return new VeebotContext(config);
    }

    public VeebotConfig getConfig() {
        return config;
    }

    public HttpJsonClient getHttpClient() {
        return httpClient;
    }

    public YouTubeClient getYouTubeClient() {
        return youTubeClient;
    }

    public CommandRunner getCommandRunner() {
        return commandRunner;
    }

    @Override
    public void close() {
        log.info("Shutting down Veebot context...");
        httpClient.close();
    }
}
