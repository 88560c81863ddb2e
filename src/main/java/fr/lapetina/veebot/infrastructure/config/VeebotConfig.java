package fr.lapetina.veebot.infrastructure.config;

/**
 * Root configuration object for the bot core.
 * Designed to be populated from YAML.
 */
public class VeebotConfig {

    private HttpConfig http = new HttpConfig();
    private YouTubeConfig youtube = new YouTubeConfig();

    public HttpConfig getHttp() { return http; }
    public void setHttp(HttpConfig http) { this.http = http; }

    public YouTubeConfig getYoutube() { return youtube; }
    public void setYoutube(YouTubeConfig youtube) { this.youtube = youtube; }

    /**
     * Outbound HTTP client configuration, shared by every caller of the client.
     */
    public static class HttpConfig {
        private String userAgent = "Veebot";
        private long connectTimeoutMs = 30000;
        private long requestTimeoutMs = 30000;

        public String getUserAgent() { return userAgent; }
        public void setUserAgent(String userAgent) { this.userAgent = userAgent; }

        public long getConnectTimeoutMs() { return connectTimeoutMs; }
        public void setConnectTimeoutMs(long connectTimeoutMs) { this.connectTimeoutMs = connectTimeoutMs; }

        public long getRequestTimeoutMs() { return requestTimeoutMs; }
        public void setRequestTimeoutMs(long requestTimeoutMs) { this.requestTimeoutMs = requestTimeoutMs; }
    }

    /**
     * YouTube Data API configuration.
     */
    public static class YouTubeConfig {
        private String apiBaseUrl = "https://www.googleapis.com/youtube/v3";
        private String apiKey = "";

        public String getApiBaseUrl() { return apiBaseUrl; }
        public void setApiBaseUrl(String apiBaseUrl) { this.apiBaseUrl = apiBaseUrl; }

        public String getApiKey() { return apiKey; }
        public void setApiKey(String apiKey) { this.apiKey = apiKey; }
    }
}
