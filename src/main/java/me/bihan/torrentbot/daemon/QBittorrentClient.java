package me.bihan.torrentbot.daemon;

import lombok.extern.log4j.Log4j2;
import me.bihan.torrentbot.exception.AuthenticationFailedException;
import me.bihan.torrentbot.exception.DaemonException;
import me.bihan.torrentbot.exception.InvalidEndpointException;
import me.bihan.torrentbot.exception.SubmissionRejectedException;
import org.apache.hc.client5.http.classic.methods.HttpGet;
import org.apache.hc.client5.http.classic.methods.HttpPost;
import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.cookie.BasicCookieStore;
import org.apache.hc.client5.http.cookie.CookieStore;
import org.apache.hc.client5.http.entity.mime.HttpMultipartMode;
import org.apache.hc.client5.http.entity.mime.MultipartEntityBuilder;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.CloseableHttpResponse;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManagerBuilder;
import org.apache.hc.core5.http.ClassicHttpRequest;
import org.apache.hc.core5.http.ContentType;
import org.apache.hc.core5.http.HttpEntity;
import org.apache.hc.core5.http.HttpHeaders;
import org.apache.hc.core5.http.ParseException;
import org.apache.hc.core5.http.io.entity.EntityUtils;
import org.apache.hc.core5.http.io.entity.StringEntity;
import org.apache.hc.core5.util.Timeout;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * qBittorrent Web API v2 client.
 * Each instance owns its own cookie store, so the SID cookie issued on login lives exactly
 * as long as the instance.
 */
@Log4j2
public class QBittorrentClient implements DaemonClient {

    static final String LOGIN_PATH = "/api/v2/auth/login";
    static final String ADD_TORRENT_PATH = "/api/v2/torrents/add";
    static final String VERSION_PATH = "/api/v2/app/version";

    /** Body the daemon sends when a call went through */
    public static final String SUCCESS_SENTINEL = "Ok.";
    /** Body the daemon sends with status 200 when the credentials are wrong */
    static final String LOGIN_FAILURE_BODY = "Fails.";

    private static final ContentType FORM_CONTENT_TYPE = ContentType.create("application/x-www-form-urlencoded");
    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    private final URI baseUri;
    private final CloseableHttpClient httpClient;
    private boolean authenticated;

    public QBittorrentClient(String baseUrl) throws InvalidEndpointException {
        this(baseUrl, DEFAULT_TIMEOUT);
    }

    public QBittorrentClient(String baseUrl, Duration timeout) throws InvalidEndpointException {
        this.baseUri = parseEndpoint(baseUrl);
        this.httpClient = createHttpClient(new BasicCookieStore(), timeout);
    }

    /**
     * Parses a daemon address, accepting only absolute http or https URLs with a host.
     */
    public static URI parseEndpoint(String baseUrl) throws InvalidEndpointException {
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new InvalidEndpointException("Daemon URL is empty");
        }
        URI uri;
        try {
            uri = new URI(baseUrl.trim());
        } catch (URISyntaxException e) {
            throw new InvalidEndpointException("Daemon URL is malformed: " + e.getMessage(), e);
        }
        String scheme = uri.getScheme();
        if (!uri.isAbsolute() || uri.getHost() == null
                || !("http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme))) {
            throw new InvalidEndpointException("Daemon URL must be an absolute http(s) URL: " + baseUrl);
        }
        if (uri.getRawPath() == null || uri.getRawPath().isEmpty()) {
            uri = uri.resolve("/");
        }
        return uri;
    }

    private static CloseableHttpClient createHttpClient(CookieStore cookieStore, Duration timeout) {
        Timeout limit = Timeout.of(timeout);
        return HttpClients.custom()
                .setDefaultCookieStore(cookieStore)
                .setConnectionManager(PoolingHttpClientConnectionManagerBuilder.create()
                        .setDefaultConnectionConfig(ConnectionConfig.custom()
                                .setConnectTimeout(limit)
                                .setSocketTimeout(limit)
                                .build())
                        .build())
                .setDefaultRequestConfig(RequestConfig.custom()
                        .setResponseTimeout(limit)
                        .build())
                .disableAutomaticRetries()
                .build();
    }

    @Override
    public void login(String username, String password) throws AuthenticationFailedException {
        HttpPost post = new HttpPost(endpoint(LOGIN_PATH));
        post.setHeader(HttpHeaders.REFERER, baseUri.toString());
        post.setEntity(new StringEntity(
                "username=" + formEncode(username) + "&password=" + formEncode(password),
                FORM_CONTENT_TYPE));

        log.debug("Logging in to {}", baseUri);

        DaemonResponse response;
        try {
            response = send(post);
        } catch (IOException e) {
            throw new AuthenticationFailedException("Daemon unreachable during login: " + e.getMessage(), e);
        }

        if (!response.isSuccess() || LOGIN_FAILURE_BODY.equals(response.getBody())) {
            throw new AuthenticationFailedException(
                    "Auth failed (status " + response.getStatusCode() + ")");
        }

        authenticated = true;
        log.info("Logged in to daemon at {}", baseUri);
    }

    @Override
    public void submit(TorrentSource source) throws DaemonException {
        if (!authenticated) {
            throw new AuthenticationFailedException("Cannot add torrent before logging in");
        }

        MultipartEntityBuilder multipart = MultipartEntityBuilder.create()
                .setMode(HttpMultipartMode.LEGACY);
        source.addTo(multipart);

        HttpPost post = new HttpPost(endpoint(ADD_TORRENT_PATH));
        post.setEntity(multipart.build());

        log.debug("Submitting {} as part '{}'", source.describe(), source.getPartName());

        DaemonResponse response;
        try {
            response = send(post);
        } catch (IOException e) {
            throw new SubmissionRejectedException("Failed to reach daemon while adding torrent: " + e.getMessage(), e);
        }

        if (!response.isSuccess() || !SUCCESS_SENTINEL.equals(response.getBody())) {
            throw new SubmissionRejectedException(response.getStatusCode(), response.getBody());
        }

        log.info("Daemon accepted {}", source.describe());
    }

    @Override
    public String queryVersion() throws DaemonException {
        try {
            DaemonResponse response = send(new HttpGet(endpoint(VERSION_PATH)));
            if (!response.isSuccess()) {
                throw new DaemonException("Version query failed with status " + response.getStatusCode());
            }
            return response.getBody();
        } catch (IOException e) {
            throw new DaemonException("Version query failed: " + e.getMessage(), e);
        }
    }

    @Override
    public String getBaseUrl() {
        return baseUri.toString();
    }

    @Override
    public boolean isAuthenticated() {
        return authenticated;
    }

    @Override
    public void close() throws IOException {
        authenticated = false;
        httpClient.close();
    }

    private URI endpoint(String path) {
        return baseUri.resolve(path);
    }

    private DaemonResponse send(ClassicHttpRequest request) throws IOException {
        try (CloseableHttpResponse response = httpClient.execute(request)) {
            HttpEntity entity = response.getEntity();
            String body = entity != null ? EntityUtils.toString(entity, StandardCharsets.UTF_8) : "";
            log.debug("{} {} -> {} ({} chars)", request.getMethod(), request.getPath(), response.getCode(), body.length());
            return new DaemonResponse(response.getCode(), body);
        } catch (ParseException e) {
            throw new IOException("Unreadable daemon response", e);
        }
    }

    private static String formEncode(String value) {
        return URLEncoder.encode(value == null ? "" : value, StandardCharsets.UTF_8);
    }
}
