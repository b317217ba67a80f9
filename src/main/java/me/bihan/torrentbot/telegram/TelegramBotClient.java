package me.bihan.torrentbot.telegram;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.log4j.Log4j2;
import me.bihan.torrentbot.chat.Attachment;
import me.bihan.torrentbot.chat.ChatTransport;
import me.bihan.torrentbot.chat.ChatUpdate;
import me.bihan.torrentbot.chat.InboundMessage;
import me.bihan.torrentbot.exception.FetchException;
import org.apache.hc.client5.http.classic.methods.HttpGet;
import org.apache.hc.client5.http.classic.methods.HttpPost;
import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.CloseableHttpResponse;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManagerBuilder;
import org.apache.hc.core5.http.ContentType;
import org.apache.hc.core5.http.HttpEntity;
import org.apache.hc.core5.http.io.entity.EntityUtils;
import org.apache.hc.core5.http.io.entity.StringEntity;
import org.apache.hc.core5.util.Timeout;

import java.io.Closeable;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Telegram Bot API transport: long-polls updates, sends replies and downloads documents.
 * The bot token is part of every URL, so URLs are never logged.
 */
@Log4j2
public class TelegramBotClient implements ChatTransport, Closeable {

    public static final String DEFAULT_API_URL = "https://api.telegram.org";

    private final String apiUrl;
    private final String token;
    private final CloseableHttpClient httpClient;
    private final ObjectMapper objectMapper;

    public TelegramBotClient(String apiUrl, String token, Duration requestTimeout, int pollTimeoutSeconds) {
        this.apiUrl = apiUrl.endsWith("/") ? apiUrl.substring(0, apiUrl.length() - 1) : apiUrl;
        this.token = token;
        this.httpClient = createHttpClient(requestTimeout.plusSeconds(pollTimeoutSeconds));
        this.objectMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    private static CloseableHttpClient createHttpClient(Duration timeout) {
        Timeout limit = Timeout.of(timeout);
        return HttpClients.custom()
                .setConnectionManager(PoolingHttpClientConnectionManagerBuilder.create()
                        .setDefaultConnectionConfig(ConnectionConfig.custom()
                                .setConnectTimeout(limit)
                                .setSocketTimeout(limit)
                                .build())
                        .build())
                .setDefaultRequestConfig(RequestConfig.custom()
                        .setResponseTimeout(limit)
                        .build())
                .build();
    }

    @Override
    public List<ChatUpdate> pollUpdates(long offset, int timeoutSeconds) throws IOException {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("offset", offset);
        params.put("timeout", timeoutSeconds);
        params.put("allowed_updates", List.of("message"));

        JavaType updateList = objectMapper.getTypeFactory().constructCollectionType(List.class, TelegramUpdate.class);
        List<TelegramUpdate> updates = call("getUpdates", params, updateList);

        List<ChatUpdate> result = new ArrayList<>();
        if (updates != null) {
            for (TelegramUpdate update : updates) {
                result.add(new ChatUpdate(update.getUpdateId(), toInboundMessage(update.getMessage())));
            }
        }
        return result;
    }

    @Override
    public void sendText(long chatId, String text) throws IOException {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("chat_id", chatId);
        params.put("text", text);
        call("sendMessage", params, objectMapper.constructType(TelegramMessage.class));
    }

    @Override
    public byte[] fetchAttachment(String fileRef) throws FetchException {
        TelegramFile file;
        try {
            file = call("getFile", Map.of("file_id", fileRef), objectMapper.constructType(TelegramFile.class));
        } catch (IOException e) {
            throw new FetchException("getFile failed: " + e.getMessage(), e);
        }
        if (file == null || file.getFilePath() == null || file.getFilePath().isBlank()) {
            throw new FetchException("Telegram returned no file path for the attachment");
        }

        HttpGet get = new HttpGet(apiUrl + "/file/bot" + token + "/" + file.getFilePath());
        try (CloseableHttpResponse response = httpClient.execute(get)) {
            HttpEntity entity = response.getEntity();
            if (response.getCode() < 200 || response.getCode() >= 300) {
                throw new FetchException("File download failed with status " + response.getCode());
            }
            if (entity == null) {
                throw new FetchException("Empty file download response");
            }
            byte[] content = EntityUtils.toByteArray(entity);
            log.debug("Downloaded file {} ({} bytes)", file.getFilePath(), content.length);
            return content;
        } catch (IOException e) {
            throw new FetchException("File download failed: " + e.getMessage(), e);
        }
    }

    @Override
    public void close() throws IOException {
        httpClient.close();
    }

    private <T> T call(String method, Map<String, Object> params, JavaType resultType) throws IOException {
        HttpPost post = new HttpPost(apiUrl + "/bot" + token + "/" + method);
        post.setEntity(new StringEntity(objectMapper.writeValueAsString(params), ContentType.APPLICATION_JSON));

        JavaType responseType = objectMapper.getTypeFactory().constructParametricType(TelegramResponse.class, resultType);

        try (CloseableHttpResponse response = httpClient.execute(post)) {
            HttpEntity entity = response.getEntity();
            if (entity == null) {
                throw new IOException("Empty response from Telegram for " + method);
            }
            byte[] body = EntityUtils.toByteArray(entity);
            TelegramResponse<T> parsed;
            try {
                parsed = objectMapper.readValue(body, responseType);
            } catch (IOException e) {
                throw new IOException("Unreadable Telegram response for " + method
                        + " (status " + response.getCode() + ")", e);
            }
            if (!parsed.isOk()) {
                throw new IOException("Telegram " + method + " failed: "
                        + parsed.getErrorCode() + " " + parsed.getDescription());
            }
            return parsed.getResult();
        }
    }

    static InboundMessage toInboundMessage(TelegramMessage message) {
        if (message == null || message.getChat() == null) {
            return null;
        }
        InboundMessage.InboundMessageBuilder builder = InboundMessage.builder()
                .chatId(message.getChat().getId())
                .text(message.getText());
        if (message.getFrom() != null) {
            builder.senderId(message.getFrom().getId());
        }
        if (message.getDocument() != null && message.getDocument().getFileId() != null) {
            builder.attachment(new Attachment(message.getDocument().getFileId(), message.getDocument().getFileName()));
        }
        return builder.build();
    }
}
