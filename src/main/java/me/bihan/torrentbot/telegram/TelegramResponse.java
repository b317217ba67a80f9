package me.bihan.torrentbot.telegram;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Envelope every Bot API method answers with.
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class TelegramResponse<T> {

    private boolean ok;
    private T result;
    private String description;
    @JsonProperty("error_code")
    private Integer errorCode;
}
