package me.bihan.torrentbot.telegram;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Result of {@code getFile}. The path is missing when the file can no longer be downloaded.
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class TelegramFile {

    @JsonProperty("file_path")
    private String filePath;
}
