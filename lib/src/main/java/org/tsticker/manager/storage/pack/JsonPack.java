package org.tsticker.manager.storage.pack;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * On disk layout of index.json.
 */
public record JsonPack(
        @JsonProperty("title") String title,
        @JsonProperty("name") String name,
        @JsonProperty("sticker_type") String stickerType,
        @JsonProperty("operator_id") String operatorId,
        @JsonProperty("lock_ns") String lockNs,
        @JsonProperty("emotes") List<JsonEmote> emotes
) {

    public record JsonEmote(@JsonProperty("emoji") String emoji, @JsonProperty("file_id") String fileId) {}
}
