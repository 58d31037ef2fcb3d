package com.clapgrow.fleet.session.session;

import com.clapgrow.fleet.common.message.MessageContent;
import com.clapgrow.fleet.common.protocol.ProtocolClient;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import java.util.Set;

/**
 * Downloads message media through a protocol client and writes it to disk.
 */
@Component
@Slf4j
public class MediaSaver {

    private static final Set<String> MEDIA_TYPES = Set.of(
        MessageContent.IMAGE, MessageContent.VIDEO, MessageContent.AUDIO,
        MessageContent.STICKER, "documentMessage");

    private static final Map<String, String> EXTENSIONS = Map.of(
        "image/jpeg", "jpg",
        "image/png", "png",
        "image/webp", "webp",
        "video/mp4", "mp4",
        "audio/ogg", "ogg",
        "audio/mpeg", "mp3",
        "audio/mp4", "m4a",
        "application/pdf", "pdf");

    @Value("${fleet.media-dir:media}")
    private String mediaDir;

    public Path save(ProtocolClient client, JsonNode message, String baseName, boolean attachExtension) {
        String type = MessageContent.contentType(message)
            .filter(MEDIA_TYPES::contains)
            .orElseThrow(() -> new IllegalArgumentException("Message carries no downloadable media"));
        JsonNode media = message.get(type);
        byte[] bytes = client.downloadMedia(media, type.replace("Message", ""));

        String fileName = baseName;
        if (attachExtension) {
            fileName = baseName + "." + extension(media.path("mimetype").asText(""), bytes);
        }
        Path target = Paths.get(mediaDir).resolve(fileName);
        try {
            Files.createDirectories(target.getParent());
            Files.write(target, bytes);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write media to " + target, e);
        }
        log.debug("Saved {} bytes of {} to {}", bytes.length, type, target);
        return target;
    }

    /**
     * Extension for a mimetype, or sniffed from magic bytes when the mimetype is unknown.
     */
    static String extension(String mimetype, byte[] bytes) {
        String base = mimetype.split(";")[0].trim().toLowerCase();
        String known = EXTENSIONS.get(base);
        if (known != null) {
            return known;
        }
        return sniff(bytes);
    }

    private static String sniff(byte[] bytes) {
        if (startsWith(bytes, 0xFF, 0xD8, 0xFF)) {
            return "jpg";
        }
        if (startsWith(bytes, 0x89, 'P', 'N', 'G')) {
            return "png";
        }
        if (startsWith(bytes, 'R', 'I', 'F', 'F') && bytes.length > 11
            && bytes[8] == 'W' && bytes[9] == 'E' && bytes[10] == 'B' && bytes[11] == 'P') {
            return "webp";
        }
        if (startsWith(bytes, 'O', 'g', 'g', 'S')) {
            return "ogg";
        }
        if (startsWith(bytes, '%', 'P', 'D', 'F')) {
            return "pdf";
        }
        if (bytes.length > 7 && bytes[4] == 'f' && bytes[5] == 't' && bytes[6] == 'y' && bytes[7] == 'p') {
            return "mp4";
        }
        return "bin";
    }

    private static boolean startsWith(byte[] bytes, int... prefix) {
        if (bytes.length < prefix.length) {
            return false;
        }
        for (int i = 0; i < prefix.length; i++) {
            if ((bytes[i] & 0xFF) != prefix[i]) {
                return false;
            }
        }
        return true;
    }
}
