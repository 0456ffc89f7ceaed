package com.pagepilot.providers.chat;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A base64 image split out of a {@code data:} URL, for providers that take raw bytes.
 */
public final class InlineImage {

    private static final Pattern DATA_URL = Pattern.compile("^data:([^;]+);base64,(.+)$", Pattern.CASE_INSENSITIVE | Pattern.DOTALL);

    private final String mimeType;
    private final String base64;

    private InlineImage(String mimeType, String base64) {
        this.mimeType = mimeType;
        this.base64 = base64;
    }

    /**
     * @return the parsed image, or null when the value is not a base64 data URL
     */
    public static InlineImage fromDataUrl(String dataUrl) {
        if (dataUrl == null) {
            return null;
        }
        Matcher matcher = DATA_URL.matcher(dataUrl.trim());
        if (!matcher.matches()) {
            return null;
        }
        String mime = matcher.group(1).isBlank() ? "image/jpeg" : matcher.group(1).trim();
        String data = matcher.group(2).trim();
        if (data.isEmpty()) {
            return null;
        }
        return new InlineImage(mime, data);
    }

    public String getMimeType() {
        return mimeType;
    }

    public String getBase64() {
        return base64;
    }

    /**
     * Converse API image format, or null for mime types Bedrock does not accept.
     */
    public String getBedrockFormat() {
        String mime = mimeType.toLowerCase(Locale.ROOT);
        if (mime.contains("png")) return "png";
        if (mime.contains("jpeg") || mime.contains("jpg")) return "jpeg";
        if (mime.contains("webp")) return "webp";
        if (mime.contains("gif")) return "gif";
        return null;
    }
}
