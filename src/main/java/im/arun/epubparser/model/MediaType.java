package im.arun.epubparser.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.HashMap;
import java.util.Map;

/**
 * Media types found in EPUB manifests. Anything not listed maps to {@link #UNKNOWN}.
 */
public enum MediaType {
    GIF("image/gif"),
    JPEG("image/jpeg"),
    PNG("image/png"),
    SVG("image/svg+xml"),
    WEBP("image/webp"),
    XHTML("application/xhtml+xml"),
    HTML("text/html"),
    OEB1_DOCUMENT("text/x-oeb1-document"),
    DTBOOK("application/x-dtbook+xml"),
    NCX("application/x-dtbncx+xml"),
    OPF("application/oebps-package+xml"),
    XML("application/xml"),
    CSS("text/css"),
    OEB1_CSS("text/x-oeb1-css"),
    JAVASCRIPT("application/javascript"),
    TEXT_JAVASCRIPT("text/javascript"),
    ECMASCRIPT("application/ecmascript"),
    OPENTYPE("application/vnd.ms-opentype"),
    FONT_OTF("font/otf"),
    FONT_TTF("font/ttf"),
    FONT_SFNT("application/font-sfnt"),
    X_FONT_TTF("application/x-font-ttf"),
    WOFF("application/font-woff"),
    FONT_WOFF("font/woff"),
    WOFF2("font/woff2"),
    MEDIA_OVERLAYS("application/smil+xml"),
    PLS("application/pls+xml"),
    MP3("audio/mpeg"),
    MP4_AUDIO("audio/mp4"),
    MP4_VIDEO("video/mp4"),
    PDF("application/pdf"),
    UNKNOWN("unknown");

    private static final Map<String, MediaType> BY_VALUE = new HashMap<>();

    static {
        for (MediaType type : values()) {
            if (type != UNKNOWN) {
                BY_VALUE.put(type.value, type);
            }
        }
    }

    private final String value;

    MediaType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static MediaType fromValue(String value) {
        if (value == null) {
            return UNKNOWN;
        }
        return BY_VALUE.getOrDefault(value.trim(), UNKNOWN);
    }
}
