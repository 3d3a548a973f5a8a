package im.arun.epubparser.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Reading direction declared on the spine. {@link #UNSPECIFIED} marks a declared value
 * that is neither {@code ltr} nor {@code rtl}.
 */
public enum PageProgressionDirection {
    LTR("ltr"),
    RTL("rtl"),
    UNSPECIFIED("unspecified");

    private final String value;

    PageProgressionDirection(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Maps the attribute value; {@code null} means the attribute was absent.
     */
    public static PageProgressionDirection fromAttribute(String attribute) {
        if (attribute == null) {
            return LTR;
        }
        if (LTR.value.equals(attribute)) {
            return LTR;
        }
        if (RTL.value.equals(attribute)) {
            return RTL;
        }
        return UNSPECIFIED;
    }
}
