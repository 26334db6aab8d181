package net.spookly.ringprobe.node;

import java.util.Locale;

/**
 * Dimensions a probe request can filter vantage points on.
 */
public enum FilterField {
    NODE("node"),
    ASN("asn"),
    CITY("city"),
    COUNTRY_CODE("countrycode"),
    CONTINENT("continent"),
    COMPANY("company");

    private final String paramName;

    FilterField(String paramName) {
        this.paramName = paramName;
    }

    /**
     * Query parameter name used by the HTTP boundary.
     */
    public String paramName() {
        return paramName;
    }

    /**
     * Value of this dimension for the point, or null when the point has none.
     */
    public String valueOf(VantagePoint point) {
        switch (this) {
            case NODE:
                return point.shortName();
            case ASN:
                return point.asn() == null ? null : String.valueOf(point.asn());
            case CITY:
                return point.city();
            case COUNTRY_CODE:
                return point.countryCode();
            case CONTINENT:
                return point.continent();
            case COMPANY:
                return point.company();
            default:
                throw new IllegalStateException("unhandled field " + this);
        }
    }

    public static FilterField fromParam(String name) {
        if (name == null) {
            return null;
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (FilterField field : values()) {
            if (field.paramName.equals(normalized)) {
                return field;
            }
        }
        return null;
    }
}
