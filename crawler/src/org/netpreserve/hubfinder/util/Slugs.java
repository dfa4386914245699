package org.netpreserve.hubfinder.util;

import org.apache.commons.lang3.StringUtils;

import java.util.Locale;

public final class Slugs {
    private Slugs() {
    }

    /**
     * Lower-case, accent-stripped, hyphen-separated form of a name as it usually appears in a URL path.
     * "Côte d'Ivoire" becomes "cote-d-ivoire".
     */
    public static String slugify(String name) {
        if (name == null) return "";
        String stripped = StringUtils.stripAccents(name).toLowerCase(Locale.ROOT);
        var builder = new StringBuilder(stripped.length());
        boolean pendingHyphen = false;
        for (int i = 0; i < stripped.length(); i++) {
            char c = stripped.charAt(i);
            if ((c >= 'a' && c <= 'z') || (c >= '0' && c <= '9')) {
                if (pendingHyphen && !builder.isEmpty()) builder.append('-');
                builder.append(c);
                pendingHyphen = false;
            } else {
                pendingHyphen = true;
            }
        }
        return builder.toString();
    }
}
