package org.netpreserve.hubfinder.fetch;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.netpreserve.hubfinder.util.Url;

import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.StandardCharsets;
import java.nio.charset.UnsupportedCharsetException;
import java.util.Locale;

/**
 * The response to a fetch.
 *
 * @param status          HTTP status code of the final response
 * @param url             the URL that was requested
 * @param finalUrl        the URL after following redirects
 * @param body            response body, never null
 * @param contentType     value of the Content-Type header, if any
 * @param fetchDurationMs wall-clock time taken by the fetch
 */
public record FetchResult(
        int status,
        @NotNull Url url,
        @NotNull Url finalUrl,
        byte[] body,
        @Nullable String contentType,
        long fetchDurationMs) {

    public boolean isSuccess() {
        return status >= 200 && status < 300;
    }

    public boolean isRedirected() {
        return !url.equals(finalUrl);
    }

    public boolean isHtml() {
        if (contentType == null) return true;
        String lower = contentType.toLowerCase(Locale.ROOT);
        return lower.startsWith("text/html") || lower.startsWith("application/xhtml");
    }

    public String bodyAsString() {
        return new String(body, charset());
    }

    private Charset charset() {
        if (contentType != null) {
            for (String param : contentType.split(";")) {
                String trimmed = param.trim();
                if (trimmed.regionMatches(true, 0, "charset=", 0, 8)) {
                    try {
                        return Charset.forName(trimmed.substring(8).replace("\"", ""));
                    } catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
                        break;
                    }
                }
            }
        }
        return StandardCharsets.UTF_8;
    }
}
