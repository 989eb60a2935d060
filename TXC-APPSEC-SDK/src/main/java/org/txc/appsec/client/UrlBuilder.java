package org.txc.appsec.client;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds API paths one encoded segment at a time; query parameters keep insertion order.
 */
public final class UrlBuilder {
    private final StringBuilder path;
    private final List<String> query = new ArrayList<>();

    private UrlBuilder(String root) {
        this.path = new StringBuilder(root);
    }

    public static UrlBuilder root(String root) {
        return new UrlBuilder(root);
    }

    public UrlBuilder segment(Object value) {
        path.append('/').append(encode(String.valueOf(value)));
        return this;
    }

    public UrlBuilder query(String name, Object value) {
        query.add(encode(name) + "=" + encode(String.valueOf(value)));
        return this;
    }

    /**
     * Appends the parameter only if {@code value} is non-null and non-blank.
     */
    public UrlBuilder queryIfPresent(String name, String value) {
        if (value != null && !value.isBlank()) {
            query(name, value);
        }
        return this;
    }

    public String build() {
        return query.isEmpty() ? path.toString() : path + "?" + String.join("&", query);
    }

    private static String encode(String raw) {
        return URLEncoder.encode(raw, StandardCharsets.UTF_8).replace("+", "%20");
    }
}
