package org.netpreserve.hubfinder.validate;

import org.netpreserve.hubfinder.util.Url;

import java.util.List;

/**
 * @param title        document title
 * @param headings     text of h1 elements
 * @param linkCount    same-site links
 * @param navLinkCount links inside navigation elements
 * @param articleLinks distinct same-site article-shaped links outside navigation
 * @param articlePage  the page itself is a single article
 */
public record PageMetrics(
        String title,
        List<String> headings,
        int linkCount,
        int navLinkCount,
        List<Url> articleLinks,
        boolean articlePage) {
}
