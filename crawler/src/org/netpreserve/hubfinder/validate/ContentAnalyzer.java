package org.netpreserve.hubfinder.validate;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.netpreserve.hubfinder.util.Url;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Extracts the link structure of a page with jsoup.
 */
public class ContentAnalyzer {
    private static final String NAV_LINKS = "nav a[href], header a[href], [role=navigation] a[href], " +
                                            ".nav a[href], .navigation a[href], .menu a[href]";
    private static final int LONG_ARTICLE_TEXT = 1500;
    private static final int FEW_LINKS = 40;

    public PageMetrics analyze(Url pageUrl, String html) {
        Document doc = Jsoup.parse(html, pageUrl.toString());
        Url page = pageUrl.normalize();

        Elements navAnchors = doc.select(NAV_LINKS);
        Set<Element> navElements = new HashSet<>(navAnchors);
        int links = 0;
        var articleLinks = new LinkedHashSet<Url>();
        for (Element anchor : doc.select("a[href]")) {
            String href = anchor.absUrl("href");
            if (href.isEmpty()) continue;
            Url url = new Url(href);
            if (!url.isValid() || !url.sameSite(page)) continue;
            links++;
            if (navElements.contains(anchor)) continue;
            Url normalized = url.normalize();
            if (!normalized.equals(page) && UrlStructureCheck.looksLikeArticle(normalized)) {
                articleLinks.add(normalized);
            }
        }

        var headings = new ArrayList<String>();
        for (Element h1 : doc.select("h1")) headings.add(h1.text());

        return new PageMetrics(doc.title(), headings, links, navAnchors.size(), new ArrayList<>(articleLinks),
                isArticlePage(doc, links));
    }

    private static boolean isArticlePage(Document doc, int links) {
        Element ogType = doc.selectFirst("meta[property=og:type]");
        if (ogType != null && ogType.attr("content").equalsIgnoreCase("article")) return true;
        Elements articles = doc.select("article");
        return articles.size() == 1 && articles.first().text().length() >= LONG_ARTICLE_TEXT && links < FEW_LINKS;
    }
}
