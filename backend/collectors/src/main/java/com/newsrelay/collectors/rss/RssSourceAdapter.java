package com.newsrelay.collectors.rss;

import com.newsrelay.collectors.api.ParseFailureException;
import com.newsrelay.collectors.api.SourceAdapter;
import com.newsrelay.core.model.Article;
import com.newsrelay.core.model.SourceConfig;
import com.newsrelay.core.model.SourceKind;
import com.newsrelay.core.util.HtmlUtils;
import com.newsrelay.core.util.Timestamps;
import org.jsoup.Jsoup;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.ErrorHandler;
import org.xml.sax.InputSource;
import org.xml.sax.SAXParseException;

import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Reads RSS 2.0 / RSS 1.0 {@code item}s and Atom {@code entry}s. Entries lacking a title
 * or link are dropped.
 */
public class RssSourceAdapter implements SourceAdapter {
    private static final Logger LOGGER = Logger.getLogger(RssSourceAdapter.class.getName());
    public static final int SUMMARY_LIMIT = 300;

    private static final List<String> SUMMARY_TAGS = List.of("description", "summary", "content:encoded", "content");
    private static final List<String> DATE_TAGS = List.of("pubDate", "published", "updated", "dc:date");

    @Override
    public SourceKind kind() {
        return SourceKind.RSS;
    }

    @Override
    public List<Article> parse(String payload, SourceConfig source, String baseUrl) {
        Document document = readDocument(payload, source.sourceName());
        Element root = document.getDocumentElement();
        String rootName = root.getTagName().toLowerCase(Locale.ROOT);
        boolean atom = "feed".equals(rootName);
        if (!atom && !"rss".equals(rootName) && !"rdf:rdf".equals(rootName)) {
            throw new ParseFailureException(source.sourceName(), "Unsupported feed root element <" + root.getTagName() + ">");
        }

        NodeList entries = document.getElementsByTagName(atom ? "entry" : "item");
        List<Article> articles = new ArrayList<>();
        for (int i = 0; i < entries.getLength(); i++) {
            if (!(entries.item(i) instanceof Element entry)) {
                continue;
            }
            try {
                toArticle(entry, atom, source).ifPresent(articles::add);
            } catch (RuntimeException e) {
                LOGGER.log(Level.FINE, "Skipping malformed entry " + i + " of " + source.sourceName(), e);
            }
        }
        return articles;
    }

    private Optional<Article> toArticle(Element entry, boolean atom, SourceConfig source) {
        String title = childText(entry, "title").map(RssSourceAdapter::plainText).orElse("");
        String link = (atom ? atomLink(entry) : childText(entry, "link")).orElse("");
        if (title.isBlank() || link.isBlank()) {
            return Optional.empty();
        }

        List<String> rawBodies = new ArrayList<>();
        for (String tag : SUMMARY_TAGS) {
            childText(entry, tag).ifPresent(rawBodies::add);
        }
        String summary = rawBodies.stream()
                .map(RssSourceAdapter::plainText)
                .filter(text -> !text.isBlank())
                .findFirst()
                .map(text -> HtmlUtils.truncate(text, SUMMARY_LIMIT))
                .orElse(null);

        String rawPublished = DATE_TAGS.stream()
                .map(tag -> childText(entry, tag))
                .flatMap(Optional::stream)
                .filter(value -> !value.isBlank())
                .findFirst()
                .orElse(null);

        String imageUrl = mediaImage(entry)
                .or(() -> enclosureImage(entry))
                .or(() -> rawBodies.stream()
                        .map(HtmlUtils::firstImageSource)
                        .flatMap(Optional::stream)
                        .findFirst())
                .orElse(null);

        return Optional.of(Article.of(
                title,
                link.trim(),
                summary,
                Timestamps.parse(rawPublished).orElse(null),
                rawPublished,
                source.section(),
                imageUrl,
                source.sourceName()
        ));
    }

    /**
     * Feed text is often HTML inside CDATA; entities are decoded exactly once, so
     * {@code &amp;lt;} stays {@code &lt;}.
     */
    static String plainText(String html) {
        if (html == null || html.isBlank()) {
            return "";
        }
        return HtmlUtils.normalizeWhitespace(Jsoup.parseBodyFragment(html).text().replace('\u00a0', ' '));
    }

    static Optional<String> mediaImage(Element entry) {
        NodeList contents = entry.getElementsByTagName("media:content");
        for (int i = 0; i < contents.getLength(); i++) {
            Element content = (Element) contents.item(i);
            String type = content.getAttribute("type").toLowerCase(Locale.ROOT);
            String medium = content.getAttribute("medium").toLowerCase(Locale.ROOT);
            String url = content.getAttribute("url");
            if (!url.isBlank() && (type.startsWith("image") || "image".equals(medium))) {
                return Optional.of(url.trim());
            }
        }
        NodeList thumbnails = entry.getElementsByTagName("media:thumbnail");
        for (int i = 0; i < thumbnails.getLength(); i++) {
            String url = ((Element) thumbnails.item(i)).getAttribute("url");
            if (!url.isBlank()) {
                return Optional.of(url.trim());
            }
        }
        return Optional.empty();
    }

    static Optional<String> enclosureImage(Element entry) {
        NodeList enclosures = entry.getElementsByTagName("enclosure");
        for (int i = 0; i < enclosures.getLength(); i++) {
            Element enclosure = (Element) enclosures.item(i);
            String url = enclosure.getAttribute("url");
            if (!url.isBlank() && enclosure.getAttribute("type").toLowerCase(Locale.ROOT).startsWith("image")) {
                return Optional.of(url.trim());
            }
        }
        return Optional.empty();
    }

    private static Optional<String> atomLink(Element entry) {
        NodeList links = entry.getElementsByTagName("link");
        String fallback = null;
        for (int i = 0; i < links.getLength(); i++) {
            Element link = (Element) links.item(i);
            String href = link.getAttribute("href");
            if (href.isBlank()) {
                continue;
            }
            String rel = link.getAttribute("rel");
            if (rel.isBlank() || "alternate".equals(rel)) {
                return Optional.of(href);
            }
            if (fallback == null) {
                fallback = href;
            }
        }
        return Optional.ofNullable(fallback);
    }

    private static Optional<String> childText(Element parent, String tagName) {
        NodeList children = parent.getElementsByTagName(tagName);
        if (children.getLength() == 0) {
            return Optional.empty();
        }
        Node node = children.item(0);
        String text = node.getTextContent();
        return text == null ? Optional.empty() : Optional.of(text.trim());
    }

    private static Document readDocument(String xml, String sourceName) {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
            factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
            factory.setExpandEntityReferences(false);

            DocumentBuilder builder = factory.newDocumentBuilder();
            builder.setErrorHandler(new ErrorHandler() {
                @Override
                public void warning(SAXParseException exception) {
                    LOGGER.fine("XML warning for " + sourceName + ": " + exception.getMessage());
                }

                @Override
                public void error(SAXParseException exception) throws SAXParseException {
                    throw exception;
                }

                @Override
                public void fatalError(SAXParseException exception) throws SAXParseException {
                    throw exception;
                }
            });
            Document document = builder.parse(new InputSource(new StringReader(xml.trim())));
            if (document.getDocumentElement() == null) {
                throw new ParseFailureException(sourceName, "Empty feed document");
            }
            return document;
        } catch (ParseFailureException e) {
            throw e;
        } catch (Exception e) {
            throw new ParseFailureException(sourceName, "Invalid RSS/Atom XML for source " + sourceName, e);
        }
    }
}
