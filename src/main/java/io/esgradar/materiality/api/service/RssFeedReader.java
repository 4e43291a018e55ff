package io.esgradar.materiality.api.service;

import com.rometools.rome.feed.synd.SyndEntry;
import com.rometools.rome.io.FeedException;
import com.rometools.rome.io.SyndFeedInput;
import io.esgradar.materiality.api.dto.analysis.Article;
import io.esgradar.materiality.api.dto.analysis.SentimentLabel;
import io.esgradar.materiality.api.exception.ErrorCategory;
import io.esgradar.materiality.config.HttpConfig;
import io.esgradar.materiality.config.RssConfig;
import org.apache.commons.codec.digest.DigestUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.io.StringReader;
import java.net.ConnectException;
import java.net.HttpURLConnection;
import java.net.MalformedURLException;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.net.URI;
import java.net.UnknownHostException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.Collections;
import java.util.Date;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.zip.GZIPInputStream;

/**
 * Downloads one RSS/Atom feed and converts its entries into unlabelled articles.
 */
@Service
public class RssFeedReader {

    private static final Logger logger = LoggerFactory.getLogger(RssFeedReader.class);
    private static final String FEED_ACCEPT =
            "application/rss+xml, application/atom+xml, application/xml, text/xml;q=0.9, */*;q=0.8";

    private final HttpConfig http;
    private final Clock clock;
    private final AtomicInteger userAgentIndex = new AtomicInteger();

    public RssFeedReader(RssConfig rssConfig, Clock clock) {
        this.http = rssConfig.http();
        this.clock = clock;
    }

    /**
     * Reads a feed, retrying transient failures with exponential backoff.
     *
     * @param url    feed URL
     * @param source name recorded on every article
     * @throws RssParsingException once retries are exhausted or on a permanent failure
     */
    @Retryable(
            retryFor = RssParsingException.class,
            exceptionExpression = "category.isTransient()",
            maxAttemptsExpression = "#{@retryProps.maxAttempts}",
            backoff = @Backoff(delayExpression = "#{@retryProps.retryDelay}", multiplier = 2.0, maxDelay = 10000)
    )
    public List<Article> read(String url, String source) throws RssParsingException {
        if (url == null || url.isBlank()) {
            throw new RssParsingException("Feed " + source + " has no URL", ErrorCategory.INVALID_URL);
        }
        logger.debug("Reading feed {} from {}", source, url);

        HttpURLConnection connection = null;
        try {
            connection = open(url.trim());
            int status = connection.getResponseCode();
            ErrorCategory failure = categorize(status);
            if (failure != null) {
                throw new RssParsingException("Feed " + source + " answered " + status, failure);
            }

            String contentType = connection.getContentType();
            if (contentType != null && !isFeedContentType(contentType)) {
                logger.warn("Feed {} served unexpected content type {}", source, contentType);
            }
            return parseFeed(connection, source);

        } catch (IllegalArgumentException | MalformedURLException e) {
            throw new RssParsingException("Feed " + source + " has a malformed URL: " + url, e, ErrorCategory.INVALID_URL);
        } catch (IOException e) {
            throw new RssParsingException("Feed " + source + " unreachable: " + e.getMessage(), e, categorize(e));
        } finally {
            if (connection != null) {
                connection.disconnect();
            }
        }
    }

    private HttpURLConnection open(String url) throws IOException {
        HttpURLConnection connection = (HttpURLConnection) URI.create(url).toURL().openConnection();
        connection.setConnectTimeout(http.connectTimeout());
        connection.setReadTimeout(http.readTimeout());
        connection.setInstanceFollowRedirects(true);
        connection.setUseCaches(false);

        connection.setRequestProperty("User-Agent", http.userAgent(userAgentIndex.getAndIncrement()));
        connection.setRequestProperty("Accept", FEED_ACCEPT);
        connection.setRequestProperty("Accept-Language", "ko-KR,ko;q=0.9,en-US;q=0.8");
        connection.setRequestProperty("Accept-Encoding", "gzip");
        connection.connect();
        return connection;
    }

    /**
     * Maps an HTTP status to a failure category, or {@code null} when the body can be read.
     */
    static ErrorCategory categorize(int status) {
        if (status < 400) return null;

        return switch (status) {
            case HttpURLConnection.HTTP_UNAUTHORIZED -> ErrorCategory.AUTH_REQUIRED;
            case HttpURLConnection.HTTP_FORBIDDEN -> ErrorCategory.ACCESS_FORBIDDEN;
            case HttpURLConnection.HTTP_NOT_FOUND -> ErrorCategory.NOT_FOUND;
            case 429 -> ErrorCategory.RATE_LIMITED;
            case HttpURLConnection.HTTP_INTERNAL_ERROR -> ErrorCategory.SERVER_ERROR;
            case HttpURLConnection.HTTP_BAD_GATEWAY, HttpURLConnection.HTTP_UNAVAILABLE,
                    HttpURLConnection.HTTP_GATEWAY_TIMEOUT -> ErrorCategory.SERVER_UNAVAILABLE;
            default -> ErrorCategory.HTTP_ERROR;
        };
    }

    static ErrorCategory categorize(IOException e) {
        // subclasses first: ConnectException is a SocketException
        if (e instanceof SocketTimeoutException) return ErrorCategory.TIMEOUT;
        if (e instanceof ConnectException) return ErrorCategory.CONNECTION_REFUSED;
        if (e instanceof UnknownHostException) return ErrorCategory.DNS_ERROR;
        if (e instanceof SocketException) return ErrorCategory.NETWORK_ERROR;
        return ErrorCategory.IO_ERROR;
    }

    private List<Article> parseFeed(HttpURLConnection connection, String source) throws IOException, RssParsingException {
        InputStream inputStream = connection.getInputStream();
        if ("gzip".equalsIgnoreCase(connection.getContentEncoding())) {
            inputStream = new GZIPInputStream(inputStream);
        }

        String xml;
        try (InputStream in = inputStream) {
            xml = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }

        try {
            var feed = new SyndFeedInput().build(new StringReader(xml));

            if (feed.getEntries() == null || feed.getEntries().isEmpty()) {
                logger.warn("Feed {} has no entries", source);
                return Collections.emptyList();
            }

            return feed.getEntries().stream()
                    .map(entry -> toArticle(entry, source))
                    .filter(Objects::nonNull)
                    .toList();

        } catch (FeedException | IllegalArgumentException e) {
            throw new RssParsingException("Feed parsing error: " + e.getMessage(), e, ErrorCategory.PARSE_ERROR);
        }
    }

    private Article toArticle(SyndEntry entry, String source) {
        String title = entry.getTitle() != null ? cleanText(entry.getTitle()) : "";
        String link = entry.getLink() != null ? entry.getLink().trim() : "";

        if (title.isBlank() || link.isBlank()) {
            logger.debug("Skipping entry with missing title or link: title='{}', link='{}'", title, link);
            return null;
        }

        String description = entry.getDescription() != null ? cleanText(entry.getDescription().getValue()) : "";
        String content = entry.getContents() == null ? "" : entry.getContents().stream()
                .map(item -> cleanText(item.getValue()))
                .reduce((first, second) -> first + " " + second)
                .orElse("");

        return new Article(
                DigestUtils.sha1Hex(link),
                title,
                description,
                content,
                link,
                source,
                publishedAt(entry),
                SentimentLabel.NEUTRAL,
                0.0,
                Set.of(),
                1
        );
    }

    private LocalDateTime publishedAt(SyndEntry entry) {
        Date date = entry.getPublishedDate() != null ? entry.getPublishedDate() : entry.getUpdatedDate();
        if (date == null) return LocalDateTime.now(clock);

        return date.toInstant().atZone(ZoneId.systemDefault()).toLocalDateTime();
    }

    private boolean isFeedContentType(String contentType) {
        String lower = contentType.toLowerCase(Locale.ROOT);
        return lower.contains("xml") || lower.contains("rss") || lower.contains("atom") || lower.contains("text");
    }

    static String cleanText(String text) {
        if (text == null) return "";

        return text
                .replaceAll("<[^>]+>", " ")
                .replaceAll("&[a-zA-Z0-9#]+;", " ")
                .replaceAll("\\s+", " ")
                .trim();
    }

    public static class RssParsingException extends Exception {
        private final ErrorCategory category;

        public RssParsingException(String message, ErrorCategory category) {
            super(message);
            this.category = category;
        }

        public RssParsingException(String message, Throwable cause, ErrorCategory category) {
            super(message, cause);
            this.category = category;
        }

        public ErrorCategory getCategory() {
            return category;
        }
    }
}
