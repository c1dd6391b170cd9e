package fun.fengwk.scraper.core.service.scrape.support;

import fun.fengwk.scraper.core.service.scrape.ScraperProperties;
import fun.fengwk.scraper.core.service.scrape.runtime.FetchException;
import fun.fengwk.scraper.core.service.scrape.runtime.PageParseException;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * {@link PageFetcher} over the JDK HttpClient, bodies parsed with jsoup.
 *
 * @author fengwk
 */
@Slf4j
@Component
public class HttpPageFetcher implements PageFetcher {

    private static final String ACCEPT = "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8";

    private static final Pattern CHARSET_PATTERN = Pattern.compile("(?i)\\bcharset=\\s*\"?([^\\s;\"]+)");

    private final HttpClient httpClient;
    private final ScraperProperties scraperProperties;

    @Autowired
    public HttpPageFetcher(ScraperProperties scraperProperties) {
        this(scraperProperties, HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(Duration.ofMillis(scraperProperties.getHttp().getConnectTimeoutMs()))
            .build());
    }

    public HttpPageFetcher(ScraperProperties scraperProperties, HttpClient httpClient) {
        this.scraperProperties = scraperProperties;
        this.httpClient = httpClient;
    }

    @Override
    public Document fetch(String url) {
        HttpRequest request;
        try {
            request = buildGetRequest(url);
        } catch (IllegalArgumentException ex) {
            throw new FetchException(url, ex);
        }

        HttpResponse<byte[]> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofByteArray());
        } catch (IOException ex) {
            throw new FetchException(url, ex);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new FetchException(url, ex);
        }

        int statusCode = response.statusCode();
        if (statusCode < 200 || statusCode >= 300) {
            throw new FetchException(url, statusCode);
        }

        String contentType = response.headers().firstValue("Content-Type").orElse("");
        if (!isDocumentContentType(contentType)) {
            throw new PageParseException(url, "unsupported content type: " + contentType);
        }

        String baseUri = response.uri() == null ? url : response.uri().toString();
        byte[] body = response.body() == null ? new byte[0] : response.body();
        log.debug("page fetched, url={}, status={}, bytes={}", url, statusCode, body.length);
        return parse(url, body, resolveCharset(contentType), baseUri);
    }

    private HttpRequest buildGetRequest(String url) {
        if (!StringUtils.hasText(url)) {
            throw new IllegalArgumentException("url is blank");
        }
        return HttpRequest.newBuilder(URI.create(url))
            .GET()
            .header("Accept", ACCEPT)
            .header("User-Agent", scraperProperties.getHttp().getUserAgent())
            .timeout(Duration.ofMillis(scraperProperties.getHttp().getRequestTimeoutMs()))
            .build();
    }

    private Document parse(String url, byte[] body, String charset, String baseUri) {
        try (InputStream input = new ByteArrayInputStream(body)) {
            return Jsoup.parse(input, charset, baseUri);
        } catch (IOException | IllegalArgumentException ex) {
            throw new PageParseException(url, ex);
        }
    }

    static boolean isDocumentContentType(String contentType) {
        if (!StringUtils.hasText(contentType)) {
            return true;
        }
        String normalized = contentType.toLowerCase(Locale.ROOT);
        return normalized.startsWith("text/") || normalized.contains("html") || normalized.contains("xml");
    }

    /**
     * Charset declared by the Content-Type header, null lets jsoup sniff the document.
     */
    static String resolveCharset(String contentType) {
        if (!StringUtils.hasText(contentType)) {
            return null;
        }
        Matcher matcher = CHARSET_PATTERN.matcher(contentType);
        return matcher.find() ? matcher.group(1).trim() : null;
    }

}
