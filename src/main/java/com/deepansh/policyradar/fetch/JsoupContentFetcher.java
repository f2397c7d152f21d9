package com.deepansh.policyradar.fetch;

import com.deepansh.policyradar.config.RadarProperties;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Connection;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Fetches with Jsoup and extracts text: HTML through Jsoup's DOM, PDF through PDFBox,
 * plain text and JSON as-is.
 *
 * Redirects are followed by hand so every hop passes the {@link UrlSafetyPolicy}.
 */
@Component
@Slf4j
public class JsoupContentFetcher implements ContentFetcher {

    private static final int MAX_REDIRECTS = 5;

    private final UrlSafetyPolicy safetyPolicy;
    private final RadarProperties.Fetch props;
    private final int timeoutMs;
    private final PdfExtractor pdfExtractor;

    public JsoupContentFetcher(UrlSafetyPolicy safetyPolicy, RadarProperties properties) {
        this.safetyPolicy = safetyPolicy;
        this.props = properties.getFetch();
        this.timeoutMs = properties.getHttp().getReadTimeoutMs();
        this.pdfExtractor = new PdfExtractor(props.isExtractPdfImages());
    }

    @Override
    public FetchedContent fetch(String url) {
        URI target;
        try {
            target = safetyPolicy.check(url);
        } catch (UnsafeUrlException e) {
            return FetchedContent.failure(url, e.getMessage());
        }

        try {
            Connection.Response response = null;
            for (int hop = 0; hop <= MAX_REDIRECTS; hop++) {
                response = connect(target.toString()).execute();
                int status = response.statusCode();
                if (status >= 300 && status < 400 && response.hasHeader("Location")) {
                    target = safetyPolicy.check(target.resolve(response.header("Location")).toString());
                    log.debug("Following redirect to {}", target);
                    continue;
                }
                break;
            }
            return handle(target.toString(), response);
        } catch (UnsafeUrlException e) {
            return FetchedContent.failure(url, e.getMessage());
        } catch (IOException e) {
            log.warn("Fetch failed [url={}]: {}", url, e.getMessage());
            return FetchedContent.failure(url, "Fetch failed: " + e.getMessage());
        }
    }

    private Connection connect(String url) {
        return Jsoup.connect(url)
                .userAgent(props.getUserAgent())
                .timeout(timeoutMs)
                .followRedirects(false)
                .ignoreContentType(true)
                .ignoreHttpErrors(true)
                .maxBodySize((int) Math.min(Integer.MAX_VALUE, props.getMaxResponseBytes() + 1));
    }

    private FetchedContent handle(String url, Connection.Response response) {
        int status = response.statusCode();
        if (status == 429) {
            return FetchedContent.failure(url, "Rate limited (429). Please try again later.");
        }
        if (status >= 300) {
            return FetchedContent.failure(url, "HTTP " + status);
        }

        String declaredLength = response.header("Content-Length");
        if (declaredLength != null && parseLong(declaredLength) > props.getMaxResponseBytes()) {
            return tooLarge(url);
        }
        byte[] body = response.bodyAsBytes();
        if (body.length > props.getMaxResponseBytes()) {
            return tooLarge(url);
        }

        String contentType = response.contentType() == null ? "" : response.contentType().toLowerCase(Locale.ROOT);
        if (contentType.contains("application/pdf") || url.toLowerCase(Locale.ROOT).endsWith(".pdf") || looksLikePdf(body)) {
            return pdfExtractor.extract(url, body);
        }
        if (contentType.contains("html") || contentType.isEmpty()) {
            return extractHtml(url, new String(body, charsetOf(response)));
        }
        return new FetchedContent(url, null, new String(body, charsetOf(response)).trim(),
                FetchedContent.TYPE_TEXT, List.of(), null);
    }

    public static FetchedContent extractHtml(String url, String html) {
        Document doc = Jsoup.parse(html, url);
        doc.select("script,noscript,style,nav,header,footer,aside,form").remove();

        Elements bodies = doc.select("article, main, [role=main], #content, .content");
        if (bodies.isEmpty() && doc.body() != null) bodies = doc.body().children();

        String text = bodies.stream()
                .map(Element::text)
                .collect(Collectors.joining("\n"))
                .replace('\u00A0', ' ')
                .replaceAll("[ \\t]{2,}", " ")
                .trim();
        return new FetchedContent(url, doc.title(), text, FetchedContent.TYPE_HTML, List.of(), null);
    }

    private FetchedContent tooLarge(String url) {
        return FetchedContent.failure(url, "Response too large (limit " + props.getMaxResponseBytes() + " bytes).");
    }

    private static boolean looksLikePdf(byte[] body) {
        return body.length > 4 && body[0] == '%' && body[1] == 'P' && body[2] == 'D' && body[3] == 'F';
    }

    private static Charset charsetOf(Connection.Response response) {
        try {
            return response.charset() != null ? Charset.forName(response.charset()) : StandardCharsets.UTF_8;
        } catch (IllegalArgumentException e) {
            return StandardCharsets.UTF_8;
        }
    }

    private static long parseLong(String value) {
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            return -1;
        }
    }
}
