package dev.markdown2pdf.source;

import dev.markdown2pdf.config.MarkdownSource;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.MalformedInputException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fetches Markdown text from a file, over HTTP, or straight from the command line.
 */
public class MarkdownSourceReader {

    private static final Logger LOGGER = LoggerFactory.getLogger(MarkdownSourceReader.class);
    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(30);

    private final HttpClient httpClient;

    public MarkdownSourceReader() {
        this(HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NORMAL)
                .connectTimeout(REQUEST_TIMEOUT)
                .build());
    }

    public MarkdownSourceReader(HttpClient httpClient) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
    }

    public String read(MarkdownSource source) {
        Objects.requireNonNull(source, "source");
        return switch (source.type()) {
            case PATH -> readFile(Path.of(source.value()));
            case URL -> fetch(URI.create(source.value()));
            case STRING -> source.value();
        };
    }

    private String readFile(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new InputSourceException("Markdown file not found: " + path);
        }
        try {
            String content = Files.readString(path, StandardCharsets.UTF_8);
            LOGGER.debug("Read {} characters from {}", content.length(), path);
            return content;
        } catch (MalformedInputException ex) {
            throw new InputSourceException("Markdown file is not valid UTF-8: " + path, ex);
        } catch (IOException ex) {
            throw new InputSourceException("Failed to read Markdown file " + path, ex);
        }
    }

    private String fetch(URI url) {
        HttpRequest request = HttpRequest.newBuilder(url)
                .header("Accept", "text/markdown, text/plain;q=0.9, */*;q=0.8")
                .timeout(REQUEST_TIMEOUT)
                .GET()
                .build();
        try {
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
            if (response.statusCode() >= 200 && response.statusCode() < 300) {
                LOGGER.debug("Fetched {} characters from {}", response.body().length(), url);
                return response.body();
            }
            throw new InputSourceException("Fetching " + url + " returned status " + response.statusCode());
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new InputSourceException("Interrupted while fetching " + url, ex);
        } catch (IOException ex) {
            throw new InputSourceException("Failed to fetch " + url, ex);
        }
    }
}
