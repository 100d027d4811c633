package de.bsommerfeld.toolvault.mirror.download;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * HTTP download utility built on {@link HttpClient}.
 *
 * <p>
 * Two modes: streaming to a file (through a {@code .tmp} sibling that is
 * atomically renamed on success) and small UTF-8 documents such as mirror
 * manifests. Redirects are followed, since mirror archive URLs commonly
 * bounce to a CDN.
 *
 * <p>
 * This class does not consult the offline gate. Callers check
 * {@code OfflineEnforcer.guardNetworkCall} before every call.
 */
public final class Downloader {

    private static final int BUFFER_SIZE = 8192;

    private static final HttpClient HTTP = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .build();

    private Downloader() {
    }

    /**
     * Downloads a URL to the given target file. A partially transferred file
     * never appears under the target name.
     *
     * @throws IOException on connection failures, non-2xx responses, or write errors
     */
    public static void toFile(String url, Path target, DownloadProgressListener listener) throws IOException {
        HttpResponse<InputStream> response = send(url);
        long totalBytes = response.headers()
                .firstValueAsLong("Content-Length")
                .orElse(-1);

        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }

        Path temp = target.resolveSibling(target.getFileName() + ".tmp");
        try (InputStream in = response.body()) {
            transferWithProgress(in, temp, totalBytes, listener);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } finally {
            Files.deleteIfExists(temp);
        }
    }

    /**
     * Downloads a small document as UTF-8 text. No progress is reported.
     */
    public static String toString(String url) throws IOException {
        HttpResponse<InputStream> response = send(url);
        try (InputStream in = response.body()) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    private static HttpResponse<InputStream> send(String url) throws IOException {
        URI uri;
        try {
            uri = URI.create(url);
        } catch (IllegalArgumentException e) {
            throw new IOException("Invalid URL: " + url, e);
        }

        try {
            HttpRequest request = HttpRequest.newBuilder(uri).GET().build();
            HttpResponse<InputStream> response = HTTP.send(request, HttpResponse.BodyHandlers.ofInputStream());
            if (!isSuccess(response.statusCode())) {
                response.body().close();
                throw new IOException("HTTP " + response.statusCode() + " for " + url);
            }
            return response;
        } catch (IllegalArgumentException e) {
            throw new IOException("Unsupported URL: " + url, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Download interrupted: " + url, e);
        }
    }

    private static void transferWithProgress(InputStream in, Path target, long totalBytes,
            DownloadProgressListener listener) throws IOException {
        try (OutputStream out = Files.newOutputStream(target)) {
            byte[] buffer = new byte[BUFFER_SIZE];
            long transferred = 0;
            int read;
            while ((read = in.read(buffer)) != -1) {
                out.write(buffer, 0, read);
                transferred += read;
                listener.onProgress(transferred, totalBytes);
            }
        }
    }

    /** 2xx only; redirects are resolved by the client before we see them. */
    static boolean isSuccess(int status) {
        return status >= 200 && status < 300;
    }
}
