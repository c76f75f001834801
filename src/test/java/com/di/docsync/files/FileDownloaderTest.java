package com.di.docsync.files;

import com.di.docsync.config.FileProperties;
import com.di.docsync.config.RetrySettings;
import com.di.docsync.exception.DownloadException;
import com.di.docsync.exception.ObjectNotFoundException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@DisplayName("FileDownloader Tests")
class FileDownloaderTest {

    private static final String URL = "https://cdn.example.com/p/9/site.jpg?sig=abc";

    @TempDir
    Path downloadDir;

    private ObjectStoreClient urlClient;
    private ObjectStoreClient keyClient;
    private FileDownloader downloader;

    @BeforeEach
    void setUp() {
        urlClient = mock(ObjectStoreClient.class);
        keyClient = mock(ObjectStoreClient.class);
        downloader = new FileDownloader(properties(), urlClient, keyClient, null);
    }

    @AfterEach
    void tearDown() {
        downloader.close();
    }

    private FileProperties properties() {
        FileProperties properties = new FileProperties();
        properties.setDownloadDir(downloadDir.toString());
        properties.setDownloadWorkers(2);
        properties.setMaxFileSizeBytes(1024);
        properties.setSupportedExtensions(List.of("pdf", ".JPG", "png"));
        RetrySettings retry = RetrySettings.of(3, 1);
        retry.setMaxBackoffMs(5);
        properties.setRetry(retry);
        return properties;
    }

    private static DetectedFile file(String key, String url, String filename, Long size) {
        return new DetectedFile(key, url, "photos", "9", "s3_key", null, filename, size);
    }

    // ============================================================================
    // Skip policy
    // ============================================================================

    @Test
    @DisplayName("Should skip unsupported file types without fetching")
    void testDownload_UnsupportedType() {
        DownloadResult result = downloader.download(file("a/tool.exe", URL, "tool.exe", null));

        assertEquals(DownloadStatus.SKIPPED, result.status());
        assertTrue(result.reason().contains("exe"));
        verifyNoInteractions(urlClient, keyClient);
    }

    @Test
    @DisplayName("Should skip files whose declared size exceeds the ceiling")
    void testDownload_DeclaredTooLarge() {
        DownloadResult result = downloader.download(file("a/big.pdf", URL, "big.pdf", 4096L));

        assertEquals(DownloadStatus.SKIPPED, result.status());
        verifyNoInteractions(urlClient, keyClient);
    }

    @Test
    @DisplayName("Should not skip files without an extension")
    void testCheckSkipPolicy_NoExtension() {
        assertTrue(downloader.checkSkipPolicy(file("a/README", URL, "README", null)).isEmpty());
    }

    // ============================================================================
    // Fetching
    // ============================================================================

    @Test
    @DisplayName("Should prefer the pre-authorized URL and write under table/row")
    void testDownload_ByUrl() throws Exception {
        when(urlClient.fetch(URL)).thenReturn(new byte[]{1, 2, 3});

        DownloadResult result = downloader.download(file("12/345/photos/9/site.jpg", URL, "site.jpg", null));

        assertEquals(DownloadStatus.SUCCESS, result.status());
        assertEquals(3, result.bytes());
        Path written = downloadDir.resolve("photos").resolve("9")
                .resolve(FileDownloader.referenceDigest("12/345/photos/9/site.jpg") + "_site.jpg");
        assertEquals(written.toString(), result.localPath());
        assertArrayEquals(new byte[]{1, 2, 3}, Files.readAllBytes(written));
        verifyNoInteractions(keyClient);
    }

    @Test
    @DisplayName("Should fall back to the object store for a bare key")
    void testDownload_ByKey() {
        when(keyClient.fetch("12/345/a.pdf")).thenReturn(new byte[]{9});

        DownloadResult result = downloader.download(file("12/345/a.pdf", null, "a.pdf", null));

        assertEquals(DownloadStatus.SUCCESS, result.status());
        verify(keyClient).fetch("12/345/a.pdf");
    }

    @Test
    @DisplayName("Should fail a bare key when no object store is configured")
    void testDownload_NoKeyClient() {
        try (FileDownloader urlOnly = new FileDownloader(properties(), urlClient, null, null)) {
            DownloadResult result = urlOnly.download(file("12/345/a.pdf", null, "a.pdf", null));

            assertEquals(DownloadStatus.FAILED, result.status());
            verifyNoInteractions(urlClient);
        }
    }

    @Test
    @DisplayName("Should not retry a missing object")
    void testDownload_NotFound() {
        when(urlClient.fetch(URL)).thenThrow(new ObjectNotFoundException(URL));

        DownloadResult result = downloader.download(file(null, URL, "site.jpg", null));

        assertEquals(DownloadStatus.FAILED, result.status());
        verify(urlClient, times(1)).fetch(URL);
    }

    @Test
    @DisplayName("Should retry transient download failures")
    void testDownload_RetriesThenSucceeds() {
        when(urlClient.fetch(URL))
                .thenThrow(new DownloadException("HTTP 503"))
                .thenThrow(new DownloadException("HTTP 503"))
                .thenReturn(new byte[]{7});

        DownloadResult result = downloader.download(file(null, URL, "site.jpg", null));

        assertEquals(DownloadStatus.SUCCESS, result.status());
        verify(urlClient, times(3)).fetch(URL);
    }

    @Test
    @DisplayName("Should report failure once retries are exhausted")
    void testDownload_RetriesExhausted() {
        when(urlClient.fetch(anyString())).thenThrow(new DownloadException("HTTP 500"));

        DownloadResult result = downloader.download(file(null, URL, "site.jpg", null));

        assertEquals(DownloadStatus.FAILED, result.status());
        verify(urlClient, times(3)).fetch(URL);
    }

    @Test
    @DisplayName("Should skip fetched content over the size ceiling")
    void testDownload_FetchedTooLarge() {
        when(urlClient.fetch(URL)).thenReturn(new byte[2048]);

        DownloadResult result = downloader.download(file(null, URL, "site.jpg", null));

        assertEquals(DownloadStatus.SKIPPED, result.status());
        assertFalse(Files.exists(downloader.targetPath(file(null, URL, "site.jpg", null))));
    }

    @Test
    @DisplayName("Should keep same-named objects on one row in separate files")
    void testDownload_SameFilenameDifferentKeys() throws Exception {
        when(keyClient.fetch(anyString())).thenAnswer(inv -> inv.getArgument(0, String.class).getBytes());

        DownloadResult first = downloader.download(file("co/a/report.pdf", null, "report.pdf", null));
        DownloadResult second = downloader.download(file("co/b/report.pdf", null, "report.pdf", null));

        assertEquals(DownloadStatus.SUCCESS, first.status());
        assertEquals(DownloadStatus.SUCCESS, second.status());
        assertNotEquals(first.localPath(), second.localPath());
        assertEquals("co/a/report.pdf", Files.readString(Path.of(first.localPath())));
        assertEquals("co/b/report.pdf", Files.readString(Path.of(second.localPath())));
        assertTrue(first.localPath().endsWith("_report.pdf"));
    }

    @Test
    @DisplayName("Should derive the same path for the same reference")
    void testTargetPath_Stable() {
        DetectedFile file = file("co/a/report.pdf", null, "report.pdf", null);

        assertEquals(downloader.targetPath(file), downloader.targetPath(file));
        assertEquals(downloadDir.resolve("photos").resolve("9"), downloader.targetPath(file).getParent());
    }

    // ============================================================================
    // Pool
    // ============================================================================

    @Test
    @DisplayName("Should download asynchronously on its own pool")
    void testSubmit() throws Exception {
        when(urlClient.fetch(URL)).thenReturn(new byte[]{1});

        DownloadResult result = downloader.submit(file(null, URL, "site.jpg", null)).get(10, TimeUnit.SECONDS);

        assertEquals(DownloadStatus.SUCCESS, result.status());
    }

    @Test
    @DisplayName("Should refuse new work after cancel")
    void testSubmit_AfterCancel() throws Exception {
        downloader.cancel();

        DownloadResult result = downloader.submit(file(null, URL, "site.jpg", null)).get(1, TimeUnit.SECONDS);

        assertEquals(DownloadStatus.SKIPPED, result.status());
        assertEquals("run cancelled", result.reason());
        verifyNoInteractions(urlClient);
    }

    @Test
    @DisplayName("Should keep downloaded paths inside the download root")
    void testTargetPath_Sanitized() {
        DetectedFile hostile = new DetectedFile("../../etc/passwd", null, "photos", "../1", "s3_key", null, "..", null);

        Path target = downloader.targetPath(hostile);

        assertTrue(target.normalize().startsWith(downloadDir));
    }
}
