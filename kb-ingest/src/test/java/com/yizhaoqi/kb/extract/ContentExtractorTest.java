package com.yizhaoqi.kb.extract;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.yizhaoqi.kb.config.KnowledgeBaseProperties;
import com.yizhaoqi.kb.entity.ExtractedContent;
import com.yizhaoqi.kb.entity.ExtractionFailureKind;
import com.yizhaoqi.kb.entity.ExtractionOutcome;
import com.yizhaoqi.kb.model.DocumentFileType;
import com.yizhaoqi.kb.model.DocumentSourceType;
import com.yizhaoqi.kb.model.KnowledgeDocument;
import com.yizhaoqi.kb.storage.BlobStorage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;


class ContentExtractorTest {

    @Mock
    private BlobStorage blobStorage;

    @Mock
    private UrlContentFetcher urlContentFetcher;

    private ContentExtractor extractor;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        extractor = new ContentExtractor(blobStorage, new TikaDocumentParser(), new HtmlContentNormalizer(),
                new JsonTextFlattener(new ObjectMapper(), new KnowledgeBaseProperties()), new CsvTextRenderer(),
                urlContentFetcher);
    }

    @Test
    void testExtract_Pdf() throws IOException {
        ExtractionOutcome outcome = extractor.extractFromFile(fixture("sample.pdf"), DocumentFileType.PDF, "sample.pdf");

        assertTrue(outcome.isSuccess());
        ExtractedContent content = outcome.getContent();
        assertTrue(content.getContent().contains("Quarterly revenue grew"));
        assertTrue(content.getContent().contains("Second page text"));
        assertEquals(2, content.metadata("pages"));
        assertEquals("Sample Report", content.metadata("title"));
        assertEquals("Jane Doe", content.metadata("author"));
        assertWordCountMatchesContent(content);
    }

    @Test
    void testExtract_Docx() throws IOException {
        ExtractionOutcome outcome = extractor.extractFromFile(fixture("sample.docx"), DocumentFileType.DOCX, "sample.docx");

        assertTrue(outcome.isSuccess());
        ExtractedContent content = outcome.getContent();
        assertTrue(content.getContent().contains("Employee handbook"));
        assertTrue(content.getContent().contains("Vacation policy applies to everyone"));
        assertEquals(List.of(), content.metadata("warnings"));
        assertEquals(7, content.metadata("wordCount"));
    }

    @Test
    void testExtract_DocUsesContentDetection() throws IOException {
        ExtractionOutcome outcome = extractor.extractFromFile(fixture("sample.docx"), DocumentFileType.DOC, "legacy.doc");

        assertTrue(outcome.isSuccess());
        assertTrue(outcome.getContent().getContent().contains("Employee handbook"));
    }

    @Test
    void testExtract_CorruptPdfFails() {
        byte[] garbage = "%PDF-1.4 this is not really a pdf".getBytes(StandardCharsets.UTF_8);

        ExtractionOutcome outcome = extractor.extractFromFile(garbage, DocumentFileType.PDF, "broken.pdf");

        assertFalse(outcome.isSuccess());
        assertEquals(ExtractionFailureKind.PARSE_FAILED, outcome.getError().kind());
        assertEquals("pdf", outcome.getError().format());
        assertTrue(outcome.getError().message().startsWith("Failed to extract text from PDF"));
    }

    @Test
    void testExtract_MarkdownVerbatim() throws IOException {
        ExtractionOutcome outcome = extractor.extractFromFile(fixture("sample.md"), DocumentFileType.MD, "sample.md");

        assertEquals("# Notes\n\nPlain markdown body.\n", outcome.getContent().getContent());
        assertEquals(5, outcome.getContent().metadata("wordCount"));
        assertEquals(30, outcome.getContent().metadata("characterCount"));
    }

    @Test
    void testExtract_BlankTextHasZeroWords() {
        ExtractionOutcome outcome = extractor.extractFromFile("  \n ".getBytes(StandardCharsets.UTF_8),
                DocumentFileType.TXT, "blank.txt");

        assertTrue(outcome.isSuccess());
        assertEquals(0, outcome.getContent().metadata("wordCount"));
    }

    @Test
    void testExtract_HtmlFixture() throws IOException {
        ExtractionOutcome outcome = extractor.extractFromFile(fixture("sample.html"), DocumentFileType.HTML, "sample.html");

        assertEquals("Product Guide\n\nHow to use the product\n\nGetting started\nInstall the package.",
                outcome.getContent().getContent());
        assertEquals("Product Guide", outcome.getContent().metadata("title"));
        assertNull(outcome.getContent().metadata("source"));
        assertEquals(12, outcome.getContent().metadata("wordCount"));
    }

    @Test
    void testExtract_JsonFixture() throws IOException {
        ExtractionOutcome outcome = extractor.extractFromFile(fixture("sample.json"), DocumentFileType.JSON, "sample.json");

        assertTrue(outcome.getContent().getContent().startsWith("title:\nHandbook\nversion:\n2"));
        assertEquals("json", outcome.getContent().metadata("structure"));
        assertWordCountMatchesContent(outcome.getContent());
    }

    @Test
    void testExtract_CsvFixture() throws IOException {
        ExtractionOutcome outcome = extractor.extractFromFile(fixture("sample.csv"), DocumentFileType.CSV, "sample.csv");

        assertTrue(outcome.getContent().getContent().startsWith("Headers: name, role, city\nname: Alice"));
        assertEquals(3, outcome.getContent().metadata("rowCount"));
        assertEquals(3, outcome.getContent().metadata("columnCount"));
        assertWordCountMatchesContent(outcome.getContent());
    }

    @Test
    void testExtract_FileDocumentReadsFromBlobStorage() throws IOException {
        KnowledgeDocument document = fileDocument("kb/1/notes.txt", DocumentFileType.TXT);
        when(blobStorage.fetchBytes("kb/1/notes.txt")).thenReturn("hello world".getBytes(StandardCharsets.UTF_8));

        ExtractionOutcome outcome = extractor.extract(document);

        assertEquals("hello world", outcome.getContent().getContent());
        assertEquals(2, outcome.getContent().metadata("wordCount"));
    }

    @Test
    void testExtract_MissingBlobIsSourceUnavailable() throws IOException {
        KnowledgeDocument document = fileDocument("kb/1/gone.pdf", DocumentFileType.PDF);
        when(blobStorage.fetchBytes("kb/1/gone.pdf")).thenThrow(new IOException("File not found in storage: kb/1/gone.pdf"));

        ExtractionOutcome outcome = extractor.extract(document);

        assertFalse(outcome.isSuccess());
        assertEquals(ExtractionFailureKind.SOURCE_UNAVAILABLE, outcome.getError().kind());
        assertEquals("File not found in storage: kb/1/gone.pdf", outcome.getError().message());
    }

    @Test
    void testExtract_UrlPdfIsRejected() {
        when(urlContentFetcher.fetch("https://example.com/report.pdf")).thenReturn(
                new UrlContentFetcher.FetchedResource("https://example.com/report.pdf", "application/pdf", new byte[0]));

        ExtractionOutcome outcome = extractor.extractFromUrl("https://example.com/report.pdf");

        assertFalse(outcome.isSuccess());
        assertEquals(ExtractionFailureKind.UNSUPPORTED_CONTENT_TYPE, outcome.getError().kind());
        assertEquals("PDF URLs are not yet supported. Please download and upload the file.", outcome.getError().message());
    }

    @Test
    void testExtract_UrlDocumentUsesSourceUrl() {
        KnowledgeDocument document = new KnowledgeDocument();
        document.setId(9L);
        document.setSourceType(DocumentSourceType.URL);
        document.setSourceUrl("https://example.com/");
        document.setFileType(DocumentFileType.HTML);
        when(urlContentFetcher.fetch("https://example.com/")).thenReturn(new UrlContentFetcher.FetchedResource(
                "https://example.com/", "text/html; charset=utf-8",
                "<title>Home</title><main>Welcome</main>".getBytes(StandardCharsets.UTF_8)));

        ExtractionOutcome outcome = extractor.extract(document);

        assertEquals("Home\n\nWelcome", outcome.getContent().getContent());
        assertEquals("https://example.com/", outcome.getContent().metadata("source"));
        verifyNoInteractions(blobStorage);
    }

    @Test
    void testExtract_WordCountIsWhitespaceTokensForEveryFixture() throws IOException {
        Object[][] fixtures = {
                {"sample.pdf", DocumentFileType.PDF},
                {"sample.docx", DocumentFileType.DOCX},
                {"sample.md", DocumentFileType.MD},
                {"sample.html", DocumentFileType.HTML},
                {"sample.json", DocumentFileType.JSON},
                {"sample.csv", DocumentFileType.CSV},
        };
        for (Object[] fixture : fixtures) {
            String name = (String) fixture[0];
            ExtractionOutcome outcome = extractor.extractFromFile(fixture(name), (DocumentFileType) fixture[1], name);

            assertTrue(outcome.isSuccess(), name);
            assertWordCountMatchesContent(outcome.getContent());
            assertEquals(outcome.getContent().getContent().length(), outcome.getContent().metadata("characterCount"), name);
        }
    }

    private static void assertWordCountMatchesContent(ExtractedContent content) {
        String trimmed = content.getContent().trim();
        int expected = trimmed.isEmpty() ? 0 : trimmed.split("\\s+").length;
        assertEquals(expected, content.metadata("wordCount"));
    }

    private KnowledgeDocument fileDocument(String path, DocumentFileType type) {
        KnowledgeDocument document = new KnowledgeDocument();
        document.setId(1L);
        document.setName(path.substring(path.lastIndexOf('/') + 1));
        document.setSourceType(DocumentSourceType.FILE);
        document.setFilePath(path);
        document.setFileType(type);
        return document;
    }

    private byte[] fixture(String name) throws IOException {
        try (InputStream in = getClass().getResourceAsStream("/fixtures/" + name)) {
            assertNotNull(in, "missing fixture " + name);
            return in.readAllBytes();
        }
    }
}
