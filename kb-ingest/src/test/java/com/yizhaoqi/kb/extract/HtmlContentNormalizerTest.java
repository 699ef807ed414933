package com.yizhaoqi.kb.extract;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;


class HtmlContentNormalizerTest {

    private final HtmlContentNormalizer normalizer = new HtmlContentNormalizer();

    @Test
    void testNormalize_MainWinsOverArticle() {
        String html = "<html><head><title>Guide</title></head><body>"
                + "<article>Article text</article><main>Main text</main></body></html>";

        HtmlContentNormalizer.NormalizedPage page = normalizer.normalize(html);

        assertEquals("Guide\n\nMain text", page.text());
    }

    @Test
    void testNormalize_SelectorPriority() {
        String html = "<body><div id=\"content\">By id</div><div class=\"content\">By class</div>"
                + "<div role=\"main\">By role</div></body>";

        assertEquals("By role", normalizer.normalize(html).text());
    }

    @Test
    void testNormalize_FallsBackToBody() {
        String html = "<html><body><div>Just a body</div><p>and a paragraph</p></body></html>";

        String text = normalizer.normalize(html).text();

        assertTrue(text.contains("Just a body"));
        assertTrue(text.contains("and a paragraph"));
    }

    @Test
    void testNormalize_EmptyMainFallsBackToBody() {
        String html = "<body><main>   </main><div>Body content</div></body>";

        assertEquals("Body content", normalizer.normalize(html).text());
    }

    @Test
    void testNormalize_StripsScriptStyleNoscript() {
        String html = "<html><head><style>.x{}</style><script>alert(1)</script></head>"
                + "<body><main>Visible<noscript>Enable JS</noscript><script>var a;</script></main></body></html>";

        HtmlContentNormalizer.NormalizedPage page = normalizer.normalize(html);

        assertEquals("Visible", page.text());
    }

    @Test
    void testNormalize_TitleAndDescriptionMetadata() {
        String html = "<html><head><title> My Page </title>"
                + "<meta name=\"description\" content=\"A short summary\"></head>"
                + "<body><main>Body</main></body></html>";

        HtmlContentNormalizer.NormalizedPage page = normalizer.normalize(html);

        assertEquals("My Page\n\nA short summary\n\nBody", page.text());
        assertEquals("My Page", page.metadata().get("title"));
        assertEquals("A short summary", page.metadata().get("description"));
    }

    @Test
    void testNormalize_EmptyPartsOmitted() {
        HtmlContentNormalizer.NormalizedPage page = normalizer.normalize("<body><main>Only body</main></body>");

        assertEquals("Only body", page.text());
        assertEquals("", page.metadata().get("title"));
        assertEquals("", page.metadata().get("description"));
    }

    @Test
    void testCollapseWhitespace() {
        assertEquals("a b\nc", HtmlContentNormalizer.collapseWhitespace("  a \t  b \n\n \n  c  "));
    }
}
