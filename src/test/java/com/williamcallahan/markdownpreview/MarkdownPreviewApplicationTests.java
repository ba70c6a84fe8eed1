package com.williamcallahan.markdownpreview;

import com.williamcallahan.markdownpreview.domain.markdown.TextDocument;
import com.williamcallahan.markdownpreview.service.markdown.MarkdownEngine;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.net.URI;

import static org.junit.jupiter.api.Assertions.assertTrue;

@SpringBootTest(properties = {
        "markdown.preview.workspace-roots=file:///ws",
        "markdown.preview.external-schemes=vscode"
})
class MarkdownPreviewApplicationTests {

    @Autowired
    private MarkdownEngine markdownEngine;

    @Test
    void contextLoads() {
        String html = markdownEngine.render(new TextDocument(URI.create("file:///ws/docs/a.md"), 1, "# Hello\n\n[root](/b.md)\n"));

        assertTrue(html.contains("id=\"hello\""));
        assertTrue(html.contains("href=\"file:///ws/b.md\""));
    }

}
