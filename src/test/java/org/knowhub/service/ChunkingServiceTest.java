package org.knowhub.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.knowhub.DTO.Chunk;
import org.knowhub.DTO.StructuralTag;
import org.knowhub.config.RagProperties;
import org.knowhub.entity.SourceType;
import org.knowhub.exception.DocumentParseException;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ChunkingServiceTest {

    private RagProperties ragProperties;
    private ChunkingService chunkingService;

    @BeforeEach
    void setUp() {
        ragProperties = new RagProperties();
        chunkingService = new ChunkingService(ragProperties);
    }

    @Test
    void threeParagraphsWithTwoHundredCharBudgetGiveThreeChunks() {
        ragProperties.getChunking().setMaxChars(200);
        ragProperties.getChunking().setOverlap(20);
        String text = paragraph("alpha") + "\n\n" + paragraph("bravo") + "\n\n" + paragraph("charlie");

        List<Chunk> chunks = chunkingService.chunk("doc-a", text, SourceType.MARKDOWN);

        assertThat(chunks).hasSize(3);
        assertThat(chunks).extracting(Chunk::getSequenceIndex).containsExactly(0, 1, 2);
        assertThat(chunks.get(0).getText()).startsWith("alpha");
        assertThat(chunks.get(1).getText()).startsWith("bravo");
        assertThat(chunks.get(2).getText()).startsWith("charlie");
        assertThat(chunks).allSatisfy(c -> assertThat(c.getText().length()).isLessThanOrEqualTo(200));
    }

    @Test
    void chunksReconstructOriginalText() {
        String text = "\n\n# Guide\n\nIntro line one.\nIntro line two.\n\n"
                + "| col | val |\n| --- | --- |\n| a | 1 |\n\n"
                + "```bash\nterraform init\n\nterraform apply\n```\n\n"
                + "## Next\nClosing remarks without a trailing newline";
        ragProperties.getChunking().setMaxChars(60);
        ragProperties.getChunking().setOverlap(10);

        List<Chunk> chunks = chunkingService.chunk("doc-b", text, SourceType.MARKDOWN);

        StringBuilder rebuilt = new StringBuilder();
        int expectedStart = 0;
        for (Chunk chunk : chunks) {
            assertThat(chunk.getStartOffset()).isEqualTo(expectedStart);
            assertThat(text.substring(chunk.getStartOffset(), chunk.getEndOffset())).isEqualTo(chunk.getText());
            rebuilt.append(chunk.getText());
            expectedStart = chunk.getEndOffset();
        }
        assertThat(rebuilt.toString()).isEqualTo(text);
    }

    @Test
    void headingStartsNewChunkAndTakesBodyTag() {
        String text = "# Title\nintro text\n\n## Setup\nInstall things.\n";

        List<Chunk> chunks = chunkingService.chunk("doc-c", text, SourceType.MARKDOWN);

        assertThat(chunks).hasSize(2);
        assertThat(chunks.get(0).getText()).isEqualTo("# Title\nintro text\n\n");
        assertThat(chunks.get(1).getText()).isEqualTo("## Setup\nInstall things.\n");
        assertThat(chunks).extracting(Chunk::getTag).containsOnly(StructuralTag.BODY);
    }

    @Test
    void fencedCodeBlockIsKeptWhole() {
        ragProperties.getChunking().setMaxChars(40);
        ragProperties.getChunking().setOverlap(5);
        String code = "```\ncode line one\n\ncode line two\n```\n";
        String text = "Intro paragraph here.\n\n" + code;

        List<Chunk> chunks = chunkingService.chunk("doc-d", text, SourceType.MARKDOWN);

        assertThat(chunks).hasSize(2);
        assertThat(chunks.get(1).getText()).isEqualTo(code);
        assertThat(chunks.get(1).getTag()).isEqualTo(StructuralTag.CODE);
    }

    @Test
    void plainTextIgnoresMarkdownSyntax() {
        List<Chunk> chunks = chunkingService.chunk("doc-e", "# not a heading\nbody\n", SourceType.TEXT);

        assertThat(chunks).hasSize(1);
        assertThat(chunks.get(0).getTag()).isEqualTo(StructuralTag.BODY);
    }

    @Test
    void longSentenceIsSplitWithinBudget() {
        ragProperties.getChunking().setMaxChars(100);
        ragProperties.getChunking().setOverlap(10);
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < 60; i++) {
            sb.append("word").append(i).append(' ');
        }
        String text = sb.toString().trim();

        List<Chunk> chunks = chunkingService.chunk("doc-f", text, SourceType.TEXT);

        assertThat(chunks.size()).isGreaterThan(1);
        assertThat(chunks).allSatisfy(c -> {
            assertThat(c.getText().length()).isLessThanOrEqualTo(100);
            assertThat(text.substring(c.getStartOffset(), c.getEndOffset())).isEqualTo(c.getText());
        });
        assertThat(chunks.get(0).getStartOffset()).isZero();
        assertThat(chunks.get(chunks.size() - 1).getEndOffset()).isEqualTo(text.length());
    }

    @Test
    void unbreakableTokenFallsBackToOverlappingWindows() {
        ragProperties.getChunking().setMaxChars(100);
        ragProperties.getChunking().setOverlap(20);
        String text = "x".repeat(250);

        List<Chunk> chunks = chunkingService.chunk("doc-g", text, SourceType.TEXT);

        assertThat(chunks.size()).isGreaterThan(2);
        assertThat(chunks.get(0).getStartOffset()).isZero();
        assertThat(chunks.get(chunks.size() - 1).getEndOffset()).isEqualTo(250);
        for (int i = 1; i < chunks.size(); i++) {
            // 相邻分块之间没有空洞
            assertThat(chunks.get(i).getStartOffset()).isLessThanOrEqualTo(chunks.get(i - 1).getEndOffset());
            assertThat(chunks.get(i).getText().length()).isLessThanOrEqualTo(100);
        }
    }

    @Test
    void whitespaceBetweenOversizedWordsIsNotAChunkOfItsOwn() {
        ragProperties.getChunking().setMaxChars(10);
        ragProperties.getChunking().setOverlap(2);
        String text = "aaaaaaaaaa bbbbbbbbbb";

        List<Chunk> chunks = chunkingService.chunk("doc-k", text, SourceType.TEXT);

        assertThat(chunks).noneMatch(c -> c.getText().isBlank());
        assertThat(chunks.get(0).getText()).startsWith("aaaaaaaaaa");
        assertThat(chunks.get(0).getStartOffset()).isZero();
        assertThat(chunks.get(chunks.size() - 1).getEndOffset()).isEqualTo(text.length());
        for (int i = 1; i < chunks.size(); i++) {
            assertThat(chunks.get(i).getStartOffset()).isLessThanOrEqualTo(chunks.get(i - 1).getEndOffset());
        }
        assertThat(chunks).allSatisfy(c ->
                assertThat(text.substring(c.getStartOffset(), c.getEndOffset())).isEqualTo(c.getText()));
    }

    @Test
    void leadingWhitespaceJoinsFirstChunk() {
        ragProperties.getChunking().setMaxChars(10);
        ragProperties.getChunking().setOverlap(2);
        String text = "           aaaaaaaaaa";

        List<Chunk> chunks = chunkingService.chunk("doc-l", text, SourceType.TEXT);

        assertThat(chunks).noneMatch(c -> c.getText().isBlank());
        assertThat(chunks.get(0).getStartOffset()).isZero();
        assertThat(chunks.get(chunks.size() - 1).getEndOffset()).isEqualTo(text.length());
    }

    @Test
    void sameInputGivesSameChunks() {
        String text = "# A\nfirst.\n\n# B\nsecond.\n";

        List<Chunk> first = chunkingService.chunk("doc-h", text, SourceType.MARKDOWN);
        List<Chunk> second = chunkingService.chunk("doc-h", text, SourceType.MARKDOWN);

        assertThat(second).usingRecursiveFieldByFieldElementComparator().isEqualTo(first);
    }

    @Test
    void blankTextIsRejected() {
        assertThatThrownBy(() -> chunkingService.chunk("doc-i", "  \n\n ", SourceType.TEXT))
                .isInstanceOf(DocumentParseException.class);
    }

    @Test
    void overlapMustBeSmallerThanBudget() {
        ragProperties.getChunking().setMaxChars(50);
        ragProperties.getChunking().setOverlap(50);

        assertThatThrownBy(() -> chunkingService.chunk("doc-j", "some text", SourceType.TEXT))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static String paragraph(String word) {
        StringBuilder sb = new StringBuilder();
        while (sb.length() < 198) {
            sb.append(word).append(" lorem ipsum dolor ");
        }
        return sb.substring(0, 198);
    }
}
