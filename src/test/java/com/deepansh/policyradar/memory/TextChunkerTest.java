package com.deepansh.policyradar.memory;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class TextChunkerTest {

    @Test
    void chunk_2500Chars_producesThreeOverlappingWindows() {
        String text = "a".repeat(2500);

        List<TextChunker.Chunk> chunks = TextChunker.chunk(text, 1200, 200, 500);

        assertThat(chunks).hasSize(3);
        assertThat(chunks).extracting(TextChunker.Chunk::offset).containsExactly(0, 1000, 2000);
        assertThat(chunks).extracting(TextChunker.Chunk::index).containsExactly(0, 1, 2);
        assertThat(chunks.get(0).text()).hasSize(1200);
        assertThat(chunks.get(2).text()).hasSize(500);
    }

    @Test
    void chunk_textShorterThanWindow_returnsSingleChunk() {
        List<TextChunker.Chunk> chunks = TextChunker.chunk("short text", 1200, 200, 500);

        assertThat(chunks).singleElement().satisfies(c -> assertThat(c.text()).isEqualTo("short text"));
    }

    @Test
    void chunk_tinyChunkSize_isRaisedToMinimum() {
        List<TextChunker.Chunk> chunks = TextChunker.chunk("b".repeat(450), 10, 0, 500);

        assertThat(chunks).extracting(c -> c.text().length()).containsExactly(200, 200, 50);
    }

    @Test
    void chunk_overlapAboveHalf_isClampedToHalfTheWindow() {
        List<TextChunker.Chunk> chunks = TextChunker.chunk("c".repeat(800), 400, 1000, 500);

        assertThat(chunks).extracting(TextChunker.Chunk::offset).containsExactly(0, 200, 400);
    }

    @Test
    void chunk_capReached_dropsTheRest() {
        List<TextChunker.Chunk> chunks = TextChunker.chunk("d".repeat(10_000), 1200, 200, 2);

        assertThat(chunks).hasSize(2);
    }

    @Test
    void chunk_emptyText_returnsNothing() {
        assertThat(TextChunker.chunk("", 1200, 200, 500)).isEmpty();
        assertThat(TextChunker.chunk(null, 1200, 200, 500)).isEmpty();
    }

    @Test
    void normalize_collapsesWhitespaceAndBlankLines() {
        String raw = "  Title\r\n\r\n\r\n\r\nBody\t\twith   gaps  \n";

        assertThat(TextChunker.normalize(raw)).isEqualTo("Title\n\nBody with gaps");
    }
}
