package br.edu.ifba.kgrag.retrieval;

import br.edu.ifba.kgrag.core.Chunk;
import br.edu.ifba.kgrag.utils.IdentityUtil;
import br.edu.ifba.kgrag.utils.TokenUtil;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Splits document text into overlapping chunks sized for mixed CJK/Latin text.
 */
public final class TextChunker {

    private static final Logger logger = LoggerFactory.getLogger(TextChunker.class);

    public static final int DEFAULT_CHUNK_SIZE = 800;
    public static final int DEFAULT_OVERLAP = 120;

    /** How far back from the window end a sentence boundary is searched for. */
    static final int BOUNDARY_LOOKBACK = 50;

    private static final String SENTENCE_TERMINATORS = "。！？\n.!?";

    private final int chunkSize;
    private final int overlap;

    public TextChunker() {
        this(DEFAULT_CHUNK_SIZE, DEFAULT_OVERLAP);
    }

    public TextChunker(int chunkSize, int overlap) {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("Chunk size must be a positive integer.");
        }
        if (overlap < 0 || overlap >= chunkSize) {
            throw new IllegalArgumentException(String.format(
                "Chunk overlap must be in [0, %d), got %d", chunkSize, overlap));
        }
        this.chunkSize = chunkSize;
        this.overlap = overlap;
    }

    /**
     * Chunks a document.
     *
     * <p>Each window of {@code chunkSize} characters is cut short at the last
     * sentence terminator found within the final {@value #BOUNDARY_LOOKBACK}
     * characters, but never before the window's half-way point. Blank windows
     * are skipped without consuming a chunk index.</p>
     *
     * @param text     document text
     * @param docId    document id
     * @param metadata document metadata copied onto every chunk, may be null
     * @return chunks in document order
     */
    @NotNull
    public List<Chunk> chunk(@Nullable String text, @NotNull String docId, @Nullable Map<String, Object> metadata) {
        List<Chunk> chunks = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return chunks;
        }

        int length = text.length();
        int start = 0;
        int index = 0;
        while (start < length) {
            int end = Math.min(start + chunkSize, length);
            if (end < length) {
                end = snapToBoundary(text, start, end);
            }

            String piece = text.substring(start, end).strip();
            if (!piece.isEmpty()) {
                Map<String, Object> meta = new LinkedHashMap<>();
                if (metadata != null) {
                    meta.putAll(metadata);
                }
                meta.put("chunk_index", index);
                meta.put("start_char", start);
                meta.put("end_char", end);
                meta.put("token_count", TokenUtil.countTokens(piece));

                chunks.add(new Chunk(chunkId(docId, index, piece), docId, piece, start, end, null, meta));
                index++;
            }

            if (end >= length) {
                break;
            }
            start = Math.max(start + 1, end - overlap);
        }

        logger.info("Chunked document {} into {} chunks", docId, chunks.size());
        return chunks;
    }

    /**
     * {@code <docId>_chunk_<0000>_<md5[:8]>}.
     */
    @NotNull
    public static String chunkId(@NotNull String docId, int index, @NotNull String text) {
        return String.format("%s_chunk_%04d_%s", docId, index, IdentityUtil.md5Hex(text).substring(0, 8));
    }

    private int snapToBoundary(String text, int start, int end) {
        int floor = Math.max(start + chunkSize / 2, end - BOUNDARY_LOOKBACK);
        for (int i = end - 1; i > floor; i--) {
            if (SENTENCE_TERMINATORS.indexOf(text.charAt(i)) >= 0) {
                return i + 1;
            }
        }
        return end;
    }

    public int getChunkSize() {
        return chunkSize;
    }

    public int getOverlap() {
        return overlap;
    }
}
