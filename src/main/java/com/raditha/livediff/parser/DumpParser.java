package com.raditha.livediff.parser;

import com.raditha.livediff.model.BlockState;
import com.raditha.livediff.model.DumpModel;
import com.raditha.livediff.model.Section;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Recovers a {@link DumpModel} from the text of a register allocator dump.
 * <p>
 * Best effort: lines that are not headers, block summaries or section-end markers are skipped,
 * and block summaries outside a section are ignored. Only I/O failures escape.
 * <p>
 * Key collisions follow two different rules:
 * <ul>
 *   <li>a function header seen again keeps the first header line and annotation, and later
 *       blocks are added to the existing section;</li>
 *   <li>a block id seen again in the same section replaces the earlier block.</li>
 * </ul>
 */
public class DumpParser {

    private static final Logger logger = LoggerFactory.getLogger(DumpParser.class);

    private final LineClassifier classifier;
    private final BlockBodyDecoder decoder;

    public DumpParser() {
        this(new LineClassifier(), new BlockBodyDecoder());
    }

    public DumpParser(LineClassifier classifier, BlockBodyDecoder decoder) {
        this.classifier = classifier;
        this.decoder = decoder;
    }

    /**
     * Parse a dump file. Undecodable bytes are replaced rather than rejected.
     *
     * @param path  the dump file
     * @param label file label stored in the model
     * @throws IOException when the file cannot be opened or read
     */
    public DumpModel parse(Path path, String label) throws IOException {
        CharsetDecoder charsetDecoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPLACE)
                .onUnmappableCharacter(CodingErrorAction.REPLACE);
        try (Reader reader = new InputStreamReader(Files.newInputStream(path), charsetDecoder)) {
            DumpModel model = parse(reader, label);
            logger.debug("Parsed {}: {} functions, {} blocks", path, model.sections().size(), model.blockCount());
            return model;
        }
    }

    /**
     * Parse dump text held in memory.
     */
    public DumpModel parse(String text, String label) {
        try {
            return parse(new StringReader(text), label);
        } catch (IOException e) {
            // StringReader does not fail
            throw new IllegalStateException(e);
        }
    }

    /**
     * Parse from a reader. The caller owns (and closes) the reader.
     */
    public DumpModel parse(Reader reader, String label) throws IOException {
        SectionAccumulator sections = new SectionAccumulator();
        ParserState state = ParserState.IDLE;
        int skipped = 0;
        int orphanBlocks = 0;

        BufferedReader lines = reader instanceof BufferedReader br ? br : new BufferedReader(reader);
        String line;
        while ((line = lines.readLine()) != null) {
            DumpLine classified = classifier.classify(line);

            if (classified instanceof DumpLine.SectionHeader header) {
                sections.openSectionFirstWins(header);
            } else if (classified instanceof DumpLine.BlockSummary block) {
                if (state.isIdle()) {
                    orphanBlocks++;
                } else {
                    sections.putBlockLastWins(state.currentFunction(), block.blockId(),
                            decoder.decodeBlock(block.body()));
                }
            } else if (classified instanceof DumpLine.Unrecognized) {
                skipped++;
            }
            state = state.next(classified);
        }

        logger.debug("Skipped {} unrecognized lines and {} block lines outside a section", skipped, orphanBlocks);
        return sections.build(label);
    }

    /**
     * Mutable collection state for one parse. Never escapes {@link #parse(Reader, String)}.
     */
    private static final class SectionAccumulator {
        private final Map<String, SectionDraft> drafts = new LinkedHashMap<>();

        /**
         * Registers a header. The first header for a function fixes its header line and
         * annotation; later ones reopen the section, and only fill in the annotation when
         * the first header had none.
         */
        void openSectionFirstWins(DumpLine.SectionHeader header) {
            SectionDraft draft = drafts.computeIfAbsent(header.functionName(),
                    name -> new SectionDraft(header.description(), header.text()));
            if (draft.description == null && header.description() != null) {
                draft.description = header.description();
            }
        }

        /**
         * Stores a block, replacing any earlier block with the same id.
         */
        void putBlockLastWins(String functionName, int blockId, BlockState block) {
            drafts.get(functionName).blocks.put(blockId, block);
        }

        DumpModel build(String label) {
            Map<String, Section> sections = new HashMap<>();
            drafts.forEach((name, draft) ->
                    sections.put(name, new Section(draft.description, draft.headerText, draft.blocks)));
            return new DumpModel(label, sections);
        }
    }

    private static final class SectionDraft {
        private String description;
        private final String headerText;
        private final Map<Integer, BlockState> blocks = new HashMap<>();

        SectionDraft(String description, String headerText) {
            this.description = description;
            this.headerText = headerText;
        }
    }
}
