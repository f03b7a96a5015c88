package org.docweave.extractor.api;

import org.docweave.extractor.grammar.GrammarDescriptor;
import org.docweave.extractor.model.DocumentModel;

import java.nio.charset.Charset;

/**
 * Defines the public interface of the comment extraction engine.
 * <p>
 * Every call scans one file from scratch and returns a new immutable model.
 */
public interface IDocExtractor {

    /**
     * Scans source text with an explicit grammar.
     *
     * @param source The complete source text.
     * @param fileName The file name, used for diagnostics and as the root module's name.
     * @param grammar The grammar of the text.
     * @return The document model, including diagnostics for malformed input.
     */
    DocumentModel extract(String source, String fileName, GrammarDescriptor grammar);

    /**
     * Scans source text with the grammar registered under a language tag.
     *
     * @param source The complete source text.
     * @param fileName The file name.
     * @param languageTag The language tag, e.g. {@code rust}.
     * @return The document model.
     * @throws ExtractionException if no grammar is registered for the tag.
     */
    DocumentModel extract(String source, String fileName, String languageTag) throws ExtractionException;

    /**
     * Scans source text with the grammar claiming the file's extension.
     *
     * @param source The complete source text.
     * @param fileName The file name, e.g. {@code src/lib.rs}.
     * @return The document model.
     * @throws ExtractionException if no grammar claims the extension.
     */
    DocumentModel extract(String source, String fileName) throws ExtractionException;

    /**
     * Decodes and scans file content in a known encoding.
     *
     * @param content The raw bytes of the file.
     * @param charset The encoding of the bytes.
     * @param fileName The file name.
     * @param grammar The grammar of the text.
     * @return The document model.
     */
    default DocumentModel extract(byte[] content, Charset charset, String fileName, GrammarDescriptor grammar) {
        return extract(new String(content, charset), fileName, grammar);
    }
}
