package org.docweave.extractor;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.docweave.extractor.api.ExtractionException;
import org.docweave.extractor.api.IDocExtractor;
import org.docweave.extractor.config.ExtractorOptions;
import org.docweave.extractor.diagnostics.DiagnosticsEngine;
import org.docweave.extractor.frontend.association.Associator;
import org.docweave.extractor.frontend.builder.DocumentModelBuilder;
import org.docweave.extractor.frontend.classifier.CommentClassifier;
import org.docweave.extractor.frontend.classifier.CommentDraft;
import org.docweave.extractor.frontend.lexer.Lexer;
import org.docweave.extractor.frontend.lexer.Token;
import org.docweave.extractor.frontend.parser.EntityParser;
import org.docweave.extractor.frontend.parser.ParsedSkeleton;
import org.docweave.extractor.frontend.tagging.AnnotationTagger;
import org.docweave.extractor.frontend.tagging.DocTagExtractor;
import org.docweave.extractor.grammar.GrammarDescriptor;
import org.docweave.extractor.grammar.GrammarRegistry;
import org.docweave.extractor.model.DocumentModel;
import org.docweave.extractor.model.LineIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * The main extraction engine. This class orchestrates the pipeline from source text to a
 * {@link DocumentModel}: lexing, comment classification, entity parsing, association, tagging
 * and model assembly.
 * <p>
 * An instance holds only immutable configuration; every scan creates its own state, so one
 * instance may scan many files concurrently.
 */
public class DocExtractor implements IDocExtractor {

    private static final Logger LOG = LoggerFactory.getLogger(DocExtractor.class);

    private final GrammarRegistry grammars;
    private final ExtractorOptions options;

    /**
     * Creates an engine from the default configuration ({@code application.conf} over {@code reference.conf}).
     */
    public DocExtractor() {
        this(ConfigFactory.load());
    }

    /**
     * Creates an engine from a resolved configuration.
     * @param config The configuration holding the {@code docweave} block.
     */
    public DocExtractor(Config config) {
        this(GrammarRegistry.fromConfig(config), ExtractorOptions.fromConfig(config));
    }

    /**
     * Creates an engine from explicit parts.
     * @param grammars The grammars available by tag or extension.
     * @param options The engine options.
     */
    public DocExtractor(GrammarRegistry grammars, ExtractorOptions options) {
        this.grammars = grammars;
        this.options = options;
    }

    @Override
    public DocumentModel extract(String source, String fileName, GrammarDescriptor grammar) {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        // Phase 1: Lexical Analysis
        Lexer lexer = new Lexer(source, grammar, diagnostics, fileName);
        List<Token> tokens = lexer.scanTokens();
        LOG.debug("{}: {} tokens", fileName, tokens.size());

        // Phase 2: Comment Classification
        CommentClassifier classifier = new CommentClassifier(grammar);
        List<CommentDraft> comments = classifier.collect(tokens);
        LOG.debug("{}: {} comments", fileName, comments.size());

        // Phase 3: Entity Parsing
        EntityParser parser = new EntityParser(source, grammar, diagnostics, fileName);
        ParsedSkeleton skeleton = parser.parse(tokens);

        // Phase 4: Association
        new Associator(source, grammar).associate(comments, skeleton);

        // Phase 5: Tagging
        AnnotationTagger tagger = new AnnotationTagger(classifier.commentText(), options.customTags(), new LineIndex(source));
        int annotations = 0;
        for (CommentDraft comment : comments) {
            annotations += tagger.tag(comment);
            if (comment.kind().isDoc() || comment.ownerId() != CommentDraft.NO_ENTITY) {
                comment.docTags().addAll(DocTagExtractor.extract(comment.text()));
            }
        }
        LOG.debug("{}: {} annotations", fileName, annotations);

        // Phase 6: Model Assembly
        DocumentModel model = new DocumentModelBuilder(fileName, grammar.name())
                .build(skeleton.root(), comments, tokens, diagnostics.getDiagnostics());
        if (!model.diagnostics().isEmpty()) {
            LOG.warn("{} diagnostic(s) while scanning {}:\n{}", model.diagnostics().size(), fileName, diagnostics.summary());
        }
        return model;
    }

    @Override
    public DocumentModel extract(String source, String fileName, String languageTag) throws ExtractionException {
        GrammarDescriptor grammar = grammars.find(languageTag)
                .orElseThrow(() -> new ExtractionException("Unknown language '" + languageTag
                        + "'; known languages: " + grammars.names()));
        return extract(source, fileName, grammar);
    }

    @Override
    public DocumentModel extract(String source, String fileName) throws ExtractionException {
        GrammarDescriptor grammar = grammars.forFileName(fileName)
                .orElseThrow(() -> new ExtractionException("No grammar registered for file '" + fileName + "'"));
        return extract(source, fileName, grammar);
    }

    /**
     * @return The grammars this engine selects from.
     */
    public GrammarRegistry grammars() {
        return grammars;
    }

    /**
     * @return The engine options.
     */
    public ExtractorOptions options() {
        return options;
    }
}
