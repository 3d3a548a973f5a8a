package im.arun.epubparser.service;

import im.arun.epubparser.model.Manifest;
import im.arun.epubparser.model.Metadata;
import im.arun.epubparser.model.Spine;
import im.arun.epubparser.model.TableOfContents;

import java.nio.file.Path;

/**
 * Receives parse lifecycle events from {@link EpubParserService}.
 * Callbacks run synchronously on the parsing thread, in declaration order.
 * Every method defaults to doing nothing.
 */
public interface EpubParserListener {

    default void parsingStarted(Path archive) {
    }

    default void archiveExtracted(Path directory) {
    }

    default void metadataParsed(Metadata metadata) {
    }

    default void manifestParsed(Manifest manifest) {
    }

    default void spineParsed(Spine spine) {
    }

    default void tableOfContentsParsed(TableOfContents tableOfContents) {
    }

    default void parsingFinished(Path archive) {
    }

    /**
     * Called once before the failure is rethrown to the caller.
     */
    default void parsingFailed(Path archive, Exception error) {
    }
}
