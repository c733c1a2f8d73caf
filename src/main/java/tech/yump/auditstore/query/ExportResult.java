package tech.yump.auditstore.query;

/**
 * An export ready to be handed to a download response.
 *
 * @param content     the exported document
 * @param contentType MIME type of {@code content}
 * @param filename    suggested file name, stamped with the export time
 */
public record ExportResult(String content, String contentType, String filename) {
}
