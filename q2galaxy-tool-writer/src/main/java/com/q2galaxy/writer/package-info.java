/**
 * Galaxy tool XML output.
 * <ul>
 *   <li>{@link com.q2galaxy.writer.ToolDocumentAssembler} – canonical order, root attributes, comments, indented XML bytes</li>
 *   <li>{@link com.q2galaxy.writer.ToolWriter} – writes the bytes to a file or {@link com.q2galaxy.writer.ToolSink}</li>
 *   <li>{@link com.q2galaxy.writer.ToolMetadata} / {@link com.q2galaxy.writer.CopyrightNotice} – stamped metadata</li>
 * </ul>
 */
package com.q2galaxy.writer;
